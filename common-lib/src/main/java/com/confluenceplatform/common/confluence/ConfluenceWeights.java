package com.confluenceplatform.common.confluence;

import com.confluenceplatform.common.model.ConfluenceClassification;

/**
 * Tunable constants of the confluence score.
 *
 * <pre>
 *   score = clip((biasAgreementWeight · agreement + proximityWeight · proximity)
 *                · (1 − recencyPenalty · staleFraction), 0, 1)
 *
 *   score ≥ highThreshold   → HIGH
 *   score ≥ mediumThreshold → MEDIUM
 *   score ≥ lowThreshold    → LOW
 *   otherwise               → NONE
 * </pre>
 * A lone source scores {@code min(confidence, singleSourceCap)} and is always NONE.
 */
public record ConfluenceWeights(
    double biasAgreementWeight,
    double proximityWeight,
    double recencyPenalty,
    double singleSourceCap,
    double highThreshold,
    double mediumThreshold,
    double lowThreshold
) {
    public ConfluenceWeights {
        if (!(lowThreshold <= mediumThreshold && mediumThreshold <= highThreshold)) {
            throw new IllegalArgumentException("thresholds must satisfy low <= medium <= high");
        }
        if (recencyPenalty < 0.0 || recencyPenalty > 1.0) {
            throw new IllegalArgumentException("recencyPenalty must be in [0,1]: " + recencyPenalty);
        }
    }

    public static ConfluenceWeights defaults() {
        return new ConfluenceWeights(0.75, 0.25, 0.30, 0.39, 0.70, 0.40, 0.15);
    }

    public ConfluenceClassification classify(double score) {
        if (score >= highThreshold)   return ConfluenceClassification.HIGH;
        if (score >= mediumThreshold) return ConfluenceClassification.MEDIUM;
        if (score >= lowThreshold)    return ConfluenceClassification.LOW;
        return ConfluenceClassification.NONE;
    }
}
