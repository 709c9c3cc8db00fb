package com.confluenceplatform.symbol.config;

import com.confluenceplatform.common.confluence.ConfluenceWeights;
import com.confluenceplatform.common.level.LevelMerger;
import com.confluenceplatform.common.level.MergeConfidencePolicy;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.staleness.StalenessEvaluator;
import com.confluenceplatform.common.staleness.StalenessPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables of the confluence engine, bound from the {@code confluence.*} namespace.
 *
 * <pre>
 * confluence:
 *   level:
 *     merge-tolerance: 0.015
 *     low-confidence-floor: 0.5
 *     merge-confidence-policy: MAX
 *   staleness:
 *     default-threshold: { soft: 48h, hard: 14d }
 *     sources:
 *       "[kt_technical]": { soft: 7d, hard: 21d }
 *   scoring:
 *     bias-agreement-weight: 0.75
 *     ...
 * </pre>
 * Sources missing from {@code staleness.sources} keep their built-in cadence defaults.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "confluence")
public class ConfluenceProperties {

    private Level level = new Level();
    private StalenessSettings staleness = new StalenessSettings();
    private Scoring scoring = new Scoring();

    @Getter
    @Setter
    public static class Level {
        private double mergeTolerance = LevelMerger.DEFAULT_TOLERANCE;
        private double lowConfidenceFloor = LevelMerger.DEFAULT_LOW_CONFIDENCE_FLOOR;
        private MergeConfidencePolicy mergeConfidencePolicy = MergeConfidencePolicy.MAX;
    }

    @Getter
    @Setter
    public static class StalenessSettings {
        private Threshold defaultThreshold = new Threshold(Duration.ofHours(48), Duration.ofDays(14));
        /** Keyed by source wire id ({@code kt_technical}, {@code discord}, ...). */
        private Map<String, Threshold> sources = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Threshold {
        private Duration soft;
        private Duration hard;

        public Threshold() {}

        public Threshold(Duration soft, Duration hard) {
            this.soft = soft;
            this.hard = hard;
        }
    }

    @Getter
    @Setter
    public static class Scoring {
        private double biasAgreementWeight = 0.75;
        private double proximityWeight = 0.25;
        private double recencyPenalty = 0.30;
        private double singleSourceCap = 0.39;
        private double highThreshold = 0.70;
        private double mediumThreshold = 0.40;
        private double lowThreshold = 0.15;
    }

    // ── factories for the pure engine components ──────────────────────────

    public LevelMerger toLevelMerger() {
        return new LevelMerger(level.mergeTolerance, level.lowConfidenceFloor, level.mergeConfidencePolicy);
    }

    public ConfluenceWeights toWeights() {
        return new ConfluenceWeights(scoring.biasAgreementWeight, scoring.proximityWeight,
                                     scoring.recencyPenalty, scoring.singleSourceCap,
                                     scoring.highThreshold, scoring.mediumThreshold, scoring.lowThreshold);
    }

    /**
     * Built-in per-source thresholds overlaid with configured ones.
     *
     * @throws IllegalStateException when a configured key is not a known source
     */
    public StalenessEvaluator toStalenessEvaluator() {
        StalenessEvaluator builtIn = StalenessEvaluator.defaults();
        Map<SignalSource, StalenessPolicy> policies = new EnumMap<>(SignalSource.class);
        for (SignalSource source : SignalSource.values()) {
            policies.put(source, builtIn.policyFor(source));
        }
        staleness.sources.forEach((key, threshold) -> {
            SignalSource source = resolveSource(key);
            if (source == null) {
                throw new IllegalStateException("Unknown source in confluence.staleness.sources: " + key);
            }
            StalenessPolicy current = policies.get(source);
            policies.put(source, StalenessPolicy.of(
                threshold.soft != null ? threshold.soft : current.soft(),
                threshold.hard != null ? threshold.hard : current.hard()));
        });
        Threshold fallback = staleness.defaultThreshold;
        return new StalenessEvaluator(policies, StalenessPolicy.of(fallback.soft, fallback.hard));
    }

    /** Map keys lose their underscore unless bracketed in YAML; accept both spellings. */
    static SignalSource resolveSource(String key) {
        SignalSource exact = SignalSource.fromId(key);
        if (exact != null) return exact;
        String compact = key.replaceAll("[^A-Za-z0-9]", "").toLowerCase();
        for (SignalSource source : SignalSource.values()) {
            if (source.id().replace("_", "").equals(compact)) return source;
        }
        return null;
    }
}
