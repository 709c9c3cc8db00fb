package com.confluenceplatform.common.confluence;

import com.confluenceplatform.common.level.LevelMerger;
import com.confluenceplatform.common.model.ConfluenceClassification;
import com.confluenceplatform.common.model.ConfluenceState;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.common.staleness.Staleness;
import com.confluenceplatform.common.staleness.StalenessEvaluator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default {@link ConfluenceScorer}: weighted bias agreement, level proximity and recency.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Drop views past their source's hard staleness cutoff.</li>
 *   <li>No views → NONE / 0. One view → NONE with score {@code min(confidence, singleSourceCap)},
 *       never aligned.</li>
 *   <li>Map biases to signals: bullish +1, neutral 0, bearish −1.</li>
 *   <li>Pair agreement: 1 for equal non-zero signals, 0.5 when a neutral is involved,
 *       0 for opposed signals. {@code agreement} is the mean over all view pairs.</li>
 *   <li>{@code proximity} = 1 when two active, non-expired levels of the same type from two
 *       different contributing sources sit inside the merge tolerance band.</li>
 *   <li>{@code staleFraction} = share of contributing views past the soft threshold.</li>
 *   <li>Combine per {@link ConfluenceWeights}; round to 4 decimals.</li>
 * </ol>
 * {@code aligned} requires HIGH or MEDIUM and a pair agreement of 1 for every pair.
 *
 * <p>This class is stateless and thread-safe.
 */
public class WeightedConfluenceScorer implements ConfluenceScorer {

    private static final double NEUTRAL_PAIR_CREDIT = 0.5;

    private final StalenessEvaluator stalenessEvaluator;
    private final ConfluenceWeights weights;
    private final double proximityTolerance;

    public WeightedConfluenceScorer(StalenessEvaluator stalenessEvaluator,
                                    ConfluenceWeights weights,
                                    double proximityTolerance) {
        this.stalenessEvaluator = stalenessEvaluator;
        this.weights            = weights;
        this.proximityTolerance = proximityTolerance;
    }

    @Override
    public ConfluenceState score(TrackedSymbol symbol, List<SourceView> views,
                                 List<PriceLevel> levels, Instant now) {
        List<SourceView> contributing = new ArrayList<>();
        List<SignalSource> expired = new ArrayList<>();
        List<SignalSource> stale = new ArrayList<>();

        for (SourceView view : sorted(views)) {
            if (view.symbol() != symbol) continue;
            Staleness staleness = stalenessEvaluator.evaluate(view, now);
            if (!staleness.isUsable()) {
                expired.add(view.source());
                continue;
            }
            if (staleness.isStale()) {
                stale.add(view.source());
            }
            contributing.add(view);
        }

        if (contributing.isEmpty()) {
            String summary = expired.isEmpty()
                ? "No source views"
                : "No current source views (expired: " + ids(expired) + ")";
            return ConfluenceState.none(symbol, summary);
        }

        List<SignalSource> sources = contributing.stream().map(SourceView::source).toList();

        if (contributing.size() == 1) {
            SourceView only = contributing.get(0);
            double score = round(Math.min(only.confidence(), weights.singleSourceCap()));
            String summary = "Single source: " + only.source().id() + " " + only.bias().id()
                + "; confluence needs an independent second view" + staleSuffix(stale);
            return new ConfluenceState(symbol, score, false, ConfluenceClassification.NONE, summary,
                                       sources, List.copyOf(stale), null);
        }

        // ── bias agreement ────────────────────────────────────────────────
        double pairSum = 0.0;
        int pairs = 0;
        boolean unanimous = true;
        for (int i = 0; i < contributing.size(); i++) {
            for (int j = i + 1; j < contributing.size(); j++) {
                double credit = pairAgreement(contributing.get(i).bias(), contributing.get(j).bias());
                pairSum += credit;
                pairs++;
                if (credit < 1.0) unanimous = false;
            }
        }
        double agreement = pairs > 0 ? pairSum / pairs : 0.0;

        // ── level proximity ──────────────────────────────────────────────
        boolean proximate = hasCrossSourceProximity(levels, symbol, EnumSet.copyOf(sources), now);
        double proximity = proximate ? 1.0 : 0.0;

        // ── recency dampener ─────────────────────────────────────────────
        double staleFraction = (double) stale.size() / contributing.size();

        double raw = (weights.biasAgreementWeight() * agreement + weights.proximityWeight() * proximity)
                     * (1.0 - weights.recencyPenalty() * staleFraction);
        double score = round(Math.max(0.0, Math.min(1.0, raw)));

        ConfluenceClassification classification = weights.classify(score);
        boolean aligned = unanimous
            && (classification == ConfluenceClassification.HIGH
                || classification == ConfluenceClassification.MEDIUM);

        String summary = summarize(contributing, unanimous, proximate) + staleSuffix(stale);
        return new ConfluenceState(symbol, score, aligned, classification, summary,
                                   sources, List.copyOf(stale), null);
    }

    static double pairAgreement(ViewBias a, ViewBias b) {
        if (a.signal() == 0 || b.signal() == 0) return NEUTRAL_PAIR_CREDIT;
        return a.signal() == b.signal() ? 1.0 : 0.0;
    }

    private boolean hasCrossSourceProximity(List<PriceLevel> levels, TrackedSymbol symbol,
                                            Set<SignalSource> sources, Instant now) {
        List<PriceLevel> usable = levels.stream()
            .filter(PriceLevel::active)
            .filter(l -> l.symbol() == symbol)
            .filter(l -> sources.contains(l.source()))
            .filter(l -> stalenessEvaluator.evaluate(l, now).isUsable())
            .toList();
        for (int i = 0; i < usable.size(); i++) {
            PriceLevel a = usable.get(i);
            for (int j = i + 1; j < usable.size(); j++) {
                PriceLevel b = usable.get(j);
                if (a.source() != b.source() && a.type() == b.type()
                        && LevelMerger.withinTolerance(a.price(), b.price(), proximityTolerance)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String summarize(List<SourceView> views, boolean unanimous, boolean proximate) {
        String stances = views.stream()
            .map(v -> v.source().id() + " " + v.bias().id())
            .collect(Collectors.joining(", "));
        String levelNote = proximate ? "; levels converge" : "";
        if (unanimous) {
            return "All sources " + views.get(0).bias().id() + " aligned (" + ids(views.stream()
                .map(SourceView::source).toList()) + ")" + levelNote;
        }
        boolean opposed = views.stream().anyMatch(v -> v.bias() == ViewBias.BULLISH)
                       && views.stream().anyMatch(v -> v.bias() == ViewBias.BEARISH);
        if (opposed) {
            return "CONFLICT: " + views.stream()
                .map(v -> v.source().id() + " " + v.bias().id())
                .collect(Collectors.joining(" vs ")) + levelNote;
        }
        return "Mixed: " + stances + levelNote;
    }

    private static String staleSuffix(List<SignalSource> stale) {
        return stale.isEmpty() ? "" : " [stale: " + ids(stale) + "]";
    }

    private static String ids(List<SignalSource> sources) {
        return sources.stream().map(SignalSource::id).collect(Collectors.joining(", "));
    }

    private static List<SourceView> sorted(List<SourceView> views) {
        return views.stream()
            .sorted(Comparator.comparing(SourceView::source))
            .toList();
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
