package com.confluenceplatform.common.setup;

import com.confluenceplatform.common.model.ConfluenceClassification;
import com.confluenceplatform.common.model.ConfluenceState;
import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TradeDirection;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.common.staleness.StalenessEvaluator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic one-line trade-setup summary for strongly aligned symbols.
 *
 * <p>Emits text only when the state is aligned AND classified HIGH. Template:
 * <pre>
 *   LONG setup on SPX: kt_technical and discord bullish. Target 5200.00 (kt_technical) |
 *   Support 5000.00 (discord) | Stop 4900.00 (kt_technical) | Strategy: sell puts (discord)
 * </pre>
 * For each contributing source, in catalog order, the highest-confidence usable level of each
 * of TARGET / SUPPORT / INVALIDATION is listed (ties: later confirmation, then higher price);
 * a source without such a level falls back to its view's primary target / support /
 * invalidation.
 *
 * <p>Descriptive only. Stateless and thread-safe.
 */
public final class TradeSetupSynthesizer {

    private static final Comparator<PriceLevel> STRONGEST = Comparator
        .comparingDouble(PriceLevel::confidence)
        .thenComparing(PriceLevel::lastConfirmedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparingDouble(PriceLevel::price);

    private final StalenessEvaluator stalenessEvaluator;

    public TradeSetupSynthesizer(StalenessEvaluator stalenessEvaluator) {
        this.stalenessEvaluator = stalenessEvaluator;
    }

    public Optional<String> synthesize(ConfluenceState state, List<SourceView> views,
                                       List<PriceLevel> levels, Instant now) {
        if (!state.aligned() || state.classification() != ConfluenceClassification.HIGH) {
            return Optional.empty();
        }
        List<SourceView> contributing = views.stream()
            .filter(v -> state.contributingSources().contains(v.source()))
            .sorted(Comparator.comparing(SourceView::source))
            .toList();
        if (contributing.isEmpty()) {
            return Optional.empty();
        }

        ViewBias bias = contributing.get(0).bias();
        TradeDirection direction = TradeDirection.fromBias(bias);
        if (direction == TradeDirection.FLAT) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        for (SourceView view : contributing) {
            addLevel(parts, "Target",  view, LevelType.TARGET,       view.primaryTarget(),  levels, now);
        }
        for (SourceView view : contributing) {
            addLevel(parts, "Support", view, LevelType.SUPPORT,      view.primarySupport(), levels, now);
        }
        for (SourceView view : contributing) {
            addLevel(parts, "Stop",    view, LevelType.INVALIDATION, view.invalidation(),   levels, now);
        }
        for (SourceView view : contributing) {
            if (view.strategyRec() != null && !view.strategyRec().isBlank()) {
                parts.add("Strategy: " + view.strategyRec().trim() + " (" + view.source().id() + ")");
            }
        }

        StringBuilder text = new StringBuilder()
            .append(direction.name()).append(" setup on ").append(state.symbol().name()).append(": ")
            .append(joinSources(contributing)).append(' ').append(bias.id()).append('.');
        if (!parts.isEmpty()) {
            text.append(' ').append(String.join(" | ", parts));
        }
        return Optional.of(text.toString());
    }

    private void addLevel(List<String> parts, String label, SourceView view, LevelType type,
                          Double fallback, List<PriceLevel> levels, Instant now) {
        Double price = levels.stream()
            .filter(PriceLevel::active)
            .filter(l -> l.source() == view.source() && l.type() == type && l.symbol() == view.symbol())
            .filter(l -> stalenessEvaluator.evaluate(l, now).isUsable())
            .max(STRONGEST)
            .map(PriceLevel::price)
            .orElse(fallback);
        if (price != null) {
            parts.add(label + " " + String.format(Locale.ROOT, "%.2f", price) + " (" + view.source().id() + ")");
        }
    }

    private static String joinSources(List<SourceView> views) {
        List<String> ids = views.stream().map(SourceView::source).map(SignalSource::id).toList();
        if (ids.size() == 1) return ids.get(0);
        return String.join(", ", ids.subList(0, ids.size() - 1)) + " and " + ids.get(ids.size() - 1);
    }
}
