package com.confluenceplatform.common.level;

import com.confluenceplatform.common.model.PriceLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Deduplicates extracted price levels within a (symbol, source, type) bucket.
 *
 * <h3>Tolerance</h3>
 * Two prices are the same level when {@code |a − b| / max(a, b) ≤ tolerance}
 * (default 1.5%).
 *
 * <h3>Merge</h3>
 * <ol>
 *   <li>price — confidence-weighted mean of both observations</li>
 *   <li>direction / fib / context fields — from the higher-confidence observation, the other
 *       side fills gaps</li>
 *   <li>context snippet — replaced by the incoming one when it is strictly more confident,
 *       otherwise the incoming snippet is appended once</li>
 *   <li>confidence — {@link MergeConfidencePolicy#combine}</li>
 *   <li>lastConfirmedAt — the later of the two; createdAt — the earlier</li>
 * </ol>
 * After a merge the survivor's price may have moved; any other active level of the bucket
 * now inside tolerance is folded in as well, so no two active levels of a bucket ever sit
 * inside the band.
 *
 * <p>Stateless and thread-safe. Callers serialize access to a bucket.
 */
public final class LevelMerger {

    public static final double DEFAULT_TOLERANCE = 0.015;
    public static final double DEFAULT_LOW_CONFIDENCE_FLOOR = 0.5;

    static final String CONTEXT_SEPARATOR = " | ";
    static final int MAX_CONTEXT_LENGTH = 200;

    private final double tolerance;
    private final double lowConfidenceFloor;
    private final MergeConfidencePolicy confidencePolicy;

    public LevelMerger(double tolerance, double lowConfidenceFloor, MergeConfidencePolicy confidencePolicy) {
        if (tolerance < 0.0 || tolerance >= 1.0) {
            throw new IllegalArgumentException("tolerance must be in [0,1): " + tolerance);
        }
        this.tolerance          = tolerance;
        this.lowConfidenceFloor = lowConfidenceFloor;
        this.confidencePolicy   = confidencePolicy != null ? confidencePolicy : MergeConfidencePolicy.MAX;
    }

    public static LevelMerger defaults() {
        return new LevelMerger(DEFAULT_TOLERANCE, DEFAULT_LOW_CONFIDENCE_FLOOR, MergeConfidencePolicy.MAX);
    }

    public double tolerance() {
        return tolerance;
    }

    public double lowConfidenceFloor() {
        return lowConfidenceFloor;
    }

    /** Relative-distance test shared with the confluence proximity check. */
    public static boolean withinTolerance(double a, double b, double tolerance) {
        double max = Math.max(Math.abs(a), Math.abs(b));
        if (max == 0.0) return true;
        return Math.abs(a - b) / max <= tolerance;
    }

    public boolean withinTolerance(double a, double b) {
        return withinTolerance(a, b, tolerance);
    }

    /**
     * Applies a candidate to the stored levels of a symbol.
     *
     * @param stored    all stored levels of the candidate's symbol (any source/type, any state)
     * @param candidate unsaved level built from an extraction record
     */
    public LevelMergeResult apply(List<PriceLevel> stored, PriceLevel candidate) {
        Optional<PriceLevel> match = findMatch(stored, candidate, null);
        if (match.isEmpty()) {
            return new LevelMergeResult(LevelMergeResult.Outcome.INSERTED, candidate, List.of());
        }

        PriceLevel existing = match.get();
        if (candidate.lastConfirmedAt() != null && existing.lastConfirmedAt() != null
                && candidate.lastConfirmedAt().isBefore(existing.lastConfirmedAt())) {
            return new LevelMergeResult(LevelMergeResult.Outcome.STALE_WRITE_IGNORED, existing, List.of());
        }

        PriceLevel merged = merge(existing, candidate);
        List<PriceLevel> superseded = new ArrayList<>();
        merged = foldNeighbours(stored, merged, superseded);
        return new LevelMergeResult(LevelMergeResult.Outcome.MERGED, merged, List.copyOf(superseded));
    }

    /**
     * Re-establishes the tolerance invariant around an already-stored level whose price or
     * type was edited. Neighbours inside the band are folded into {@code level}.
     */
    public LevelMergeResult reconcile(List<PriceLevel> stored, PriceLevel level) {
        if (!level.active()) {
            return new LevelMergeResult(LevelMergeResult.Outcome.MERGED, level, List.of());
        }
        List<PriceLevel> superseded = new ArrayList<>();
        PriceLevel survivor = foldNeighbours(stored, level, superseded);
        return new LevelMergeResult(LevelMergeResult.Outcome.MERGED, survivor, List.copyOf(superseded));
    }

    /** Nearest active level of the same bucket within tolerance, excluding {@code excludeId}. */
    Optional<PriceLevel> findMatch(List<PriceLevel> stored, PriceLevel probe, Long excludeId) {
        return stored.stream()
            .filter(PriceLevel::active)
            .filter(l -> l.sameKey(probe))
            .filter(l -> excludeId == null || !excludeId.equals(l.id()))
            .filter(l -> withinTolerance(l.price(), probe.price()))
            .min(Comparator.comparingDouble((PriceLevel l) -> Math.abs(l.price() - probe.price()))
                .thenComparing(PriceLevel::id, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    /**
     * Merges {@code incoming} into {@code existing}. The result keeps the existing id.
     */
    public PriceLevel merge(PriceLevel existing, PriceLevel incoming) {
        boolean incomingStronger = incoming.confidence() > existing.confidence();
        PriceLevel strong = incomingStronger ? incoming : existing;
        PriceLevel weak   = incomingStronger ? existing : incoming;

        double price = weightedPrice(existing, incoming);
        double confidence = confidencePolicy.combine(existing.confidence(), incoming.confidence());
        String context = incomingStronger
            ? firstNonNull(incoming.contextSnippet(), existing.contextSnippet())
            : appendContext(existing.contextSnippet(), incoming.contextSnippet());

        boolean incomingNewer = !isBefore(incoming.lastConfirmedAt(), existing.lastConfirmedAt());

        return new PriceLevel(
            existing.id(), existing.symbol(), existing.source(), existing.type(),
            price,
            firstNonNull(strong.priceUpper(), weak.priceUpper()),
            firstNonNull(strong.direction(), weak.direction()),
            firstNonNull(strong.fibLevel(), weak.fibLevel()),
            firstNonNull(strong.waveContext(), weak.waveContext()),
            firstNonNull(strong.optionsContext(), weak.optionsContext()),
            firstNonNull(strong.invalidationPrice(), weak.invalidationPrice()),
            confidence,
            confidence < lowConfidenceFloor,
            context,
            incomingNewer ? firstNonNull(incoming.contentId(), existing.contentId())
                          : firstNonNull(existing.contentId(), incoming.contentId()),
            earlier(existing.createdAt(), incoming.createdAt()),
            later(existing.lastConfirmedAt(), incoming.lastConfirmedAt()),
            true, null);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private PriceLevel foldNeighbours(List<PriceLevel> stored, PriceLevel survivor, List<PriceLevel> superseded) {
        List<PriceLevel> remaining = new ArrayList<>(stored);
        while (true) {
            Optional<PriceLevel> neighbour = findMatch(remaining, survivor, survivor.id());
            if (neighbour.isEmpty()) {
                return survivor;
            }
            PriceLevel absorbed = neighbour.get();
            remaining.remove(absorbed);
            superseded.add(absorbed.deactivated(PriceLevel.SUPERSEDED));
            survivor = merge(survivor, absorbed);
        }
    }

    private static double weightedPrice(PriceLevel a, PriceLevel b) {
        if (Double.compare(a.price(), b.price()) == 0) {
            return a.price();
        }
        double totalWeight = a.confidence() + b.confidence();
        if (totalWeight <= 0.0) {
            return (a.price() + b.price()) / 2.0;
        }
        return (a.price() * a.confidence() + b.price() * b.confidence()) / totalWeight;
    }

    static String appendContext(String current, String addition) {
        if (addition == null || addition.isBlank()) return current;
        if (current == null || current.isBlank()) return addition;
        if (current.contains(addition)) return current;
        String joined = current + CONTEXT_SEPARATOR + addition;
        return joined.length() > MAX_CONTEXT_LENGTH ? joined.substring(0, MAX_CONTEXT_LENGTH) : joined;
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }

    private static boolean isBefore(Instant a, Instant b) {
        return a != null && b != null && a.isBefore(b);
    }

    private static Instant earlier(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
