package com.confluenceplatform.symbol.store;

import com.confluenceplatform.common.level.LevelMergeResult;
import com.confluenceplatform.common.level.LevelMerger;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.TrackedSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * In-memory store of deduplicated price levels, one list per tracked symbol.
 *
 * <p>Each list is only touched while holding that symbol's lock from
 * {@link SymbolLockRegistry}; the merge decision and the write-back happen in the same
 * critical section, so two concurrent near-duplicates of one level always end up as a
 * single stored level. Levels are never removed: superseded and dismissed levels stay
 * stored with {@code active = false}.
 */
@Component
public class LevelStore {

    private static final Logger log = LoggerFactory.getLogger(LevelStore.class);

    private final Map<TrackedSymbol, List<PriceLevel>> levels;
    private final Map<Long, TrackedSymbol> symbolById = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    private final SymbolLockRegistry locks;
    private final LevelMerger merger;

    public LevelStore(SymbolLockRegistry locks, LevelMerger merger) {
        this.locks  = locks;
        this.merger = merger;
        Map<TrackedSymbol, List<PriceLevel>> map = new EnumMap<>(TrackedSymbol.class);
        for (TrackedSymbol symbol : TrackedSymbol.values()) {
            map.put(symbol, new ArrayList<>());
        }
        this.levels = Collections.unmodifiableMap(map);
    }

    /**
     * Inserts the candidate or merges it into the nearest active level of its bucket.
     * On {@link LevelMergeResult.Outcome#INSERTED} the returned survivor carries its new id.
     */
    public LevelMergeResult ingest(PriceLevel candidate) {
        return locks.withLock(candidate.symbol(), () -> {
            List<PriceLevel> bucket = levels.get(candidate.symbol());
            LevelMergeResult result = merger.apply(List.copyOf(bucket), candidate);
            switch (result.outcome()) {
                case INSERTED -> {
                    PriceLevel saved = candidate.withId(idSequence.incrementAndGet());
                    bucket.add(saved);
                    symbolById.put(saved.id(), saved.symbol());
                    return new LevelMergeResult(LevelMergeResult.Outcome.INSERTED, saved, List.of());
                }
                case MERGED -> {
                    writeBack(bucket, result);
                    return result;
                }
                default -> {
                    return result;
                }
            }
        });
    }

    /**
     * Applies a user edit to a stored level and re-establishes the tolerance invariant
     * around it. Empty when the id is unknown.
     */
    public Optional<LevelMergeResult> edit(long levelId, UnaryOperator<PriceLevel> editor) {
        TrackedSymbol symbol = symbolById.get(levelId);
        if (symbol == null) {
            return Optional.empty();
        }
        return locks.withLock(symbol, () -> {
            List<PriceLevel> bucket = levels.get(symbol);
            int index = indexOf(bucket, levelId);
            if (index < 0) {
                return Optional.empty();
            }
            PriceLevel edited = editor.apply(bucket.get(index));
            bucket.set(index, edited);
            LevelMergeResult result = merger.reconcile(List.copyOf(bucket), edited);
            writeBack(bucket, result);
            if (!result.superseded().isEmpty()) {
                log.info("Edited level absorbed neighbours. levelId={} symbol={} absorbed={}",
                         levelId, symbol, result.superseded().size());
            }
            return Optional.of(result);
        });
    }

    Optional<PriceLevel> findById(long levelId) {
        TrackedSymbol symbol = symbolById.get(levelId);
        if (symbol == null) {
            return Optional.empty();
        }
        return locks.withLock(symbol, () -> {
            List<PriceLevel> bucket = levels.get(symbol);
            int index = indexOf(bucket, levelId);
            return index < 0 ? Optional.<PriceLevel>empty() : Optional.of(bucket.get(index));
        });
    }

    /** Every stored level of the symbol, active or not, as an immutable copy. */
    public List<PriceLevel> levelsFor(TrackedSymbol symbol) {
        return locks.withLock(symbol, () -> List.copyOf(levels.get(symbol)));
    }

    List<PriceLevel> activeLevelsFor(TrackedSymbol symbol) {
        return levelsFor(symbol).stream().filter(PriceLevel::active).toList();
    }

    // ── helpers (caller holds the symbol lock) ────────────────────────────

    private static void writeBack(List<PriceLevel> bucket, LevelMergeResult result) {
        replace(bucket, result.survivor());
        result.superseded().forEach(level -> replace(bucket, level));
    }

    private static void replace(List<PriceLevel> bucket, PriceLevel level) {
        int index = indexOf(bucket, level.id());
        if (index < 0) {
            throw new IllegalStateException("Level " + level.id() + " is not stored for " + level.symbol());
        }
        bucket.set(index, level);
    }

    private static int indexOf(List<PriceLevel> bucket, Long levelId) {
        for (int i = 0; i < bucket.size(); i++) {
            if (bucket.get(i).id().equals(levelId)) {
                return i;
            }
        }
        return -1;
    }
}
