package com.confluenceplatform.symbol.store;

import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Latest {@link SourceView} per (symbol, source). Guarded by the same per-symbol locks
 * as {@link LevelStore}.
 *
 * <p>A snapshot whose {@code lastUpdatedAt} is not newer than the stored one is a stale
 * write and leaves the store untouched; replaying a record is therefore harmless.
 */
@Component
public class SourceViewStore {

    public enum UpsertOutcome {
        UPDATED,
        STALE_WRITE_IGNORED
    }

    private final Map<TrackedSymbol, Map<SignalSource, SourceView>> views;
    private final SymbolLockRegistry locks;

    public SourceViewStore(SymbolLockRegistry locks) {
        this.locks = locks;
        Map<TrackedSymbol, Map<SignalSource, SourceView>> map = new EnumMap<>(TrackedSymbol.class);
        for (TrackedSymbol symbol : TrackedSymbol.values()) {
            map.put(symbol, new EnumMap<>(SignalSource.class));
        }
        this.views = Collections.unmodifiableMap(map);
    }

    public UpsertOutcome upsert(SourceView view) {
        return locks.withLock(view.symbol(), () -> {
            Map<SignalSource, SourceView> bySource = views.get(view.symbol());
            SourceView current = bySource.get(view.source());
            if (current != null && !view.lastUpdatedAt().isAfter(current.lastUpdatedAt())) {
                return UpsertOutcome.STALE_WRITE_IGNORED;
            }
            bySource.put(view.source(), view);
            return UpsertOutcome.UPDATED;
        });
    }

    /** Current views of the symbol in source order. */
    public List<SourceView> viewsFor(TrackedSymbol symbol) {
        return locks.withLock(symbol, () -> List.copyOf(views.get(symbol).values()));
    }
}
