package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.confluence.ConfluenceScorer;
import com.confluenceplatform.common.model.ConfluenceState;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.setup.TradeSetupSynthesizer;
import com.confluenceplatform.symbol.store.LevelStore;
import com.confluenceplatform.symbol.store.SourceViewStore;
import com.confluenceplatform.symbol.store.SymbolLockRegistry;
import com.confluenceplatform.symbol.store.SymbolSnapshot;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Recomputes a symbol's confluence from a consistent snapshot.
 *
 * <p>The snapshot is taken under the symbol lock; scoring and setup synthesis run outside
 * it on the immutable copy. Nothing is cached: the state is always as of {@code now}.
 */
@Service
public class ConfluenceService {

    /** Snapshot plus the state derived from it. */
    public record Evaluation(SymbolSnapshot snapshot, ConfluenceState state) {}

    private final SymbolLockRegistry locks;
    private final SourceViewStore viewStore;
    private final LevelStore levelStore;
    private final ConfluenceScorer scorer;
    private final TradeSetupSynthesizer synthesizer;

    public ConfluenceService(SymbolLockRegistry locks,
                             SourceViewStore viewStore,
                             LevelStore levelStore,
                             ConfluenceScorer scorer,
                             TradeSetupSynthesizer synthesizer) {
        this.locks       = locks;
        this.viewStore   = viewStore;
        this.levelStore  = levelStore;
        this.scorer      = scorer;
        this.synthesizer = synthesizer;
    }

    public SymbolSnapshot snapshot(TrackedSymbol symbol) {
        return locks.withLock(symbol, () ->
            new SymbolSnapshot(symbol, viewStore.viewsFor(symbol), levelStore.levelsFor(symbol)));
    }

    public Evaluation evaluate(TrackedSymbol symbol, Instant now) {
        SymbolSnapshot snapshot = snapshot(symbol);
        ConfluenceState state = scorer.score(symbol, snapshot.views(), snapshot.activeLevels(), now);
        String setup = synthesizer.synthesize(state, snapshot.views(), snapshot.activeLevels(), now)
            .orElse(null);
        return new Evaluation(snapshot, state.withTradeSetup(setup));
    }
}
