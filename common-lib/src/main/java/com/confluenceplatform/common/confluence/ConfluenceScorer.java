package com.confluenceplatform.common.confluence;

import com.confluenceplatform.common.model.ConfluenceState;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;

import java.time.Instant;
import java.util.List;

/**
 * Strategy contract for turning a symbol's current views and levels into a
 * {@link ConfluenceState}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> — safe to call concurrently on snapshots</li>
 *   <li><b>Total</b>     — missing, partial or expired input degrades the result, never throws</li>
 *   <li><b>Deterministic</b> — identical input and {@code now} give an identical state</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedConfluenceScorer}.
 */
public interface ConfluenceScorer {

    /**
     * @param symbol the symbol being scored
     * @param views  every stored view of the symbol (any staleness)
     * @param levels every stored level of the symbol (any staleness, any active flag)
     * @param now    evaluation time
     * @return the derived state, with {@code tradeSetup == null}
     */
    ConfluenceState score(TrackedSymbol symbol, List<SourceView> views, List<PriceLevel> levels, Instant now);
}
