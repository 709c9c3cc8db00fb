package com.confluenceplatform.symbol.store;

import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;

import java.util.List;

/**
 * Consistent point-in-time copy of one symbol's views and stored levels.
 *
 * @param views  current view per source, source order
 * @param levels every stored level, active or not
 */
public record SymbolSnapshot(
    TrackedSymbol    symbol,
    List<SourceView> views,
    List<PriceLevel> levels
) {
    public List<PriceLevel> activeLevels() {
        return levels.stream().filter(PriceLevel::active).toList();
    }
}
