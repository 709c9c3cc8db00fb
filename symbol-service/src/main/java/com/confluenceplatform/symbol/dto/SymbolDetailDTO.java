package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.ConfluenceState;
import com.confluenceplatform.common.model.TrackedSymbol;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full picture for one symbol: {@code GET /api/v1/symbols/{symbol}}.
 *
 * @param views       keyed by source id, source order
 * @param levels      active levels, price descending
 * @param confluence  recomputed at {@code evaluatedAt}
 * @param tradeSetup  present only for aligned HIGH confluence
 */
public record SymbolDetailDTO(
    TrackedSymbol              symbol,
    TrackedSymbol.AssetClass   assetClass,
    Map<String, SourceViewDTO> views,
    List<PriceLevelDTO>        levels,
    ConfluenceState            confluence,
    String                     tradeSetup,
    Instant                    evaluatedAt
) {}
