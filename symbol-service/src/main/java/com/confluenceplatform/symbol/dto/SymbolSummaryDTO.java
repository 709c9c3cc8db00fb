package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.TrackedSymbol;

import java.util.Map;

/**
 * One row of {@code GET /api/v1/symbols}. Symbols without data still appear, with an
 * empty {@code views} map and a NONE confluence.
 *
 * @param views keyed by source id, source order
 */
public record SymbolSummaryDTO(
    TrackedSymbol                symbol,
    TrackedSymbol.AssetClass     assetClass,
    Map<String, ViewSummaryDTO>  views,
    ConfluenceSummaryDTO         confluence,
    int                          activeLevelCount
) {}
