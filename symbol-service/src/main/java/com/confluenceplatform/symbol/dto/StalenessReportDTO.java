package com.confluenceplatform.symbol.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Catalog-wide staleness sweep returned by {@code POST /api/v1/symbols/refresh}.
 *
 * @param staleViews     source id → symbols whose view is past the soft threshold
 * @param expiredViews   source id → symbols whose view is past the hard threshold
 * @param staleLevels    active levels past their source's soft threshold
 * @param alignedSymbols symbols whose confluence is currently aligned
 */
public record StalenessReportDTO(
    Instant                   evaluatedAt,
    int                       symbolsChecked,
    Map<String, List<String>> staleViews,
    Map<String, List<String>> expiredViews,
    int                       staleLevels,
    List<String>              alignedSymbols
) {}
