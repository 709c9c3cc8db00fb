package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.staleness.Staleness;

public record PriceLevelDTO(
    PriceLevel level,
    Staleness  staleness,
    boolean    stale,
    Double     hoursSinceConfirmed
) {}
