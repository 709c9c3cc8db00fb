package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LevelListDTO(
    TrackedSymbol       symbol,
    SignalSource        source,
    List<PriceLevelDTO> levels,
    int                 count
) {}
