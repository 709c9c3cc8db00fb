package com.confluenceplatform.symbol.dto;

import java.util.List;

public record SymbolListDTO(
    List<SymbolSummaryDTO> symbols,
    int                    count
) {}
