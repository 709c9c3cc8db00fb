package com.confluenceplatform.symbol.dto;

import java.util.List;

public record OpportunityListDTO(
    List<OpportunityDTO> opportunities,
    int                  count,
    double               minScore
) {}
