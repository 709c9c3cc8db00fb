package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.ConfluenceClassification;
import com.confluenceplatform.common.model.ConfluenceState;

public record ConfluenceSummaryDTO(
    double                   score,
    ConfluenceClassification classification,
    boolean                  aligned,
    String                   summary
) {
    public static ConfluenceSummaryDTO from(ConfluenceState state) {
        return new ConfluenceSummaryDTO(state.score(), state.classification(), state.aligned(), state.summary());
    }
}
