package com.confluenceplatform.symbol.client;

import com.confluenceplatform.common.model.SignalSource;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionRequest(
    String       contentId,
    SignalSource source
) {}
