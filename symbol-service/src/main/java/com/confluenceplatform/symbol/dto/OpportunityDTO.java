package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.ConfluenceClassification;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;

import java.util.Map;

/**
 * A symbol whose sources agree strongly enough to act on.
 *
 * @param biases contributing source id → bias
 */
public record OpportunityDTO(
    TrackedSymbol            symbol,
    double                   score,
    ConfluenceClassification classification,
    String                   summary,
    String                   tradeSetup,
    Map<String, ViewBias>    biases
) {}
