package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Derived cross-source agreement picture for one symbol.
 *
 * <p>Never stored: always recomputed from the current views and levels at read time.
 * {@code contributingSources} lists the sources whose views were scored;
 * {@code staleSources} the subset that is past its soft staleness threshold.
 */
public record ConfluenceState(
    @JsonProperty("symbol")              TrackedSymbol symbol,
    @JsonProperty("score")               double score,
    @JsonProperty("aligned")             boolean aligned,
    @JsonProperty("classification")      ConfluenceClassification classification,
    @JsonProperty("summary")             String summary,
    @JsonProperty("contributingSources") List<SignalSource> contributingSources,
    @JsonProperty("staleSources")        List<SignalSource> staleSources,
    @JsonProperty("tradeSetup")          String tradeSetup
) {
    public static ConfluenceState none(TrackedSymbol symbol, String summary) {
        return new ConfluenceState(symbol, 0.0, false, ConfluenceClassification.NONE,
                                   summary, List.of(), List.of(), null);
    }

    public ConfluenceState withTradeSetup(String setup) {
        return new ConfluenceState(symbol, score, aligned, classification, summary,
                                   contributingSources, staleSources, setup);
    }
}
