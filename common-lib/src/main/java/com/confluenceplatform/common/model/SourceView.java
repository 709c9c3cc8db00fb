package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One source's current stance on a symbol. At most one exists per (symbol, source);
 * a newer snapshot replaces it wholesale.
 *
 * <p>Elliott-wave fields are populated by chart-analysis sources, quadrant / IV fields
 * by options-positioning sources; either group may be {@code null}.
 */
public record SourceView(
    @JsonProperty("symbol")          TrackedSymbol symbol,
    @JsonProperty("source")          SignalSource source,
    @JsonProperty("bias")            ViewBias bias,
    @JsonProperty("quadrant")        OptionsQuadrant quadrant,
    @JsonProperty("ivRegime")        String ivRegime,
    @JsonProperty("waveDegree")      String waveDegree,
    @JsonProperty("wavePosition")    String wavePosition,
    @JsonProperty("waveDirection")   String waveDirection,
    @JsonProperty("wavePhase")       String wavePhase,
    @JsonProperty("primaryTarget")   Double primaryTarget,
    @JsonProperty("primarySupport")  Double primarySupport,
    @JsonProperty("invalidation")    Double invalidation,
    @JsonProperty("strategyRec")     String strategyRec,
    @JsonProperty("keyStrikes")      String keyStrikes,
    @JsonProperty("notes")           String notes,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("contentId")       String contentId,
    @JsonProperty("lastUpdatedAt")   Instant lastUpdatedAt
) {}
