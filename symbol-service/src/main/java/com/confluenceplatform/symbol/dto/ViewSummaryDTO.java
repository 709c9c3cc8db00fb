package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.OptionsQuadrant;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.common.staleness.Staleness;

import java.time.Instant;

/** Compact per-source stance shown in the symbol list. */
public record ViewSummaryDTO(
    ViewBias        bias,
    OptionsQuadrant quadrant,
    String          ivRegime,
    String          wavePosition,
    String          wavePhase,
    Instant         lastUpdatedAt,
    Staleness       staleness,
    boolean         stale,
    String          staleWarning
) {}
