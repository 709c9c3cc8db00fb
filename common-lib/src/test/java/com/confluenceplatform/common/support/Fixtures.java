package com.confluenceplatform.common.support;

import com.confluenceplatform.common.model.LevelDirection;
import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.OptionsQuadrant;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;

import java.time.Instant;

/** Builders for levels and views used across the domain tests. */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-03-01T14:00:00Z");

    private Fixtures() {}

    public static PriceLevel level(Long id, SignalSource source, LevelType type,
                                   double price, double confidence, Instant at) {
        return level(id, TrackedSymbol.SPX, source, type, price, confidence, at, null);
    }

    public static PriceLevel level(Long id, TrackedSymbol symbol, SignalSource source, LevelType type,
                                   double price, double confidence, Instant at, String snippet) {
        return new PriceLevel(id, symbol, source, type, price, null, LevelDirection.NEUTRAL,
                              null, null, null, null, confidence, confidence < 0.5,
                              snippet, "content-" + source.id(), at, at, true, null);
    }

    public static SourceView view(SignalSource source, ViewBias bias, double confidence, Instant at) {
        return view(TrackedSymbol.SPX, source, bias, confidence, at);
    }

    public static SourceView view(TrackedSymbol symbol, SignalSource source, ViewBias bias,
                                  double confidence, Instant at) {
        return new SourceView(symbol, source, bias, null, null, null, null, null, null,
                              null, null, null, null, null, null, confidence, "content-" + source.id(), at);
    }

    public static SourceView quadrantView(SignalSource source, OptionsQuadrant quadrant,
                                          String strategyRec, double confidence, Instant at) {
        return new SourceView(TrackedSymbol.SPX, source, quadrant.bias(), quadrant, "low", null, null, null,
                              null, null, null, null, strategyRec, null, null, confidence,
                              "content-" + source.id(), at);
    }

    public static SourceView waveView(SignalSource source, ViewBias bias, Double target, Double support,
                                      Double invalidation, double confidence, Instant at) {
        return new SourceView(TrackedSymbol.SPX, source, bias, null, null, "minor", "wave 3", "up", "impulse",
                              target, support, invalidation, null, null, null, confidence,
                              "content-" + source.id(), at);
    }
}
