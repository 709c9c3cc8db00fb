package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A deduplicated price level for one (symbol, source, type).
 *
 * <p>Instances are immutable; the level store replaces a stored instance when a
 * near-duplicate extraction is merged into it. {@code id} is {@code null} for a
 * candidate that has not been stored yet. Levels are never deleted: a superseded or
 * dismissed level keeps its row with {@code active = false} and an {@code inactiveReason}.
 */
public record PriceLevel(
    @JsonProperty("id")                Long id,
    @JsonProperty("symbol")            TrackedSymbol symbol,
    @JsonProperty("source")            SignalSource source,
    @JsonProperty("type")              LevelType type,
    @JsonProperty("price")             double price,
    @JsonProperty("priceUpper")        Double priceUpper,
    @JsonProperty("direction")         LevelDirection direction,
    @JsonProperty("fibLevel")          String fibLevel,
    @JsonProperty("waveContext")       String waveContext,
    @JsonProperty("optionsContext")    String optionsContext,
    @JsonProperty("invalidationPrice") Double invalidationPrice,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("lowConfidence")     boolean lowConfidence,
    @JsonProperty("contextSnippet")    String contextSnippet,
    @JsonProperty("contentId")         String contentId,
    @JsonProperty("createdAt")         Instant createdAt,
    @JsonProperty("lastConfirmedAt")   Instant lastConfirmedAt,
    @JsonProperty("active")            boolean active,
    @JsonProperty("inactiveReason")    String inactiveReason
) {
    public static final String SUPERSEDED = "superseded";
    public static final String DISMISSED  = "dismissed";

    public PriceLevel withId(long newId) {
        return new PriceLevel(newId, symbol, source, type, price, priceUpper, direction, fibLevel,
                              waveContext, optionsContext, invalidationPrice, confidence, lowConfidence,
                              contextSnippet, contentId, createdAt, lastConfirmedAt, active, inactiveReason);
    }

    public PriceLevel deactivated(String reason) {
        return new PriceLevel(id, symbol, source, type, price, priceUpper, direction, fibLevel,
                              waveContext, optionsContext, invalidationPrice, confidence, lowConfidence,
                              contextSnippet, contentId, createdAt, lastConfirmedAt, false, reason);
    }

    /** Applies a user override; {@code null} arguments keep the current value. */
    public PriceLevel withOverrides(Double newPrice, LevelType newType,
                                    LevelDirection newDirection, Boolean newActive) {
        boolean nextActive = newActive != null ? newActive : active;
        return new PriceLevel(id, symbol, source,
                              newType != null ? newType : type,
                              newPrice != null ? newPrice : price,
                              priceUpper,
                              newDirection != null ? newDirection : direction,
                              fibLevel, waveContext, optionsContext, invalidationPrice,
                              confidence, lowConfidence, contextSnippet, contentId,
                              createdAt, lastConfirmedAt,
                              nextActive, nextActive ? null : DISMISSED);
    }

    /** True when {@code other} describes the same (symbol, source, type) bucket. */
    public boolean sameKey(PriceLevel other) {
        return symbol == other.symbol && source == other.source && type == other.type;
    }
}
