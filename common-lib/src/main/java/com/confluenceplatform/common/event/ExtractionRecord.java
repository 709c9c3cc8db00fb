package com.confluenceplatform.common.event;

import com.confluenceplatform.common.model.LevelDirection;
import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.OptionsQuadrant;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.ViewBias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One candidate signal returned by the Extraction Service for a content item.
 *
 * <p>{@code symbolText} is the raw mention as written in the content ("/ES", "Google",
 * "NQ=F"); it is resolved against the catalog at ingestion time. Exactly one of
 * {@code level} / {@code view} is expected, matching {@code kind}.
 */
public record ExtractionRecord(
    @JsonProperty("symbolText") String symbolText,
    @JsonProperty("source")     SignalSource source,
    @JsonProperty("kind")       RecordKind kind,
    @JsonProperty("level")      LevelFields level,
    @JsonProperty("view")       ViewFields view,
    @JsonProperty("contentId")  String contentId,
    @JsonProperty("observedAt") Instant observedAt
) {

    public static ExtractionRecord level(String symbolText, SignalSource source, LevelFields level,
                                         String contentId, Instant observedAt) {
        return new ExtractionRecord(symbolText, source, RecordKind.LEVEL, level, null, contentId, observedAt);
    }

    public static ExtractionRecord view(String symbolText, SignalSource source, ViewFields view,
                                        String contentId, Instant observedAt) {
        return new ExtractionRecord(symbolText, source, RecordKind.VIEW, null, view, contentId, observedAt);
    }

    /** Level payload; {@code confidence} defaults to 0.8 when the extractor omits it. */
    public record LevelFields(
        @JsonProperty("type")              LevelType type,
        @JsonProperty("price")             Double price,
        @JsonProperty("priceUpper")        Double priceUpper,
        @JsonProperty("direction")         LevelDirection direction,
        @JsonProperty("fibLevel")          String fibLevel,
        @JsonProperty("waveContext")       String waveContext,
        @JsonProperty("optionsContext")    String optionsContext,
        @JsonProperty("invalidationPrice") Double invalidationPrice,
        @JsonProperty("confidence")        Double confidence,
        @JsonProperty("contextSnippet")    String contextSnippet
    ) {
        public static LevelFields of(LevelType type, double price, LevelDirection direction,
                                     double confidence, String contextSnippet) {
            return new LevelFields(type, price, null, direction, null, null, null, null,
                                   confidence, contextSnippet);
        }
    }

    /** View payload; a missing {@code bias} is derived from {@code quadrant} when present. */
    public record ViewFields(
        @JsonProperty("bias")           ViewBias bias,
        @JsonProperty("quadrant")       OptionsQuadrant quadrant,
        @JsonProperty("ivRegime")       String ivRegime,
        @JsonProperty("waveDegree")     String waveDegree,
        @JsonProperty("wavePosition")   String wavePosition,
        @JsonProperty("waveDirection")  String waveDirection,
        @JsonProperty("wavePhase")      String wavePhase,
        @JsonProperty("primaryTarget")  Double primaryTarget,
        @JsonProperty("primarySupport") Double primarySupport,
        @JsonProperty("invalidation")   Double invalidation,
        @JsonProperty("strategyRec")    String strategyRec,
        @JsonProperty("keyStrikes")     String keyStrikes,
        @JsonProperty("notes")          String notes,
        @JsonProperty("confidence")     Double confidence
    ) {
        public static ViewFields ofBias(ViewBias bias, double confidence) {
            return new ViewFields(bias, null, null, null, null, null, null, null, null, null,
                                  null, null, null, confidence);
        }

        public static ViewFields ofQuadrant(OptionsQuadrant quadrant, String ivRegime, double confidence) {
            return new ViewFields(null, quadrant, ivRegime, null, null, null, null, null, null, null,
                                  null, null, null, confidence);
        }
    }
}
