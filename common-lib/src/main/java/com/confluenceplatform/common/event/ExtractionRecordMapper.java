package com.confluenceplatform.common.event;

import com.confluenceplatform.common.exception.RejectedRecordException;
import com.confluenceplatform.common.model.LevelDirection;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.common.normalize.SymbolNormalizer;

/**
 * Validates an {@link ExtractionRecord} and converts it into a level candidate or a view.
 *
 * <p>Every failure is a {@link RejectedRecordException} scoped to the one record.
 * No logging, no side effects.
 */
public final class ExtractionRecordMapper {

    /** Applied when the extractor does not report a confidence. */
    public static final double DEFAULT_CONFIDENCE = 0.8;

    static final int MAX_SNIPPET_LENGTH = 200;

    private ExtractionRecordMapper() {}

    /**
     * Builds an unsaved {@link PriceLevel} candidate ({@code id == null}).
     *
     * @param lowConfidenceFloor confidence below which the level is flagged low-confidence
     */
    public static PriceLevel toLevelCandidate(ExtractionRecord record, double lowConfidenceFloor) {
        TrackedSymbol symbol = requireCommon(record, RecordKind.LEVEL);
        ExtractionRecord.LevelFields fields = record.level();
        if (fields == null) {
            throw reject(record, "level payload missing");
        }
        if (fields.type() == null) {
            throw reject(record, "level type missing or unknown");
        }
        if (fields.price() == null || fields.price().isNaN() || fields.price() <= 0.0) {
            throw reject(record, "price must be positive, was " + fields.price());
        }
        if (fields.priceUpper() != null && fields.priceUpper() < fields.price()) {
            throw reject(record, "priceUpper " + fields.priceUpper() + " below price " + fields.price());
        }
        double confidence = confidence(record, fields.confidence());

        return new PriceLevel(
            null, symbol, record.source(), fields.type(),
            fields.price(), fields.priceUpper(),
            fields.direction() != null ? fields.direction() : LevelDirection.NEUTRAL,
            fields.fibLevel(), fields.waveContext(), fields.optionsContext(),
            fields.invalidationPrice(),
            confidence, confidence < lowConfidenceFloor,
            truncate(fields.contextSnippet()), record.contentId(),
            record.observedAt(), record.observedAt(),
            true, null);
    }

    public static SourceView toSourceView(ExtractionRecord record) {
        TrackedSymbol symbol = requireCommon(record, RecordKind.VIEW);
        ExtractionRecord.ViewFields fields = record.view();
        if (fields == null) {
            throw reject(record, "view payload missing");
        }
        ViewBias bias = fields.bias();
        if (bias == null && fields.quadrant() != null) {
            bias = fields.quadrant().bias();
        }
        if (bias == null) {
            throw reject(record, "view bias missing and no quadrant to derive it from");
        }
        double confidence = confidence(record, fields.confidence());

        return new SourceView(
            symbol, record.source(), bias, fields.quadrant(), fields.ivRegime(),
            fields.waveDegree(), fields.wavePosition(), fields.waveDirection(), fields.wavePhase(),
            fields.primaryTarget(), fields.primarySupport(), fields.invalidation(),
            fields.strategyRec(), fields.keyStrikes(), fields.notes(),
            confidence, record.contentId(), record.observedAt());
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static TrackedSymbol requireCommon(ExtractionRecord record, RecordKind expected) {
        if (record.kind() != expected) {
            throw reject(record, "expected kind " + expected.id() + " but was " + record.kind());
        }
        if (record.source() == null) {
            throw reject(record, "source missing or unknown");
        }
        if (record.observedAt() == null) {
            throw reject(record, "observedAt missing");
        }
        return SymbolNormalizer.normalize(record.symbolText())
            .orElseThrow(() -> reject(record, "symbol '" + record.symbolText() + "' is not tracked"));
    }

    private static double confidence(ExtractionRecord record, Double raw) {
        double confidence = raw != null ? raw : DEFAULT_CONFIDENCE;
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw reject(record, "confidence " + raw + " outside [0,1]");
        }
        return confidence;
    }

    private static String truncate(String snippet) {
        if (snippet == null) return null;
        String trimmed = snippet.trim();
        return trimmed.length() > MAX_SNIPPET_LENGTH ? trimmed.substring(0, MAX_SNIPPET_LENGTH) : trimmed;
    }

    private static RejectedRecordException reject(ExtractionRecord record, String reason) {
        return new RejectedRecordException(record.contentId(), reason);
    }
}
