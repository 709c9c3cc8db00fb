package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.event.ExtractionRecord;
import com.confluenceplatform.common.event.ExtractionRecordMapper;
import com.confluenceplatform.common.exception.RejectedRecordException;
import com.confluenceplatform.common.level.LevelMergeResult;
import com.confluenceplatform.common.level.LevelMerger;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.trace.TraceContextUtil;
import com.confluenceplatform.symbol.dto.BatchIngestResultDTO;
import com.confluenceplatform.symbol.dto.IngestResultDTO;
import com.confluenceplatform.symbol.logger.IngestionFlowLogger;
import com.confluenceplatform.symbol.store.LevelStore;
import com.confluenceplatform.symbol.store.SourceViewStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes extraction records into the level and view stores.
 *
 * <p>Records are handled one at a time and independently: a rejected record is logged at
 * WARN and reported, never thrown, and the rest of a batch continues. Re-ingesting a record
 * already applied leaves the stores as they were (levels merge into themselves, views are
 * stale writes).
 */
@Service
public class IngestionService {

    private final LevelStore levelStore;
    private final SourceViewStore viewStore;
    private final LevelMerger levelMerger;
    private final IngestionFlowLogger flowLogger;

    public IngestionService(LevelStore levelStore,
                            SourceViewStore viewStore,
                            LevelMerger levelMerger,
                            IngestionFlowLogger flowLogger) {
        this.levelStore  = levelStore;
        this.viewStore   = viewStore;
        this.levelMerger = levelMerger;
        this.flowLogger  = flowLogger;
    }

    public Mono<IngestResultDTO> ingest(ExtractionRecord record) {
        String traceId = TraceContextUtil.traceIdFor(record != null ? record.contentId() : null);
        return Mono.fromCallable(() -> ingestRecord(record, traceId));
    }

    public Mono<BatchIngestResultDTO> ingestBatch(List<ExtractionRecord> records) {
        String traceId = TraceContextUtil.traceIdFor(firstContentId(records));
        return Mono.fromCallable(() -> ingestAll(records, traceId));
    }

    /** Synchronous batch ingestion under a caller-supplied trace id. */
    public BatchIngestResultDTO ingestAll(List<ExtractionRecord> records, String traceId) {
        List<ExtractionRecord> batch = records != null ? records : List.of();
        Map<IngestOutcome, Integer> counts = new EnumMap<>(IngestOutcome.class);
        for (IngestOutcome outcome : IngestOutcome.values()) {
            counts.put(outcome, 0);
        }
        List<IngestResultDTO> results = new ArrayList<>(batch.size());
        List<String> rejections = new ArrayList<>();

        for (ExtractionRecord record : batch) {
            IngestResultDTO result = ingestRecord(record, traceId);
            results.add(result);
            counts.merge(result.outcome(), 1, Integer::sum);
            if (result.outcome() == IngestOutcome.REJECTED) {
                rejections.add(result.reason());
            }
        }

        flowLogger.batchCompleted(traceId, batch.size(), counts);
        return new BatchIngestResultDTO(batch.size(), Collections.unmodifiableMap(counts),
                                        List.copyOf(results), List.copyOf(rejections));
    }

    IngestResultDTO ingestRecord(ExtractionRecord record, String traceId) {
        if (record == null) {
            flowLogger.rejected(traceId, null, null, null, "record is null");
            return IngestResultDTO.rejected(null, null, "record is null");
        }
        try {
            if (record.kind() == null) {
                throw new RejectedRecordException(record.contentId(), "kind missing or unknown");
            }
            return switch (record.kind()) {
                case LEVEL -> ingestLevel(record, traceId);
                case VIEW  -> ingestView(record, traceId);
            };
        } catch (RejectedRecordException e) {
            flowLogger.rejected(traceId, record.contentId(),
                                record.source() != null ? record.source().id() : null,
                                record.symbolText(), e.getReason());
            return IngestResultDTO.rejected(record.source(), record.contentId(), e.getReason());
        }
    }

    // ── per-kind routing ──────────────────────────────────────────────────

    private IngestResultDTO ingestLevel(ExtractionRecord record, String traceId) {
        PriceLevel candidate = ExtractionRecordMapper.toLevelCandidate(record, levelMerger.lowConfidenceFloor());
        LevelMergeResult result = levelStore.ingest(candidate);
        PriceLevel survivor = result.survivor();

        IngestOutcome outcome = switch (result.outcome()) {
            case INSERTED            -> IngestOutcome.LEVEL_INSERTED;
            case MERGED              -> IngestOutcome.LEVEL_MERGED;
            case STALE_WRITE_IGNORED -> IngestOutcome.STALE_WRITE_IGNORED;
        };
        if (outcome == IngestOutcome.STALE_WRITE_IGNORED) {
            flowLogger.staleWrite(traceId, candidate.symbol().name(), candidate.source().id(), "level");
        } else {
            flowLogger.stored(outcome == IngestOutcome.LEVEL_INSERTED
                                  ? IngestionFlowLogger.LEVEL_INSERTED
                                  : IngestionFlowLogger.LEVEL_MERGED,
                              traceId, survivor.symbol().name(), survivor.source().id(), survivor.id());
        }
        return new IngestResultDTO(outcome, survivor.symbol(), survivor.source(), survivor.id(),
                                   record.contentId(), null);
    }

    private IngestResultDTO ingestView(ExtractionRecord record, String traceId) {
        SourceView view = ExtractionRecordMapper.toSourceView(record);
        SourceViewStore.UpsertOutcome upsert = viewStore.upsert(view);

        if (upsert == SourceViewStore.UpsertOutcome.STALE_WRITE_IGNORED) {
            flowLogger.staleWrite(traceId, view.symbol().name(), view.source().id(), "view");
            return new IngestResultDTO(IngestOutcome.STALE_WRITE_IGNORED, view.symbol(), view.source(),
                                       null, record.contentId(), null);
        }
        flowLogger.stored(IngestionFlowLogger.VIEW_UPDATED, traceId,
                          view.symbol().name(), view.source().id(), null);
        return new IngestResultDTO(IngestOutcome.VIEW_UPDATED, view.symbol(), view.source(),
                                   null, record.contentId(), null);
    }

    private static String firstContentId(List<ExtractionRecord> records) {
        if (records == null) return null;
        return records.stream()
            .filter(Objects::nonNull)
            .map(ExtractionRecord::contentId)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
    }
}
