package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.trace.TraceContextUtil;
import com.confluenceplatform.symbol.client.ExtractionServiceClient;
import com.confluenceplatform.symbol.dto.BatchIngestResultDTO;
import com.confluenceplatform.symbol.logger.IngestionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Pulls candidate records for one content item from the Extraction Service and ingests
 * them as a batch.
 *
 * <p>The HTTP call runs outside any symbol lock; locks are only taken per record during
 * ingestion. If the call fails nothing is ingested and the error propagates.
 */
@Service
public class ContentExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractionService.class);

    private final ExtractionServiceClient extractionClient;
    private final IngestionService ingestionService;
    private final IngestionFlowLogger flowLogger;

    public ContentExtractionService(ExtractionServiceClient extractionClient,
                                    IngestionService ingestionService,
                                    IngestionFlowLogger flowLogger) {
        this.extractionClient = extractionClient;
        this.ingestionService = ingestionService;
        this.flowLogger       = flowLogger;
    }

    public Mono<BatchIngestResultDTO> extractAndIngest(String contentId, String sourceId) {
        SignalSource source = null;
        if (sourceId != null && !sourceId.isBlank()) {
            source = SignalSource.fromId(sourceId);
            if (source == null) {
                return Mono.error(new IllegalArgumentException("Unknown source: " + sourceId));
            }
        }
        SignalSource requested = source;
        String traceId = TraceContextUtil.traceIdFor(contentId);

        Mono<BatchIngestResultDTO> pipeline = Mono.just(contentId)
            .doOnEach(flowLogger.stage(IngestionFlowLogger.EXTRACTION_REQUESTED))
            .flatMap(id -> extractionClient.extract(id, requested))
            .doOnEach(flowLogger.stage(IngestionFlowLogger.RECORDS_RECEIVED))
            .map(records -> ingestionService.ingestAll(records, traceId))
            .doOnError(e -> log.error("Content extraction failed. contentId={} source={} traceId={}",
                                      contentId, sourceId, traceId, e));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
