package com.confluenceplatform.symbol.logger;

import com.confluenceplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Logs each stage an extraction record passes through on its way into the stores.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #EXTRACTION_REQUESTED} — content item sent to the Extraction Service</li>
 *   <li>{@link #RECORDS_RECEIVED}     — records returned (or posted directly)</li>
 *   <li>{@link #LEVEL_INSERTED} / {@link #LEVEL_MERGED} / {@link #VIEW_UPDATED}</li>
 *   <li>{@link #STALE_WRITE_IGNORED}  — older than stored data, dropped (DEBUG)</li>
 *   <li>{@link #RECORD_REJECTED}      — failed validation (WARN)</li>
 *   <li>{@link #BATCH_COMPLETED}      — per-outcome counts for a batch</li>
 * </ol>
 * The trace id is bridged into MDC only for the duration of each log call.
 */
@Component
public class IngestionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(IngestionFlowLogger.class);

    public static final String EXTRACTION_REQUESTED = "EXTRACTION_REQUESTED";
    public static final String RECORDS_RECEIVED     = "RECORDS_RECEIVED";
    public static final String LEVEL_INSERTED       = "LEVEL_INSERTED";
    public static final String LEVEL_MERGED         = "LEVEL_MERGED";
    public static final String VIEW_UPDATED         = "VIEW_UPDATED";
    public static final String STALE_WRITE_IGNORED  = "STALE_WRITE_IGNORED";
    public static final String RECORD_REJECTED      = "RECORD_REJECTED";
    public static final String BATCH_COMPLETED      = "BATCH_COMPLETED";

    /** {@code doOnEach} consumer reading the trace id from the Reactor Context; fires on onNext only. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[IngestionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void stored(String stageName, String traceId, String symbol, String source, Long levelId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[IngestionFlow] stage={} traceId={} symbol={} source={} levelId={}",
                     stageName, traceId, symbol, source, levelId)
        );
    }

    public void staleWrite(String traceId, String symbol, String source, String kind) {
        TraceContextUtil.withMdc(traceId, () ->
            log.debug("[IngestionFlow] stage={} traceId={} symbol={} source={} kind={}",
                      STALE_WRITE_IGNORED, traceId, symbol, source, kind)
        );
    }

    public void rejected(String traceId, String contentId, String source, String symbolText, String reason) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[IngestionFlow] stage={} traceId={} contentId={} source={} symbolText={} reason={}",
                     RECORD_REJECTED, traceId, contentId, source, symbolText, reason)
        );
    }

    public void batchCompleted(String traceId, int received, Map<?, Integer> counts) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[IngestionFlow] stage={} traceId={} received={} outcomes={}",
                     BATCH_COMPLETED, traceId, received, counts)
        );
    }
}
