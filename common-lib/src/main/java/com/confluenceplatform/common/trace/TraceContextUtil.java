package com.confluenceplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries an ingestion trace id through reactive pipelines.
 *
 * <p>The id lives in the Reactor Context; MDC is only populated for the duration of a
 * single log statement. Ingestion requests derive the id from the content item so that
 * every record extracted from one item logs under the same id.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /** {@code content-<contentId>} when a content id is known, otherwise a random id. */
    public static String traceIdFor(String contentId) {
        if (contentId == null || contentId.isBlank()) {
            return "adhoc-" + UUID.randomUUID().toString().substring(0, 8);
        }
        return "content-" + contentId.trim();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never {@code null}; {@code "unknown"} when absent. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
