package com.confluenceplatform.symbol.client;

import com.confluenceplatform.common.event.ExtractionRecord;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.trace.TraceContextUtil;
import com.confluenceplatform.symbol.exception.ExtractionServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link ExtractionServiceClient} over HTTP: {@code POST /api/v1/extract} with
 * {@code {contentId, source}}, answered by a JSON array of records.
 *
 * <p>Any transport failure or non-2xx status surfaces as {@link ExtractionServiceException};
 * nothing is retried here.
 */
@Component
public class RestExtractionServiceClient implements ExtractionServiceClient {

    private static final Logger log = LoggerFactory.getLogger(RestExtractionServiceClient.class);

    static final String EXTRACT_PATH = "/api/v1/extract";

    private final WebClient extractionWebClient;

    public RestExtractionServiceClient(@Qualifier("extractionWebClient") WebClient extractionWebClient) {
        this.extractionWebClient = extractionWebClient;
    }

    @Override
    public Mono<List<ExtractionRecord>> extract(String contentId, SignalSource source) {
        String traceId = TraceContextUtil.traceIdFor(contentId);
        return extractionWebClient.post()
            .uri(EXTRACT_PATH)
            .header("X-Trace-Id", traceId)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(new ExtractionRequest(contentId, source))
            .retrieve()
            .bodyToFlux(ExtractionRecord.class)
            .collectList()
            .doOnNext(records -> log.info("Extraction returned. contentId={} source={} records={} traceId={}",
                                          contentId, source != null ? source.id() : null,
                                          records.size(), traceId))
            .onErrorMap(e -> !(e instanceof ExtractionServiceException),
                        e -> new ExtractionServiceException(contentId,
                                 "Extraction Service call failed for content " + contentId + ": " + e.getMessage(), e));
    }
}
