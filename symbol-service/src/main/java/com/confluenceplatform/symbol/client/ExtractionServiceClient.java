package com.confluenceplatform.symbol.client;

import com.confluenceplatform.common.event.ExtractionRecord;
import com.confluenceplatform.common.model.SignalSource;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Boundary to the external Extraction Service, which turns one content item into
 * candidate records.
 *
 * <p>Implementations fail with
 * {@link com.confluenceplatform.symbol.exception.ExtractionServiceException} and never block
 * a reactor thread.
 */
public interface ExtractionServiceClient {

    Mono<List<ExtractionRecord>> extract(String contentId, SignalSource source);
}
