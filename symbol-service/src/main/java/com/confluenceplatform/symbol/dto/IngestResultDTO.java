package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.symbol.service.IngestOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of ingesting one extraction record.
 *
 * @param outcome  what the stores did with the record
 * @param symbol   resolved catalog symbol; null when the record was rejected before resolution
 * @param levelId  id of the inserted or merged-into level, level records only
 * @param reason   rejection reason, only for {@link IngestOutcome#REJECTED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResultDTO(
    IngestOutcome outcome,
    TrackedSymbol symbol,
    SignalSource  source,
    Long          levelId,
    String        contentId,
    String        reason
) {
    public static IngestResultDTO rejected(SignalSource source, String contentId, String reason) {
        return new IngestResultDTO(IngestOutcome.REJECTED, null, source, null, contentId, reason);
    }
}
