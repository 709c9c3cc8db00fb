package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.symbol.service.IngestOutcome;

import java.util.List;
import java.util.Map;

/**
 * Aggregate result of a batch; a rejected record never aborts the rest of the batch.
 *
 * @param received   number of records in the request
 * @param counts     records per outcome, every outcome present
 * @param results    per-record results in request order
 * @param rejections rejection reasons in request order
 */
public record BatchIngestResultDTO(
    int                        received,
    Map<IngestOutcome, Integer> counts,
    List<IngestResultDTO>      results,
    List<String>               rejections
) {}
