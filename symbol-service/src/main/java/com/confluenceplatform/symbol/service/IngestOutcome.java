package com.confluenceplatform.symbol.service;

/**
 * What happened to one ingested record. {@link #STALE_WRITE_IGNORED} and {@link #REJECTED}
 * leave the stores unchanged.
 */
public enum IngestOutcome {
    LEVEL_INSERTED,
    LEVEL_MERGED,
    VIEW_UPDATED,
    STALE_WRITE_IGNORED,
    REJECTED
}
