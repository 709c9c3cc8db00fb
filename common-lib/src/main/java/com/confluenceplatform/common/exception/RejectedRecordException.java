package com.confluenceplatform.common.exception;

/**
 * Raised when an extraction record cannot be ingested: unknown symbol, missing required
 * field, or an out-of-range price/confidence. Always confined to the single record.
 */
public class RejectedRecordException extends RuntimeException {
    private final String contentId;

    public RejectedRecordException(String contentId, String message) {
        super("[content=" + contentId + "] " + message);
        this.contentId = contentId;
    }

    public String getContentId() {
        return contentId;
    }

    /** Reason without the content prefix, as reported back to the caller. */
    public String getReason() {
        String message = getMessage();
        int idx = message.indexOf("] ");
        return idx >= 0 ? message.substring(idx + 2) : message;
    }
}
