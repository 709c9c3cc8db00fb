package com.confluenceplatform.symbol.exception;

/**
 * The Extraction Service could not be reached or answered with an error. No record of the
 * failed call has been ingested.
 */
public class ExtractionServiceException extends RuntimeException {
    private final String contentId;

    public ExtractionServiceException(String contentId, String message, Throwable cause) {
        super(message, cause);
        this.contentId = contentId;
    }

    public String getContentId() {
        return contentId;
    }
}
