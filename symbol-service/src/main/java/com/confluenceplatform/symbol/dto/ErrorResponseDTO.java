package com.confluenceplatform.symbol.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(
    String error,
    String symbol,
    Long   levelId,
    String contentId,
    String message
) {
    public static ErrorResponseDTO symbolNotFound(String symbol, String message) {
        return new ErrorResponseDTO("SYMBOL_NOT_FOUND", symbol, null, null, message);
    }

    public static ErrorResponseDTO levelNotFound(long levelId, String message) {
        return new ErrorResponseDTO("LEVEL_NOT_FOUND", null, levelId, null, message);
    }

    public static ErrorResponseDTO extractionFailed(String contentId, String message) {
        return new ErrorResponseDTO("EXTRACTION_FAILED", null, null, contentId, message);
    }

    public static ErrorResponseDTO badRequest(String message) {
        return new ErrorResponseDTO("BAD_REQUEST", null, null, null, message);
    }
}
