package com.moonscribe.rag.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body. {@code required} and {@code balance} are only set for insufficient credits.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String stage,
        Integer required,
        Integer balance
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null, null, null);
    }

    public static ErrorResponse of(String error, String stage) {
        return new ErrorResponse(error, stage, null, null);
    }
}
