package com.datapipe.orchestrator.api.dto;

/** Body of every 4xx/5xx produced by ApiExceptionHandler. */
public record ErrorResponse(boolean success, String error) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error);
    }
}
