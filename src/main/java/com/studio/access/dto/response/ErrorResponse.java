package com.studio.access.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    String status,
    int code,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public static final String STATUS_ERROR = "error";

    public ErrorResponse(int code, String error, String message,
                         Instant timestamp, String path) {
        this(STATUS_ERROR, code, error, message, timestamp, path, List.of());
    }

    public ErrorResponse(int code, String error, String message,
                         Instant timestamp, String path, List<FieldError> fieldErrors) {
        this(STATUS_ERROR, code, error, message, timestamp, path, fieldErrors);
    }

    public record FieldError(String field, String message) {}
}
