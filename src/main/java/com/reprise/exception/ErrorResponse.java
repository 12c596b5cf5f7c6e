package com.reprise.exception;

import java.time.Instant;

/**
 * Common JSON error body.
 */
public class ErrorResponse {

    private final String code;
    private final String message;
    private final Instant timestamp;
    private final String path;

    public ErrorResponse(String code, String message, Instant timestamp, String path) {
        this.code = code;
        this.message = message;
        this.timestamp = timestamp;
        this.path = path;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getPath() {
        return path;
    }

    public static ErrorResponse ofValidation(String message, String path) {
        return new ErrorResponse("VALIDATION_ERROR", message, Instant.now(), path);
    }

    public static ErrorResponse ofStorageUnavailable(String message, String path) {
        return new ErrorResponse("STORAGE_UNAVAILABLE", message, Instant.now(), path);
    }

    public static ErrorResponse ofUpstreamUnavailable(String message, String path) {
        return new ErrorResponse("UPSTREAM_UNAVAILABLE", message, Instant.now(), path);
    }

    public static ErrorResponse ofInternal(String message, String path) {
        return new ErrorResponse("INTERNAL_SERVER_ERROR", message, Instant.now(), path);
    }
}
