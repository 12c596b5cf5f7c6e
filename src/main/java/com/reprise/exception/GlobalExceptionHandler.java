package com.reprise.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps exceptions escaping the controllers to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                               ServerHttpRequest request) {
        String path = pathOf(request);
        log.warn("IllegalArgumentException at {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.ofValidation(ex.getMessage(), path));
    }

    /**
     * Unreadable body, unknown enum constant and the like.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerHttpRequest request) {
        String path = pathOf(request);
        log.warn("Bad request at {}: {}", path, ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.ofValidation(ex.getReason(), path));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException ex,
                                                                  ServerHttpRequest request) {
        String path = pathOf(request);
        log.error("Storage unavailable at {}: tier={}", path, ex.getTier(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.ofStorageUnavailable(ex.getMessage(), path));
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailable(UpstreamUnavailableException ex,
                                                                   ServerHttpRequest request) {
        String path = pathOf(request);
        log.error("Upstream unavailable at {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.ofUpstreamUnavailable(ex.getMessage(), path));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerHttpRequest request) {
        String path = pathOf(request);
        log.error("Unexpected error at {}", path, ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.ofInternal("Internal server error", path));
    }

    private String pathOf(ServerHttpRequest request) {
        return request != null ? request.getPath().value() : null;
    }
}
