package com.rebenew.tandem.syncserver.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<Map<String, String>> handleSyncException(SyncException e) {
        return ResponseEntity.status(statusOf(e.getKind()))
                .body(Map.of("error", e.getCode(), "message", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", SyncException.INVALID_REQUEST, "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        logger.error("🚨 Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "internal_server_error", "message", "Unexpected error"));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case INVALID:
                return HttpStatus.BAD_REQUEST;
            case TRANSIENT:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
