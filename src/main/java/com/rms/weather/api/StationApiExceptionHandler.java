package com.rms.weather.api;

import com.rms.weather.core.store.TransientStoreException;
import com.rms.weather.query.StationNotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError} bodies:
 * 404 not_found, 503 unavailable, 400 bad_request, 500 internal_error.
 * Stack traces stay in the server log.
 */
@RestControllerAdvice
public class StationApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(StationApiExceptionHandler.class);

    @ExceptionHandler(StationNotFoundException.class)
    public ResponseEntity<ApiError> notFound(StationNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", e.getMessage()));
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<ApiError> unavailable(TransientStoreException e) {
        log.warn("Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError("unavailable", "Not enough replicas available (required="
                        + e.getRequiredAcks() + ")"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> invalidBody(WebExchangeBindException e) {
        String msg = e.getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ApiError("bad_request", msg));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> unreadableBody(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        log.error("Station endpoint failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("internal_error", "Request failed"));
    }
}
