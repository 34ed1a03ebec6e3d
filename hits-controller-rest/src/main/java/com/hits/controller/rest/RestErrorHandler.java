package com.hits.controller.rest;

import com.hits.service.core.counter.StoreUnavailableException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/**
 * Maps engine failures to JSON payloads: invalid keys are client errors, an unavailable
 * store is a retryable 503. Anything else falls through to Spring Boot's error handling.
 */
@ControllerAdvice
@Slf4j
public class RestErrorHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorPayload> handleBadRequest(IllegalArgumentException ex, WebRequest request) {
        log.warn("Rejected request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request, NoCacheHeaders.create());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorPayload> handleStoreUnavailable(StoreUnavailableException ex, WebRequest request) {
        HttpHeaders headers = NoCacheHeaders.create();
        headers.set(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Counter store temporarily unavailable", request, headers);
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, String message, WebRequest request, HttpHeaders headers) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
        return ResponseEntity.status(status).headers(headers).body(body);
    }
}
