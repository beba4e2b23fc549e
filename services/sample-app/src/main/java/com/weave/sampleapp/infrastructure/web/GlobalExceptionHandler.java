package com.weave.sampleapp.infrastructure.web;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;

/**
 * Maps failures raised outside the router to plain-text responses.
 *
 * <p>The router has its own error boundary; this advice only sees what the host throws before or
 * after routing, such as an oversized multipart body. Responses keep the router's contract:
 * {@code text/plain} with the raw failure message for a 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<String> handleMultipart(MultipartException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return text(HttpStatus.BAD_REQUEST, "Bad request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGeneric(Exception ex) {
        log.error("An unhandled exception has occurred while executing the request.", ex);
        return text(HttpStatus.INTERNAL_SERVER_ERROR, Objects.toString(ex.getMessage(), ""));
    }

    private static ResponseEntity<String> text(HttpStatus status, String body) {
        return ResponseEntity.status(status)
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(body);
    }
}
