package com.weave.sampleapp.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Unit tests for {@link GlobalExceptionHandler}, without a Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("maps multipart failures to 400 Bad request")
    void multipart() {
        ResponseEntity<String> result = handler.handleMultipart(new MaxUploadSizeExceededException(1024));

        assertThat(result.getStatusCode().value()).isEqualTo(400);
        assertThat(result.getBody()).isEqualTo("Bad request");
    }

    @Test
    @DisplayName("maps any other failure to 500 with the raw message as text")
    void generic() {
        ResponseEntity<String> result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        assertThat(result.getBody()).isEqualTo("something broke");
        assertThat(result.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_PLAIN)).isTrue();
    }

    @Test
    @DisplayName("uses an empty body when the failure has no message")
    void nullMessage() {
        assertThat(handler.handleGeneric(new RuntimeException()).getBody()).isEmpty();
    }
}
