package com.weave.sampleapp.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;

/**
 * Model bound and echoed by the {@code /car} route. Properties serialize in PascalCase.
 *
 * @param name   model name
 * @param make   manufacturer
 * @param wheels number of wheels
 * @param built  build date-time, ISO-8601 without offset
 */
public record Car(
        @JsonProperty("Name") String name,
        @JsonProperty("Make") String make,
        @JsonProperty("Wheels") int wheels,
        @JsonProperty("Built") LocalDateTime built) {
}
