package com.weave.sampleapp.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * View model of the person pages.
 *
 * @param name display name
 */
public record Person(@JsonProperty("Name") String name) {
}
