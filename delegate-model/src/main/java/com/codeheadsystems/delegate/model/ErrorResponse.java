package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for rejected lifecycle requests (unknown key, invalid limits, ...).
 *
 * @param error   machine-readable error code, e.g. {@code INVALID_LIMITS}
 * @param message human-readable detail
 */
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message) {
}
