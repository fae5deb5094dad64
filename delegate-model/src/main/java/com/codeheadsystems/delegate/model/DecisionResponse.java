package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of evaluating an operation against a session key's policy.
 * <p>
 * A denial is a normal, expected answer and is always delivered with HTTP 200; callers branch on
 * {@code allowed} and {@code reason} rather than on the status code.
 *
 * @param allowed   whether the operation is permitted
 * @param reason    machine-readable denial reason (e.g. {@code SPENDING_LIMIT_EXCEEDED}); empty when allowed
 * @param message   human-readable denial message (e.g. "Exceeds spending limit"); empty when allowed
 * @param limit     the cap that was hit (decimal string), when the denial is numeric
 * @param attempted the value that was attempted against that cap (decimal string), when numeric
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResponse(
    @JsonProperty("allowed") boolean allowed,
    @JsonProperty("reason") String reason,
    @JsonProperty("message") String message,
    @JsonProperty("limit") String limit,
    @JsonProperty("attempted") String attempted) {
}
