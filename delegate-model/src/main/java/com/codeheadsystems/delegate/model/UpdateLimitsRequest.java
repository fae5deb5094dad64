package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for replacing the limits of an existing session key.
 * <p>
 * The consumed budget for the current day is kept; only the caps move.
 * <p>
 * Used by: {@code PUT /accounts/{accountId}/session-keys/{keyId}/limits}
 *
 * @param spendingLimit new per-operation cap (decimal string)
 * @param dailyLimit    new daily cap (decimal string), at least {@code spendingLimit}
 */
public record UpdateLimitsRequest(
    @JsonProperty("spendingLimit") String spendingLimit,
    @JsonProperty("dailyLimit") String dailyLimit) {
}
