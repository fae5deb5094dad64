package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A candidate operation a session key wants to perform.
 * <p>
 * Used by both the read-only validity check and the budget-consuming authorization:
 * {@code POST /accounts/{accountId}/session-keys/{keyId}/validity} and
 * {@code POST /accounts/{accountId}/session-keys/{keyId}/authorizations}.
 *
 * @param target identity the operation acts against
 * @param value  value moved by the operation (decimal string, wei)
 */
public record OperationRequest(
    @JsonProperty("target") String target,
    @JsonProperty("value") String value) {
}
