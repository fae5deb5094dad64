package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for pushing a session key's expiry further into the future.
 * <p>
 * Used by: {@code PUT /accounts/{accountId}/session-keys/{keyId}/expiry}
 *
 * @param expiryTime new unix timestamp (seconds); must be later than the current expiry
 */
public record ExtendExpiryRequest(@JsonProperty("expiryTime") Long expiryTime) {
}
