package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of revoking a single key.
 *
 * @param keyId   the key
 * @param revoked true if this call deactivated the key, false if it was already inactive
 */
public record RevokeResponse(
    @JsonProperty("keyId") String keyId,
    @JsonProperty("revoked") boolean revoked) {
}
