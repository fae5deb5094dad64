package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for granting a new session key to an account.
 * <p>
 * Amounts are decimal strings in the smallest currency unit (wei) so that 256-bit values survive
 * JSON transport without being squeezed through a floating-point type.  The expiry is an absolute
 * unix timestamp in seconds and must be strictly in the future when the grant is processed.
 * <p>
 * An empty (or absent) {@code allowedTargets} list grants the key authority against any target.
 * <p>
 * Used by: {@code POST /accounts/{accountId}/session-keys}
 *
 * @param keyId          identity of the delegated key, never the zero identity
 * @param spendingLimit  maximum value for a single authorized operation
 * @param dailyLimit     maximum cumulative value per UTC day; must be at least {@code spendingLimit}
 * @param expiryTime     unix timestamp (seconds) after which the key is unusable
 * @param allowedTargets targets the key may act against; empty means unrestricted
 */
public record GrantRequest(
    @JsonProperty("keyId") String keyId,
    @JsonProperty("spendingLimit") String spendingLimit,
    @JsonProperty("dailyLimit") String dailyLimit,
    @JsonProperty("expiryTime") Long expiryTime,
    @JsonProperty("allowedTargets") List<String> allowedTargets) {
}
