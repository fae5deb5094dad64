package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of revoking every active session key of an account at once.
 *
 * @param accountId    the account
 * @param revokedCount number of keys this call deactivated
 */
public record EmergencyRevokeResponse(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("revokedCount") int revokedCount) {
}
