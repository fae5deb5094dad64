package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Every session key record an account has ever granted, revoked ones included.
 *
 * @param accountId   owning account
 * @param sessionKeys the records
 */
public record SessionKeyListResponse(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("sessionKeys") List<SessionKeyResponse> sessionKeys) {
}
