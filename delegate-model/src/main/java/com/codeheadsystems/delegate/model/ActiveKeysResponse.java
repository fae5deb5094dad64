package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Identities of the session keys whose lifecycle flag is still active.
 * Expiry is not considered: an expired but unrevoked key is listed.
 *
 * @param accountId owning account
 * @param keyIds    active key identities, sorted
 */
public record ActiveKeysResponse(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("keyIds") List<String> keyIds) {
}
