package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Full view of a stored session key record.
 * <p>
 * {@code usedToday} is the value as stored; it only reflects the current day when
 * {@code lastUsedDay} equals today's day index.  Use the usage endpoint for a reconciled view.
 *
 * @param accountId      owning account
 * @param keyId          delegated key identity
 * @param spendingLimit  per-operation cap (decimal string)
 * @param dailyLimit     daily cap (decimal string)
 * @param usedToday      stored consumption for {@code lastUsedDay} (decimal string)
 * @param lastUsedDay    day index (days since the unix epoch, UTC) the usage belongs to
 * @param expiryTime     unix timestamp (seconds) of expiry
 * @param allowedTargets allow-listed targets; empty means unrestricted
 * @param active         false once the key has been revoked
 */
public record SessionKeyResponse(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("keyId") String keyId,
    @JsonProperty("spendingLimit") String spendingLimit,
    @JsonProperty("dailyLimit") String dailyLimit,
    @JsonProperty("usedToday") String usedToday,
    @JsonProperty("lastUsedDay") long lastUsedDay,
    @JsonProperty("expiryTime") long expiryTime,
    @JsonProperty("allowedTargets") List<String> allowedTargets,
    @JsonProperty("active") boolean active) {
}
