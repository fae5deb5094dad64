package com.codeheadsystems.delegate.server.store;

import com.codeheadsystems.delegate.server.model.SessionKey;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * On-disk JSON form of a {@link SessionKey}. Amounts are decimal strings so 256-bit values
 * survive any JSON reader; instants are ISO-8601 strings.
 */
record StoredSessionKey(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("keyId") String keyId,
    @JsonProperty("spendingLimit") String spendingLimit,
    @JsonProperty("dailyLimit") String dailyLimit,
    @JsonProperty("usedToday") String usedToday,
    @JsonProperty("lastUsedDay") long lastUsedDay,
    @JsonProperty("expiryTime") String expiryTime,
    @JsonProperty("allowedTargets") List<String> allowedTargets,
    @JsonProperty("active") boolean active,
    @JsonProperty("createdAt") String createdAt) {

  static StoredSessionKey from(SessionKey key) {
    return new StoredSessionKey(key.accountId(), key.keyId(),
        key.spendingLimit().toString(), key.dailyLimit().toString(), key.usedToday().toString(),
        key.lastUsedDay(), key.expiryTime().toString(), List.copyOf(key.allowedTargets()),
        key.active(), key.createdAt().toString());
  }

  SessionKey toSessionKey() {
    return new SessionKey(accountId, keyId,
        new BigInteger(spendingLimit), new BigInteger(dailyLimit), new BigInteger(usedToday),
        lastUsedDay, Instant.parse(expiryTime),
        allowedTargets == null ? Set.of() : new TreeSet<>(allowedTargets),
        active, Instant.parse(createdAt));
  }
}
