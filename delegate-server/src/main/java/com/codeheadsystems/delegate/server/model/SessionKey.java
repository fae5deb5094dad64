package com.codeheadsystems.delegate.server.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A delegated session key and its rolling usage state.
 * <p>
 * Instances are immutable; every mutation produces a copy through one of the {@code with*}
 * methods.  The record itself does not enforce the limit invariants so that a corrupted record
 * read back from storage can still be represented and reported; the manager checks them on
 * every read.
 *
 * @param accountId      owning account (normalized)
 * @param keyId          delegated key identity (normalized)
 * @param spendingLimit  per-operation cap
 * @param dailyLimit     cap on cumulative value per UTC day
 * @param usedToday      value consumed during {@code lastUsedDay}
 * @param lastUsedDay    day index the {@code usedToday} counter belongs to
 * @param expiryTime     the key is usable strictly before this instant
 * @param allowedTargets allow-listed targets (normalized); empty means unrestricted
 * @param active         lifecycle flag, false once revoked
 * @param createdAt      when the key was granted
 */
public record SessionKey(
    String accountId,
    String keyId,
    BigInteger spendingLimit,
    BigInteger dailyLimit,
    BigInteger usedToday,
    long lastUsedDay,
    Instant expiryTime,
    Set<String> allowedTargets,
    boolean active,
    Instant createdAt) {

  public SessionKey {
    Objects.requireNonNull(accountId, "accountId");
    Objects.requireNonNull(keyId, "keyId");
    Objects.requireNonNull(spendingLimit, "spendingLimit");
    Objects.requireNonNull(dailyLimit, "dailyLimit");
    Objects.requireNonNull(usedToday, "usedToday");
    Objects.requireNonNull(expiryTime, "expiryTime");
    Objects.requireNonNull(createdAt, "createdAt");
    allowedTargets = Collections.unmodifiableSortedSet(new TreeSet<>(allowedTargets));
  }

  /**
   * Id session key id.
   *
   * @return the address of this record
   */
  public SessionKeyId id() {
    return new SessionKeyId(accountId, keyId);
  }

  /**
   * Whether the key may act against the given (normalized) target.
   *
   * @param target the target
   * @return true if the allow-list is empty or contains the target
   */
  public boolean permitsTarget(String target) {
    return allowedTargets.isEmpty() || allowedTargets.contains(target);
  }

  public SessionKey withActive(boolean newActive) {
    return new SessionKey(accountId, keyId, spendingLimit, dailyLimit, usedToday, lastUsedDay,
        expiryTime, allowedTargets, newActive, createdAt);
  }

  public SessionKey withLimits(BigInteger newSpendingLimit, BigInteger newDailyLimit) {
    return new SessionKey(accountId, keyId, newSpendingLimit, newDailyLimit, usedToday, lastUsedDay,
        expiryTime, allowedTargets, active, createdAt);
  }

  public SessionKey withExpiryTime(Instant newExpiryTime) {
    return new SessionKey(accountId, keyId, spendingLimit, dailyLimit, usedToday, lastUsedDay,
        newExpiryTime, allowedTargets, active, createdAt);
  }

  public SessionKey withUsage(BigInteger newUsedToday, long newLastUsedDay) {
    return new SessionKey(accountId, keyId, spendingLimit, dailyLimit, newUsedToday, newLastUsedDay,
        expiryTime, allowedTargets, active, createdAt);
  }
}
