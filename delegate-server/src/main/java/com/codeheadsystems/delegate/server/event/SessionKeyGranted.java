package com.codeheadsystems.delegate.server.event;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Set;

/**
 * A new session key was granted.
 *
 * @param accountId      the account
 * @param keyId          the key
 * @param spendingLimit  per-operation cap
 * @param dailyLimit     daily cap
 * @param expiryTime     expiry
 * @param allowedTargets allow-list, empty when unrestricted
 * @param occurredAt     when
 */
public record SessionKeyGranted(String accountId, String keyId, BigInteger spendingLimit,
                                BigInteger dailyLimit, Instant expiryTime, Set<String> allowedTargets,
                                Instant occurredAt) implements SessionKeyEvent {

  @Override
  public String type() {
    return "SessionKeyGranted";
  }
}
