package com.codeheadsystems.delegate.server.event;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Limits of a session key were replaced.
 *
 * @param accountId        the account
 * @param keyId            the key
 * @param oldSpendingLimit previous per-operation cap
 * @param oldDailyLimit    previous daily cap
 * @param newSpendingLimit new per-operation cap
 * @param newDailyLimit    new daily cap
 * @param occurredAt       when
 */
public record SessionKeyLimitsUpdated(String accountId, String keyId,
                                      BigInteger oldSpendingLimit, BigInteger oldDailyLimit,
                                      BigInteger newSpendingLimit, BigInteger newDailyLimit,
                                      Instant occurredAt) implements SessionKeyEvent {

  @Override
  public String type() {
    return "SessionKeyLimitsUpdated";
  }
}
