package com.codeheadsystems.delegate.server.event;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Usage was recorded against a session key.
 *
 * @param accountId  the account
 * @param keyId      the key
 * @param target     target of the operation
 * @param value      value consumed
 * @param usedToday  cumulative consumption for the day after this operation
 * @param dayIndex   the day the consumption was booked to
 * @param occurredAt when
 */
public record SessionKeyUsed(String accountId, String keyId, String target, BigInteger value,
                             BigInteger usedToday, long dayIndex, Instant occurredAt)
    implements SessionKeyEvent {

  @Override
  public String type() {
    return "SessionKeyUsed";
  }
}
