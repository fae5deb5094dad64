package com.codeheadsystems.delegate.server.event;

import java.time.Instant;

/**
 * Expiry of a session key was pushed later.
 *
 * @param accountId     the account
 * @param keyId         the key
 * @param oldExpiryTime previous expiry
 * @param newExpiryTime new expiry
 * @param occurredAt    when
 */
public record SessionKeyExpiryExtended(String accountId, String keyId, Instant oldExpiryTime,
                                       Instant newExpiryTime, Instant occurredAt)
    implements SessionKeyEvent {

  @Override
  public String type() {
    return "SessionKeyExpiryExtended";
  }
}
