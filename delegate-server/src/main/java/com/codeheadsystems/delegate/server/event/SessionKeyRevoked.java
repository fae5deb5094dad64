package com.codeheadsystems.delegate.server.event;

import java.time.Instant;

/**
 * A single session key was revoked.
 *
 * @param accountId  the account
 * @param keyId      the key
 * @param occurredAt when
 */
public record SessionKeyRevoked(String accountId, String keyId, Instant occurredAt)
    implements SessionKeyEvent {

  @Override
  public String type() {
    return "SessionKeyRevoked";
  }
}
