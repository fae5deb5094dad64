package com.codeheadsystems.delegate.server.event;

import java.time.Instant;
import java.util.List;

/**
 * Every active session key of an account was revoked in one step. Emitted even when
 * nothing was active, with a count of zero.
 *
 * @param accountId  the account
 * @param count      number of keys revoked
 * @param keyIds     the revoked keys
 * @param occurredAt when
 */
public record EmergencyRevokeAll(String accountId, int count, List<String> keyIds, Instant occurredAt)
    implements SessionKeyEvent {

  @Override
  public String type() {
    return "EmergencyRevokeAll";
  }
}
