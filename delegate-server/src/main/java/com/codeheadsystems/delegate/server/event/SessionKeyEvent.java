package com.codeheadsystems.delegate.server.event;

import java.time.Instant;

/**
 * Something that happened to one or more session keys of an account.
 */
public interface SessionKeyEvent {

  /**
   * Account id string.
   *
   * @return the account the event belongs to
   */
  String accountId();

  /**
   * Occurred at instant.
   *
   * @return when the event happened, per the manager's clock
   */
  Instant occurredAt();

  /**
   * Short event name used in audit output.
   *
   * @return the type
   */
  String type();
}
