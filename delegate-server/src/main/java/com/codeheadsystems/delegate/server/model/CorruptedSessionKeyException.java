package com.codeheadsystems.delegate.server.model;

/**
 * Thrown when a stored record violates the limit invariants
 * ({@code spendingLimit <= dailyLimit}, {@code 0 <= usedToday <= dailyLimit}).
 * <p>
 * This is never a policy outcome: it means a boundary check was bypassed or storage was
 * tampered with, and the operation must fail rather than approve or deny.
 */
public class CorruptedSessionKeyException extends IllegalStateException {

  private final SessionKeyId sessionKeyId;

  /**
   * Instantiates a new Corrupted session key exception.
   *
   * @param sessionKeyId the record address
   * @param message      what is wrong with it
   */
  public CorruptedSessionKeyException(SessionKeyId sessionKeyId, String message) {
    super("Corrupted session key " + sessionKeyId + ": " + message);
    this.sessionKeyId = sessionKeyId;
  }

  public SessionKeyId sessionKeyId() {
    return sessionKeyId;
  }
}
