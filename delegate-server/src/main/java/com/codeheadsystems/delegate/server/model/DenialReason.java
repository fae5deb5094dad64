package com.codeheadsystems.delegate.server.model;

/**
 * Why a session key operation was denied, in evaluation order.
 */
public enum DenialReason {
  SESSION_KEY_NOT_FOUND("Session key not found"),
  SESSION_KEY_INACTIVE("Session key inactive"),
  SESSION_KEY_EXPIRED("Session key expired"),
  TARGET_NOT_ALLOWED("Target not allowed"),
  SPENDING_LIMIT_EXCEEDED("Exceeds spending limit"),
  DAILY_LIMIT_EXCEEDED("Exceeds daily limit");

  private final String message;

  DenialReason(String message) {
    this.message = message;
  }

  /**
   * Message string.
   *
   * @return the human-readable message for this reason
   */
  public String message() {
    return message;
  }
}
