package com.codeheadsystems.delegate.server.model;

/**
 * Expected, recoverable failures of the lifecycle and query operations.
 */
public enum SessionKeyError {
  /**
   * No record exists for the (account, key) pair.
   */
  NOT_FOUND,
  /**
   * The account identity is the zero identity.
   */
  INVALID_ACCOUNT,
  /**
   * The key identity is the zero identity.
   */
  INVALID_KEY,
  /**
   * A limit is missing, negative, wider than 256 bits, or the daily limit is below the spending limit.
   */
  INVALID_LIMITS,
  /**
   * The expiry is not strictly later than the reference time.
   */
  INVALID_EXPIRY,
  /**
   * The allow-list contains a blank entry.
   */
  INVALID_TARGETS,
  /**
   * A record, active or revoked, already exists for the (account, key) pair.
   */
  ALREADY_EXISTS
}
