package com.codeheadsystems.delegate.server.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Result of evaluating an operation against a session key's policy.
 * <p>
 * Denials are ordinary values, not exceptions.  For numeric denials {@code limit} and
 * {@code attempted} carry the figures a caller needs to explain the refusal:
 * <ul>
 *   <li>{@link DenialReason#SPENDING_LIMIT_EXCEEDED}: the per-operation cap and the operation value</li>
 *   <li>{@link DenialReason#DAILY_LIMIT_EXCEEDED}: the daily cap and the day's total had the
 *       operation been allowed ({@code usedToday + value})</li>
 * </ul>
 * Both are null for every other outcome.
 *
 * @param allowed   whether the operation is permitted
 * @param reason    denial reason, null when allowed
 * @param limit     cap that was exceeded, when numeric
 * @param attempted value attempted against that cap, when numeric
 */
public record AuthorizationDecision(
    boolean allowed,
    DenialReason reason,
    BigInteger limit,
    BigInteger attempted) {

  private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(true, null, null, null);

  public AuthorizationDecision {
    if (allowed == (reason != null)) {
      throw new IllegalArgumentException("A decision is either allowed or carries a denial reason");
    }
  }

  public static AuthorizationDecision allow() {
    return ALLOWED;
  }

  public static AuthorizationDecision deny(DenialReason reason) {
    return new AuthorizationDecision(false, reason, null, null);
  }

  public static AuthorizationDecision deny(DenialReason reason, BigInteger limit, BigInteger attempted) {
    return new AuthorizationDecision(false, reason, limit, attempted);
  }

  /**
   * Denial reason optional.
   *
   * @return the denial reason, empty when allowed
   */
  public Optional<DenialReason> denialReason() {
    return Optional.ofNullable(reason);
  }

  /**
   * Message string.
   *
   * @return the denial message, or the empty string when allowed
   */
  public String message() {
    return reason == null ? "" : reason.message();
  }
}
