package com.codeheadsystems.delegate.server.manager;

import static com.codeheadsystems.delegate.server.model.DenialReason.DAILY_LIMIT_EXCEEDED;
import static com.codeheadsystems.delegate.server.model.DenialReason.SESSION_KEY_EXPIRED;
import static com.codeheadsystems.delegate.server.model.DenialReason.SESSION_KEY_INACTIVE;
import static com.codeheadsystems.delegate.server.model.DenialReason.SESSION_KEY_NOT_FOUND;
import static com.codeheadsystems.delegate.server.model.DenialReason.SPENDING_LIMIT_EXCEEDED;
import static com.codeheadsystems.delegate.server.model.DenialReason.TARGET_NOT_ALLOWED;

import com.codeheadsystems.delegate.server.model.AuthorizationDecision;
import com.codeheadsystems.delegate.server.model.SessionKey;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Pure policy check of one operation against a session key. The first failing check wins, in
 * this order: existence, active, expiry, target, per-operation cap, daily cap.
 */
@Singleton
public class PolicyEvaluator {

  private final UsageTracker usageTracker;

  @Inject
  public PolicyEvaluator(UsageTracker usageTracker) {
    this.usageTracker = usageTracker;
  }

  /**
   * Evaluates an operation.
   *
   * @param record the record, empty if none exists
   * @param target normalized target of the operation
   * @param value  non-negative value of the operation
   * @param now    reference time; the key is usable strictly before its expiry
   * @return the decision
   */
  public AuthorizationDecision evaluate(Optional<SessionKey> record, String target, BigInteger value,
                                        Instant now) {
    if (record.isEmpty()) {
      return AuthorizationDecision.deny(SESSION_KEY_NOT_FOUND);
    }
    SessionKey key = record.get();
    if (!key.active()) {
      return AuthorizationDecision.deny(SESSION_KEY_INACTIVE);
    }
    if (!now.isBefore(key.expiryTime())) {
      return AuthorizationDecision.deny(SESSION_KEY_EXPIRED);
    }
    if (!key.permitsTarget(target)) {
      return AuthorizationDecision.deny(TARGET_NOT_ALLOWED);
    }
    if (value.compareTo(key.spendingLimit()) > 0) {
      return AuthorizationDecision.deny(SPENDING_LIMIT_EXCEEDED, key.spendingLimit(), value);
    }
    BigInteger projected = usageTracker.effectiveUsedToday(key, now).add(value);
    if (projected.compareTo(key.dailyLimit()) > 0) {
      return AuthorizationDecision.deny(DAILY_LIMIT_EXCEEDED, key.dailyLimit(), projected);
    }
    return AuthorizationDecision.allow();
  }
}
