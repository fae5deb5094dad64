package com.codeheadsystems.delegate.server.manager;

import static com.codeheadsystems.delegate.server.manager.SessionKeys.NOW;
import static com.codeheadsystems.delegate.server.manager.SessionKeys.OTHER_TARGET;
import static com.codeheadsystems.delegate.server.manager.SessionKeys.TARGET;
import static com.codeheadsystems.delegate.server.manager.SessionKeys.TODAY;
import static com.codeheadsystems.delegate.server.manager.SessionKeys.eth;
import static com.codeheadsystems.delegate.server.manager.SessionKeys.key;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.delegate.server.model.AuthorizationDecision;
import com.codeheadsystems.delegate.server.model.DenialReason;
import com.codeheadsystems.delegate.server.model.SessionKey;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PolicyEvaluatorTest {

  private final PolicyEvaluator evaluator = new PolicyEvaluator(new UsageTracker());

  @Test
  void missingRecord_isNotFound() {
    assertThat(evaluator.evaluate(Optional.empty(), TARGET, BigInteger.ONE, NOW).reason())
        .isEqualTo(DenialReason.SESSION_KEY_NOT_FOUND);
  }

  @Test
  void inactiveWinsOverExpired() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of()).withActive(false);

    AuthorizationDecision decision = evaluator.evaluate(Optional.of(key), TARGET, BigInteger.ONE,
        NOW.plus(Duration.ofDays(1)));

    assertThat(decision.reason()).isEqualTo(DenialReason.SESSION_KEY_INACTIVE);
  }

  @Test
  void expiryBoundary_isExclusive() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of()).withExpiryTime(NOW.plusSeconds(1));

    assertThat(evaluator.evaluate(Optional.of(key), TARGET, BigInteger.ONE, NOW).allowed()).isTrue();
    assertThat(evaluator.evaluate(Optional.of(key), TARGET, BigInteger.ONE, NOW.plusSeconds(1)).reason())
        .isEqualTo(DenialReason.SESSION_KEY_EXPIRED);
  }

  @Test
  void expiredWinsOverTarget() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of(TARGET));

    assertThat(evaluator.evaluate(Optional.of(key), OTHER_TARGET, BigInteger.ONE, NOW.plus(Duration.ofDays(1)))
        .reason()).isEqualTo(DenialReason.SESSION_KEY_EXPIRED);
  }

  @Test
  void targetAllowList() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of(TARGET));

    assertThat(evaluator.evaluate(Optional.of(key), TARGET, eth(1), NOW).allowed()).isTrue();
    assertThat(evaluator.evaluate(Optional.of(key), OTHER_TARGET, eth(1), NOW).reason())
        .isEqualTo(DenialReason.TARGET_NOT_ALLOWED);
  }

  @Test
  void emptyAllowList_isUnrestricted() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of());

    assertThat(evaluator.evaluate(Optional.of(key), OTHER_TARGET, eth(1), NOW).allowed()).isTrue();
  }

  @Test
  void targetWinsOverSpendingLimit() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of(TARGET));

    assertThat(evaluator.evaluate(Optional.of(key), OTHER_TARGET, eth(5), NOW).reason())
        .isEqualTo(DenialReason.TARGET_NOT_ALLOWED);
  }

  @Test
  void spendingLimit_carriesLimitAndAttempted() {
    SessionKey key = key(eth(1), eth(10), BigInteger.ZERO, TODAY, Set.of());

    AuthorizationDecision decision = evaluator.evaluate(Optional.of(key), TARGET, eth(2), NOW);

    assertThat(decision.reason()).isEqualTo(DenialReason.SPENDING_LIMIT_EXCEEDED);
    assertThat(decision.limit()).isEqualTo(eth(1));
    assertThat(decision.attempted()).isEqualTo(eth(2));
    assertThat(decision.message()).isEqualTo("Exceeds spending limit");
  }

  @Test
  void dailyLimit_carriesLimitAndProjectedTotal() {
    SessionKey key = key(eth(5), eth(10), eth(9), TODAY, Set.of());

    AuthorizationDecision decision = evaluator.evaluate(Optional.of(key), TARGET, eth(2), NOW);

    assertThat(decision.reason()).isEqualTo(DenialReason.DAILY_LIMIT_EXCEEDED);
    assertThat(decision.limit()).isEqualTo(eth(10));
    assertThat(decision.attempted()).isEqualTo(eth(11));
  }

  @Test
  void dailyLimit_exactlyReached_isAllowed() {
    SessionKey key = key(eth(5), eth(10), eth(9), TODAY, Set.of());

    assertThat(evaluator.evaluate(Optional.of(key), TARGET, eth(1), NOW).allowed()).isTrue();
  }

  @Test
  void dailyLimit_usesVirtualResetOnNewDay() {
    SessionKey key = key(eth(5), eth(10), eth(9), TODAY, Set.of()).withExpiryTime(NOW.plus(Duration.ofDays(2)));

    assertThat(evaluator.evaluate(Optional.of(key), TARGET, eth(2), NOW.plus(Duration.ofHours(13)))
        .allowed()).isTrue();
  }

  @Test
  void zeroValue_isAllowedOnExhaustedBudget() {
    SessionKey key = key(eth(5), eth(10), eth(10), TODAY, Set.of());

    assertThat(evaluator.evaluate(Optional.of(key), TARGET, BigInteger.ZERO, NOW).allowed()).isTrue();
  }
}
