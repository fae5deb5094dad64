package com.codeheadsystems.delegate.server.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SessionKeyResultTest {

  @Test
  void success_carriesValue() {
    SessionKeyResult<Integer> result = SessionKeyResult.success(3);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(3);
    assertThat(result.error()).isEmpty();
    assertThat(result.map(i -> i * 2).value()).isEqualTo(6);
  }

  @Test
  void failure_valueThrows_andMapPassesThrough() {
    SessionKeyResult<Integer> result = SessionKeyResult.failure(SessionKeyError.NOT_FOUND, "gone");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error()).contains(SessionKeyError.NOT_FOUND);
    assertThat(result.message()).isEqualTo("gone");
    assertThatThrownBy(result::value).isInstanceOf(IllegalStateException.class);

    SessionKeyResult<String> mapped = result.map(String::valueOf);
    assertThat(mapped.error()).contains(SessionKeyError.NOT_FOUND);
    assertThat(mapped.message()).isEqualTo("gone");
  }

  @Test
  void authorizationDecision_mustBeEitherAllowedOrDenied() {
    assertThat(AuthorizationDecision.allow().message()).isEmpty();
    assertThat(AuthorizationDecision.deny(DenialReason.SESSION_KEY_EXPIRED).message())
        .isEqualTo("Session key expired");
    assertThatThrownBy(() -> new AuthorizationDecision(true, DenialReason.SESSION_KEY_EXPIRED, null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new AuthorizationDecision(false, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
