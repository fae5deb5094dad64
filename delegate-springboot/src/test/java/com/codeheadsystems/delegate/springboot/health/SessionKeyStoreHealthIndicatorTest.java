package com.codeheadsystems.delegate.springboot.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.delegate.server.store.SessionKeyStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

class SessionKeyStoreHealthIndicatorTest {

  private final SessionKeyStore store = mock(SessionKeyStore.class);

  @Test
  void upWithRecordCount() {
    when(store.isAvailable()).thenReturn(true);
    when(store.size()).thenReturn(7);

    Health health = new SessionKeyStoreHealthIndicator(store).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails()).containsEntry("records", 7);
  }

  @Test
  void downWhenStoreUnavailable() {
    when(store.isAvailable()).thenReturn(false);

    Health health = new SessionKeyStoreHealthIndicator(store).health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsKey("reason");
  }
}
