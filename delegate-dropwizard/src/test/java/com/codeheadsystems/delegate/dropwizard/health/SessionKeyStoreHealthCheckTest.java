package com.codeheadsystems.delegate.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.delegate.server.store.SessionKeyStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionKeyStoreHealthCheckTest {

  @Mock private SessionKeyStore store;

  @Test
  void healthyStoreReportsRecordCount() {
    when(store.isAvailable()).thenReturn(true);
    when(store.size()).thenReturn(3);

    HealthCheck.Result result = new SessionKeyStoreHealthCheck(store).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("records=3");
  }

  @Test
  void unavailableStoreIsUnhealthy() {
    when(store.isAvailable()).thenReturn(false);

    HealthCheck.Result result = new SessionKeyStoreHealthCheck(store).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("not available");
  }
}
