package com.codeheadsystems.delegate.springboot.health;

import com.codeheadsystems.delegate.server.store.SessionKeyStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class SessionKeyStoreHealthIndicator implements HealthIndicator {

  private final SessionKeyStore store;

  public SessionKeyStoreHealthIndicator(SessionKeyStore store) {
    this.store = store;
  }

  @Override
  public Health health() {
    if (!store.isAvailable()) {
      return Health.down()
          .withDetail("reason", "Session key store is not available")
          .withDetail("store", store.getClass().getSimpleName())
          .build();
    }
    return Health.up().withDetail("records", store.size()).build();
  }
}
