package com.codeheadsystems.delegate.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.delegate.server.store.SessionKeyStore;

/**
 * Health check that verifies the session key store is reachable.
 */
public class SessionKeyStoreHealthCheck extends HealthCheck {

  private final SessionKeyStore store;

  /**
   * Instantiates a new Session key store health check.
   *
   * @param store the store
   */
  public SessionKeyStoreHealthCheck(SessionKeyStore store) {
    this.store = store;
  }

  @Override
  protected Result check() {
    if (!store.isAvailable()) {
      return Result.unhealthy("Session key store %s is not available", store.getClass().getSimpleName());
    }
    return Result.healthy("records=%d", store.size());
  }
}
