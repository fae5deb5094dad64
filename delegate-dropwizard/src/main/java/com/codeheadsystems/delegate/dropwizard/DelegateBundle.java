package com.codeheadsystems.delegate.dropwizard;

import com.codeheadsystems.delegate.dropwizard.auth.DelegateAuthenticator;
import com.codeheadsystems.delegate.dropwizard.auth.DelegatePrincipal;
import com.codeheadsystems.delegate.dropwizard.health.SessionKeyStoreHealthCheck;
import com.codeheadsystems.delegate.server.auth.OwnerTokenManager;
import com.codeheadsystems.delegate.server.event.LoggingSessionKeyEventListener;
import com.codeheadsystems.delegate.server.event.SessionKeyEventListener;
import com.codeheadsystems.delegate.server.manager.SessionKeyManager;
import com.codeheadsystems.delegate.server.resource.SessionKeyResource;
import com.codeheadsystems.delegate.server.store.FileSessionKeyStore;
import com.codeheadsystems.delegate.server.store.InMemorySessionKeyStore;
import com.codeheadsystems.delegate.server.store.SessionKeyStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the session key engine into an existing Dropwizard application.
 * <p>
 * Registers the session key JAX-RS resource, a store health check, and the owner-token
 * authentication filter. Requires a {@link DelegateConfiguration} block in the application's
 * YAML config.
 * <p>
 * Embed with the store chosen by configuration ({@code storageDirectory} empty means in-memory):
 * <pre>{@code
 *   bootstrap.addBundle(new DelegateBundle<>());
 * }</pre>
 * <p>
 * Or supply your own store and event listener:
 * <pre>{@code
 *   bootstrap.addBundle(new DelegateBundle<>(myStore, myAuditListener));
 * }</pre>
 */
@Singleton
public class DelegateBundle<C extends DelegateConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(DelegateBundle.class);

  private final SessionKeyStore suppliedStore;
  private final SessionKeyEventListener listener;
  private SessionKeyManager sessionKeyManager;

  /**
   * Creates a bundle whose store is selected by {@code storageDirectory} and whose events go
   * to the audit log.
   */
  public DelegateBundle() {
    this.suppliedStore = null;
    this.listener = new LoggingSessionKeyEventListener();
  }

  /**
   * Creates a bundle backed by the supplied store and event listener.
   * {@code storageDirectory} in the configuration is ignored.
   *
   * @param store    the store
   * @param listener the listener
   */
  @Inject
  public DelegateBundle(SessionKeyStore store, SessionKeyEventListener listener) {
    this.suppliedStore = store;
    this.listener = listener;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    SessionKeyStore store = suppliedStore != null ? suppliedStore : buildStore(configuration);
    sessionKeyManager = new SessionKeyManager(store, listener, Clock.systemUTC());
    OwnerTokenManager tokenManager = buildTokenManager(configuration);

    environment.jersey().register(new SessionKeyResource(sessionKeyManager));
    environment.healthChecks().register("session-key-store", new SessionKeyStoreHealthCheck(store));

    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<DelegatePrincipal>()
            .setAuthenticator(new DelegateAuthenticator(tokenManager))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(DelegatePrincipal.class));
  }

  /**
   * The engine this bundle serves, for in-process callers such as an operation relayer.
   *
   * @return the manager, null before {@link #run} has been called
   */
  public SessionKeyManager getSessionKeyManager() {
    return sessionKeyManager;
  }

  private SessionKeyStore buildStore(C configuration) {
    String directory = configuration.getStorageDirectory();
    if (directory == null || directory.isBlank()) {
      log.warn("""
          #################################################################
          # WARNING: No storageDirectory configured. Session keys and     #
          # daily usage are held in memory and lost on restart.           #
          # Do not use in production.                                     #
          #################################################################
          """);
      return new InMemorySessionKeyStore();
    }
    return new FileSessionKeyStore(Path.of(directory));
  }

  private OwnerTokenManager buildTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Owner tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new OwnerTokenManager(secret, configuration.getJwtIssuer(), configuration.getJwtTtlSeconds());
  }
}
