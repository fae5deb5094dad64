package com.codeheadsystems.delegate.springboot.config;

import com.codeheadsystems.delegate.server.auth.OwnerTokenManager;
import com.codeheadsystems.delegate.server.event.LoggingSessionKeyEventListener;
import com.codeheadsystems.delegate.server.event.SessionKeyEventListener;
import com.codeheadsystems.delegate.server.manager.SessionKeyManager;
import com.codeheadsystems.delegate.server.store.FileSessionKeyStore;
import com.codeheadsystems.delegate.server.store.InMemorySessionKeyStore;
import com.codeheadsystems.delegate.server.store.SessionKeyStore;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(DelegateProperties.class)
public class DelegateAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(DelegateAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * Time source for expiry checks and day boundaries. Override with a fixed clock in tests:
   * <pre>{@code
   *   @Bean
   *   public Clock clock() {
   *     return Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionKeyStore sessionKeyStore(DelegateProperties props) {
    String directory = props.getStorageDirectory();
    if (directory == null || directory.isBlank()) {
      log.warn("Using in-memory session key store. All grants and usage will be lost on restart. "
          + "Do not use in production.");
      return new InMemorySessionKeyStore();
    }
    return new FileSessionKeyStore(Path.of(directory));
  }

  /**
   * Receives every committed state change. The default writes an audit line per event; supply
   * your own bean to forward events to an indexer or message bus.
   */
  @Bean
  @ConditionalOnMissingBean
  public SessionKeyEventListener sessionKeyEventListener() {
    return new LoggingSessionKeyEventListener();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionKeyManager sessionKeyManager(SessionKeyStore store, SessionKeyEventListener listener,
                                             Clock clock) {
    return new SessionKeyManager(store, listener, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public OwnerTokenManager ownerTokenManager(DelegateProperties props, SecureRandom secureRandom) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Owner tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      secureRandom.nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new OwnerTokenManager(secret, props.getJwtIssuer(), props.getJwtTtlSeconds());
  }
}
