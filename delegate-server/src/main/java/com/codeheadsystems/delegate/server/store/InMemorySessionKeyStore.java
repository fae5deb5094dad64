package com.codeheadsystems.delegate.server.store;

import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyId;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionKeyStore}.
 * <p>
 * All session keys, including the usage counters, are lost on restart. Suitable for development
 * and testing only.
 */
public class InMemorySessionKeyStore implements SessionKeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionKeyStore.class);

  private final SessionKeyIndex index = new SessionKeyIndex();

  /**
   * Instantiates a new In memory session key store.
   */
  public InMemorySessionKeyStore() {
    log.warn("Using in-memory session key store; grants and usage will not survive a restart");
  }

  @Override
  public Optional<SessionKey> load(SessionKeyId id) {
    return index.get(id);
  }

  @Override
  public boolean insert(SessionKey sessionKey) {
    boolean inserted = index.putIfAbsent(sessionKey);
    log.debug("insert({}) -> {}", sessionKey.id(), inserted);
    return inserted;
  }

  @Override
  public void save(SessionKey sessionKey) {
    index.replace(sessionKey);
    log.debug("save({})", sessionKey.id());
  }

  @Override
  public List<SessionKey> loadAll(String accountId) {
    return index.all(accountId);
  }

  @Override
  public int size() {
    return index.size();
  }
}
