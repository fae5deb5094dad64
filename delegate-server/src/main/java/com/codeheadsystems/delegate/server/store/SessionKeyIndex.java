package com.codeheadsystems.delegate.server.store;

import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Two-level in-memory index: account → (key → record).
 * Accounts map to sorted maps so listings come back ordered by key identity.
 */
class SessionKeyIndex {

  private final ConcurrentHashMap<String, ConcurrentSkipListMap<String, SessionKey>> byAccount =
      new ConcurrentHashMap<>();

  Optional<SessionKey> get(SessionKeyId id) {
    Map<String, SessionKey> keys = byAccount.get(id.accountId());
    return keys == null ? Optional.empty() : Optional.ofNullable(keys.get(id.keyId()));
  }

  boolean putIfAbsent(SessionKey sessionKey) {
    return byAccount.computeIfAbsent(sessionKey.accountId(), k -> new ConcurrentSkipListMap<>())
        .putIfAbsent(sessionKey.keyId(), sessionKey) == null;
  }

  void replace(SessionKey sessionKey) {
    Map<String, SessionKey> keys = byAccount.get(sessionKey.accountId());
    if (keys == null || keys.replace(sessionKey.keyId(), sessionKey) == null) {
      throw new IllegalStateException("No stored record for " + sessionKey.id());
    }
  }

  void put(SessionKey sessionKey) {
    byAccount.computeIfAbsent(sessionKey.accountId(), k -> new ConcurrentSkipListMap<>())
        .put(sessionKey.keyId(), sessionKey);
  }

  List<SessionKey> all(String accountId) {
    Map<String, SessionKey> keys = byAccount.get(accountId);
    return keys == null ? List.of() : List.copyOf(new ArrayList<>(keys.values()));
  }

  int size() {
    return byAccount.values().stream().mapToInt(Map::size).sum();
  }
}
