package com.codeheadsystems.delegate.server.model;

import java.util.Objects;

/**
 * Address of a session key record: the owning account plus the key identity within that account.
 * Both parts are expected to be normalized (see {@link Identities#normalize(String)}).
 *
 * @param accountId owning account
 * @param keyId     delegated key
 */
public record SessionKeyId(String accountId, String keyId) implements Comparable<SessionKeyId> {

  public SessionKeyId {
    Objects.requireNonNull(accountId, "accountId");
    Objects.requireNonNull(keyId, "keyId");
  }

  @Override
  public int compareTo(SessionKeyId other) {
    int byAccount = accountId.compareTo(other.accountId);
    return byAccount != 0 ? byAccount : keyId.compareTo(other.keyId);
  }
}
