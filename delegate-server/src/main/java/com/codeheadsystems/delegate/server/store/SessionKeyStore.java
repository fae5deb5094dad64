package com.codeheadsystems.delegate.server.store;

import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyId;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for session key records, keyed by (account, key).
 * <p>
 * Implementations must be thread-safe.  They are not responsible for read-modify-write atomicity:
 * the manager serializes every mutation of a given record under its own per-record lock, so a
 * store only needs each individual call to be atomic.
 * <p>
 * Records are never deleted; revocation flips the {@code active} flag and the record is kept.
 */
public interface SessionKeyStore {

  /**
   * Loads a record.
   *
   * @param id the record address
   * @return the record, or empty if none exists
   */
  Optional<SessionKey> load(SessionKeyId id);

  /**
   * Inserts a new record if no record exists for its address.
   *
   * @param sessionKey the record
   * @return true if inserted, false if a record already existed
   */
  boolean insert(SessionKey sessionKey);

  /**
   * Replaces an existing record.
   *
   * @param sessionKey the record
   * @throws IllegalStateException if no record exists for its address
   */
  void save(SessionKey sessionKey);

  /**
   * Every record of an account, active or not, ordered by key identity.
   *
   * @param accountId normalized account identity
   * @return the records, empty if the account has none
   */
  List<SessionKey> loadAll(String accountId);

  /**
   * Total number of records held.
   *
   * @return the count
   */
  int size();

  /**
   * Whether the backing storage is reachable. Used by health checks.
   *
   * @return true if available
   */
  default boolean isAvailable() {
    return true;
  }
}
