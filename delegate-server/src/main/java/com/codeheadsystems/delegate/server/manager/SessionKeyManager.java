package com.codeheadsystems.delegate.server.manager;

import static com.codeheadsystems.delegate.server.model.SessionKeyError.ALREADY_EXISTS;
import static com.codeheadsystems.delegate.server.model.SessionKeyError.INVALID_ACCOUNT;
import static com.codeheadsystems.delegate.server.model.SessionKeyError.INVALID_EXPIRY;
import static com.codeheadsystems.delegate.server.model.SessionKeyError.INVALID_KEY;
import static com.codeheadsystems.delegate.server.model.SessionKeyError.INVALID_LIMITS;
import static com.codeheadsystems.delegate.server.model.SessionKeyError.INVALID_TARGETS;
import static com.codeheadsystems.delegate.server.model.SessionKeyError.NOT_FOUND;

import com.codeheadsystems.delegate.server.event.EmergencyRevokeAll;
import com.codeheadsystems.delegate.server.event.LoggingSessionKeyEventListener;
import com.codeheadsystems.delegate.server.event.SessionKeyEvent;
import com.codeheadsystems.delegate.server.event.SessionKeyEventListener;
import com.codeheadsystems.delegate.server.event.SessionKeyExpiryExtended;
import com.codeheadsystems.delegate.server.event.SessionKeyGranted;
import com.codeheadsystems.delegate.server.event.SessionKeyLimitsUpdated;
import com.codeheadsystems.delegate.server.event.SessionKeyRevoked;
import com.codeheadsystems.delegate.server.event.SessionKeyUsed;
import com.codeheadsystems.delegate.server.model.Amounts;
import com.codeheadsystems.delegate.server.model.AuthorizationDecision;
import com.codeheadsystems.delegate.server.model.CorruptedSessionKeyException;
import com.codeheadsystems.delegate.server.model.Identities;
import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyId;
import com.codeheadsystems.delegate.server.model.SessionKeyResult;
import com.codeheadsystems.delegate.server.model.SessionKeyUsage;
import com.codeheadsystems.delegate.server.store.SessionKeyStore;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic session key engine: registry lifecycle, policy checks and usage accounting.
 * <p>
 * Framework adapters ({@code SessionKeyResource} for JAX-RS / Dropwizard,
 * {@code SessionKeyController} for Spring Boot) stay thin wrappers that translate results into
 * HTTP responses.
 * <p>
 * <strong>Result contract</strong>:
 * <ul>
 *   <li>Lifecycle and query operations return a {@link SessionKeyResult}; expected failures
 *       (unknown key, invalid limits, ...) are values, not exceptions.</li>
 *   <li>{@link #checkValidity} and {@link #authorize} return an {@link AuthorizationDecision};
 *       a denial is a value.</li>
 *   <li>{@link NullPointerException} / {@link IllegalArgumentException}: a null identity or a
 *       negative value was passed to a policy operation.</li>
 *   <li>{@link CorruptedSessionKeyException}: a stored record violates the limit invariants.</li>
 * </ul>
 * <p>
 * Every mutation of a record runs under that record's lock: the record is reloaded, checked,
 * written back and its event published before the lock is released, so concurrent
 * authorizations on one key can never overspend and events for a key arrive in mutation order.
 * Operations on different keys never contend.
 */
@Singleton
public class SessionKeyManager {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyManager.class);

  private final SessionKeyStore store;
  private final SessionKeyEventListener listener;
  private final Clock clock;
  private final UsageTracker usageTracker;
  private final PolicyEvaluator policyEvaluator;
  private final RecordLocks locks = new RecordLocks();

  /**
   * Instantiates a new Session key manager with the system UTC clock and audit logging.
   *
   * @param store the store
   */
  public SessionKeyManager(SessionKeyStore store) {
    this(store, new LoggingSessionKeyEventListener(), Clock.systemUTC());
  }

  /**
   * Instantiates a new Session key manager.
   *
   * @param store    the store
   * @param listener receives every committed mutation
   * @param clock    source of "now" for the overloads that do not take one
   */
  @Inject
  public SessionKeyManager(SessionKeyStore store, SessionKeyEventListener listener, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.usageTracker = new UsageTracker();
    this.policyEvaluator = new PolicyEvaluator(usageTracker);
    log.info("SessionKeyManager({}, {})", store.getClass().getSimpleName(), listener.getClass().getSimpleName());
  }

  // ── Lifecycle ──────────────────────────────────────────────────────────────

  public SessionKeyResult<SessionKey> grant(String accountId, String keyId, BigInteger spendingLimit,
                                            BigInteger dailyLimit, Instant expiryTime,
                                            Collection<String> allowedTargets) {
    return grant(accountId, keyId, spendingLimit, dailyLimit, expiryTime, allowedTargets, clock.instant());
  }

  /**
   * Grants a new session key.
   *
   * @param accountId      owning account, not the zero identity
   * @param keyId          delegated key, not the zero identity
   * @param spendingLimit  per-operation cap
   * @param dailyLimit     daily cap, at least the spending limit
   * @param expiryTime     strictly after {@code now}
   * @param allowedTargets allow-list, null or empty for unrestricted
   * @param now            reference time
   * @return the new record, or INVALID_ACCOUNT, INVALID_KEY, INVALID_LIMITS, INVALID_EXPIRY,
   *     INVALID_TARGETS or ALREADY_EXISTS
   */
  public SessionKeyResult<SessionKey> grant(String accountId, String keyId, BigInteger spendingLimit,
                                            BigInteger dailyLimit, Instant expiryTime,
                                            Collection<String> allowedTargets, Instant now) {
    log.debug("grant({}, {})", accountId, keyId);
    if (Identities.isZero(accountId)) {
      return SessionKeyResult.failure(INVALID_ACCOUNT, "Account must not be the zero identity");
    }
    if (Identities.isZero(keyId)) {
      return SessionKeyResult.failure(INVALID_KEY, "Session key must not be the zero identity");
    }
    Optional<String> limitsProblem = limitsProblem(spendingLimit, dailyLimit);
    if (limitsProblem.isPresent()) {
      return SessionKeyResult.failure(INVALID_LIMITS, limitsProblem.get());
    }
    if (expiryTime == null || !expiryTime.isAfter(now)) {
      return SessionKeyResult.failure(INVALID_EXPIRY, "Expiry must be in the future");
    }
    Set<String> targets;
    try {
      targets = Identities.normalizeTargets(allowedTargets == null ? List.of() : allowedTargets);
    } catch (IllegalArgumentException e) {
      return SessionKeyResult.failure(INVALID_TARGETS, e.getMessage());
    }

    SessionKey sessionKey = new SessionKey(Identities.normalize(accountId), Identities.normalize(keyId),
        spendingLimit, dailyLimit, BigInteger.ZERO, usageTracker.dayIndex(now), expiryTime, targets,
        true, now);
    return locks.withLock(sessionKey.id(), () -> {
      if (!store.insert(sessionKey)) {
        return SessionKeyResult.failure(ALREADY_EXISTS, "Session key already exists");
      }
      publish(new SessionKeyGranted(sessionKey.accountId(), sessionKey.keyId(), spendingLimit,
          dailyLimit, expiryTime, sessionKey.allowedTargets(), now));
      return SessionKeyResult.success(sessionKey);
    });
  }

  public SessionKeyResult<Boolean> revoke(String accountId, String keyId) {
    return revoke(accountId, keyId, clock.instant());
  }

  /**
   * Revokes a session key. Revocation is final, and applies to a record failing the limit
   * invariants too.
   *
   * @param accountId the account
   * @param keyId     the key
   * @param now       reference time for the event
   * @return true if this call deactivated the key, false if it was already inactive, or NOT_FOUND
   */
  public SessionKeyResult<Boolean> revoke(String accountId, String keyId, Instant now) {
    log.debug("revoke({}, {})", accountId, keyId);
    SessionKeyId id = idOf(accountId, keyId);
    if (store.load(id).isEmpty()) {
      return notFound();
    }
    return locks.withLock(id, () -> {
      SessionKey key = loadForRevocation(id);
      if (!key.active()) {
        return SessionKeyResult.success(false);
      }
      store.save(key.withActive(false));
      publish(new SessionKeyRevoked(id.accountId(), id.keyId(), now));
      return SessionKeyResult.success(true);
    });
  }

  public SessionKeyResult<SessionKey> updateLimits(String accountId, String keyId,
                                                   BigInteger newSpendingLimit, BigInteger newDailyLimit) {
    return updateLimits(accountId, keyId, newSpendingLimit, newDailyLimit, clock.instant());
  }

  /**
   * Replaces both limits. Usage already booked for the day is kept, clamped to the new daily
   * limit when the new limit is lower.
   *
   * @param accountId        the account
   * @param keyId            the key
   * @param newSpendingLimit new per-operation cap
   * @param newDailyLimit    new daily cap
   * @param now              reference time for the event
   * @return the updated record, or NOT_FOUND, INVALID_LIMITS
   */
  public SessionKeyResult<SessionKey> updateLimits(String accountId, String keyId,
                                                   BigInteger newSpendingLimit, BigInteger newDailyLimit,
                                                   Instant now) {
    log.debug("updateLimits({}, {})", accountId, keyId);
    SessionKeyId id = idOf(accountId, keyId);
    if (store.load(id).isEmpty()) {
      return notFound();
    }
    Optional<String> limitsProblem = limitsProblem(newSpendingLimit, newDailyLimit);
    if (limitsProblem.isPresent()) {
      return SessionKeyResult.failure(INVALID_LIMITS, limitsProblem.get());
    }
    return locks.withLock(id, () -> {
      SessionKey key = loadVerified(id).orElseThrow();
      SessionKey updated = key.withLimits(newSpendingLimit, newDailyLimit)
          .withUsage(key.usedToday().min(newDailyLimit), key.lastUsedDay());
      store.save(updated);
      publish(new SessionKeyLimitsUpdated(id.accountId(), id.keyId(), key.spendingLimit(),
          key.dailyLimit(), newSpendingLimit, newDailyLimit, now));
      return SessionKeyResult.success(updated);
    });
  }

  public SessionKeyResult<SessionKey> extendExpiry(String accountId, String keyId, Instant newExpiryTime) {
    return extendExpiry(accountId, keyId, newExpiryTime, clock.instant());
  }

  /**
   * Moves the expiry later.
   *
   * @param accountId     the account
   * @param keyId         the key
   * @param newExpiryTime strictly after the current expiry
   * @param now           reference time for the event
   * @return the updated record, or NOT_FOUND, INVALID_EXPIRY
   */
  public SessionKeyResult<SessionKey> extendExpiry(String accountId, String keyId, Instant newExpiryTime,
                                                   Instant now) {
    log.debug("extendExpiry({}, {}, {})", accountId, keyId, newExpiryTime);
    SessionKeyId id = idOf(accountId, keyId);
    if (store.load(id).isEmpty()) {
      return notFound();
    }
    if (newExpiryTime == null) {
      return SessionKeyResult.failure(INVALID_EXPIRY, "Expiry is required");
    }
    return locks.withLock(id, () -> {
      SessionKey key = loadVerified(id).orElseThrow();
      if (!newExpiryTime.isAfter(key.expiryTime())) {
        return SessionKeyResult.failure(INVALID_EXPIRY, "New expiry must be later than the current expiry");
      }
      SessionKey updated = key.withExpiryTime(newExpiryTime);
      store.save(updated);
      publish(new SessionKeyExpiryExtended(id.accountId(), id.keyId(), key.expiryTime(), newExpiryTime, now));
      return SessionKeyResult.success(updated);
    });
  }

  public SessionKeyResult<Integer> emergencyRevokeAll(String accountId) {
    return emergencyRevokeAll(accountId, clock.instant());
  }

  /**
   * Revokes every active key of the account in one step. The locks of all the account's
   * records are held together, so no authorization on any of them can interleave.
   * Records failing the limit invariants are deactivated like any other.
   * One event is published, even when nothing was active.
   *
   * @param accountId the account
   * @param now       reference time for the event
   * @return the number of keys this call deactivated
   */
  public SessionKeyResult<Integer> emergencyRevokeAll(String accountId, Instant now) {
    log.debug("emergencyRevokeAll({})", accountId);
    String account = Identities.normalize(Objects.requireNonNull(accountId, "accountId"));
    List<SessionKeyId> ids = store.loadAll(account).stream().map(SessionKey::id).toList();
    return locks.withLocks(ids, () -> {
      List<String> revoked = new ArrayList<>();
      for (SessionKeyId id : ids) {
        SessionKey key = loadForRevocation(id);
        if (key.active()) {
          store.save(key.withActive(false));
          revoked.add(id.keyId());
        }
      }
      log.warn("Emergency revoke for account {} deactivated {} key(s)", account, revoked.size());
      publish(new EmergencyRevokeAll(account, revoked.size(), List.copyOf(revoked), now));
      return SessionKeyResult.success(revoked.size());
    });
  }

  // ── Queries ────────────────────────────────────────────────────────────────

  public SessionKeyResult<SessionKey> get(String accountId, String keyId) {
    log.debug("get({}, {})", accountId, keyId);
    return loadVerified(idOf(accountId, keyId))
        .map(SessionKeyResult::success)
        .orElseGet(SessionKeyManager::notFound);
  }

  /**
   * Keys whose active flag is set. Expiry is not evaluated.
   *
   * @param accountId the account
   * @return sorted key ids
   */
  public Set<String> listActive(String accountId) {
    log.debug("listActive({})", accountId);
    return store.loadAll(Identities.normalize(Objects.requireNonNull(accountId, "accountId"))).stream()
        .filter(SessionKey::active)
        .map(SessionKey::keyId)
        .collect(Collectors.collectingAndThen(Collectors.toCollection(TreeSet::new),
            Collections::unmodifiableSortedSet));
  }

  /**
   * Every record of the account, revoked ones included.
   *
   * @param accountId the account
   * @return records ordered by key id
   */
  public List<SessionKey> listAll(String accountId) {
    log.debug("listAll({})", accountId);
    List<SessionKey> all = store.loadAll(Identities.normalize(Objects.requireNonNull(accountId, "accountId")));
    all.forEach(SessionKeyManager::verify);
    return all;
  }

  public SessionKeyResult<SessionKeyUsage> getUsage(String accountId, String keyId) {
    return getUsage(accountId, keyId, clock.instant());
  }

  /**
   * Usage statistics. A pending day reset is applied to the figures but not persisted.
   *
   * @param accountId the account
   * @param keyId     the key
   * @param now       reference time
   * @return the usage, or NOT_FOUND
   */
  public SessionKeyResult<SessionKeyUsage> getUsage(String accountId, String keyId, Instant now) {
    log.debug("getUsage({}, {})", accountId, keyId);
    return loadVerified(idOf(accountId, keyId))
        .map(key -> SessionKeyResult.success(usageTracker.usage(key, now)))
        .orElseGet(SessionKeyManager::notFound);
  }

  // ── Policy ─────────────────────────────────────────────────────────────────

  public AuthorizationDecision checkValidity(String accountId, String keyId, String target, BigInteger value) {
    return checkValidity(accountId, keyId, target, value, clock.instant());
  }

  /**
   * Evaluates an operation without recording anything.
   *
   * @param accountId the account
   * @param keyId     the key
   * @param target    target of the operation
   * @param value     non-negative value of the operation
   * @param now       reference time
   * @return the decision {@link #authorize} would make at {@code now}
   */
  public AuthorizationDecision checkValidity(String accountId, String keyId, String target, BigInteger value,
                                             Instant now) {
    log.debug("checkValidity({}, {}, {}, {})", accountId, keyId, target, value);
    SessionKeyId id = idOf(accountId, keyId);
    String normalizedTarget = checkOperation(target, value);
    return policyEvaluator.evaluate(loadVerified(id), normalizedTarget, value, now);
  }

  public AuthorizationDecision authorize(String accountId, String keyId, String target, BigInteger value) {
    return authorize(accountId, keyId, target, value, clock.instant());
  }

  /**
   * Evaluates an operation and, when allowed, books its value against the day's budget.
   * Not idempotent: every allowed call consumes budget.
   *
   * @param accountId the account
   * @param keyId     the key
   * @param target    target of the operation
   * @param value     non-negative value of the operation
   * @param now       reference time
   * @return the decision
   */
  public AuthorizationDecision authorize(String accountId, String keyId, String target, BigInteger value,
                                         Instant now) {
    log.debug("authorize({}, {}, {}, {})", accountId, keyId, target, value);
    SessionKeyId id = idOf(accountId, keyId);
    String normalizedTarget = checkOperation(target, value);
    if (store.load(id).isEmpty()) {
      return policyEvaluator.evaluate(Optional.empty(), normalizedTarget, value, now);
    }
    return locks.withLock(id, () -> {
      Optional<SessionKey> record = loadVerified(id);
      AuthorizationDecision decision = policyEvaluator.evaluate(record, normalizedTarget, value, now);
      if (!decision.allowed()) {
        log.debug("authorize({}) denied: {}", id, decision.reason());
        return decision;
      }
      SessionKey updated = usageTracker.recordUsage(record.orElseThrow(), value, now);
      store.save(updated);
      publish(new SessionKeyUsed(id.accountId(), id.keyId(), normalizedTarget, value,
          updated.usedToday(), updated.lastUsedDay(), now));
      return decision;
    });
  }

  // ── Internals ──────────────────────────────────────────────────────────────

  private Optional<SessionKey> loadVerified(SessionKeyId id) {
    Optional<SessionKey> record = store.load(id);
    record.ifPresent(SessionKeyManager::verify);
    return record;
  }

  /**
   * Loads a record that is about to be deactivated. Deactivating never widens what a key may do,
   * so a record failing the limit invariants is still returned, with a warning.
   */
  private SessionKey loadForRevocation(SessionKeyId id) {
    SessionKey key = store.load(id).orElseThrow(() -> new IllegalStateException("No stored record for " + id));
    try {
      verify(key);
    } catch (CorruptedSessionKeyException e) {
      log.warn("Revoking corrupted session key {}: {}", id, e.getMessage());
    }
    return key;
  }

  private static void verify(SessionKey key) {
    if (key.spendingLimit().signum() < 0 || key.spendingLimit().compareTo(key.dailyLimit()) > 0) {
      throw new CorruptedSessionKeyException(key.id(), "spending limit outside [0, dailyLimit]");
    }
    if (key.usedToday().signum() < 0 || key.usedToday().compareTo(key.dailyLimit()) > 0) {
      throw new CorruptedSessionKeyException(key.id(), "usedToday outside [0, dailyLimit]");
    }
  }

  private void publish(SessionKeyEvent event) {
    try {
      listener.onEvent(event);
    } catch (RuntimeException e) {
      log.error("Event listener failed for {} on account {}; the change is kept",
          event.type(), event.accountId(), e);
    }
  }

  private static String checkOperation(String target, BigInteger value) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(value, "value");
    if (value.signum() < 0) {
      throw new IllegalArgumentException("Operation value must not be negative: " + value);
    }
    return Identities.normalize(target);
  }

  private static SessionKeyId idOf(String accountId, String keyId) {
    Objects.requireNonNull(accountId, "accountId");
    Objects.requireNonNull(keyId, "keyId");
    return new SessionKeyId(Identities.normalize(accountId), Identities.normalize(keyId));
  }

  private static Optional<String> limitsProblem(BigInteger spendingLimit, BigInteger dailyLimit) {
    if (spendingLimit == null || dailyLimit == null) {
      return Optional.of("Spending and daily limits are required");
    }
    if (!Amounts.isUint256(spendingLimit) || !Amounts.isUint256(dailyLimit)) {
      return Optional.of("Limits must be between 0 and 2^256 - 1");
    }
    if (dailyLimit.compareTo(spendingLimit) < 0) {
      return Optional.of("Daily limit must not be below the spending limit");
    }
    return Optional.empty();
  }

  private static <T> SessionKeyResult<T> notFound() {
    return SessionKeyResult.failure(NOT_FOUND, "Session key not found");
  }

  int lockCount() {
    return locks.size();
  }
}
