package com.codeheadsystems.delegate.server.manager;

import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyUsage;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Rolling daily usage accounting with lazy reset.
 * <p>
 * Days are UTC days since the epoch. A stored {@code usedToday} only counts while
 * {@code lastUsedDay} equals the current day; once the day has moved on the effective usage is
 * zero, without anything having to run at midnight.  A {@code lastUsedDay} ahead of the current
 * day (the caller's clock moved backwards) keeps the stored usage; the window is never rewound.
 */
@Singleton
public class UsageTracker {

  public static final long SECONDS_PER_DAY = 86_400L;

  @Inject
  public UsageTracker() {
  }

  public long dayIndex(Instant now) {
    return Math.floorDiv(now.getEpochSecond(), SECONDS_PER_DAY);
  }

  /**
   * Usage that counts against the daily limit at {@code now}.
   *
   * @param key the record
   * @param now reference time
   * @return stored usage, or zero if it belongs to an earlier day
   */
  public BigInteger effectiveUsedToday(SessionKey key, Instant now) {
    return key.lastUsedDay() < dayIndex(now) ? BigInteger.ZERO : key.usedToday();
  }

  /**
   * Applies the day reset, if due, and adds {@code value}.
   *
   * @param key   the record
   * @param value amount consumed
   * @param now   reference time
   * @return the updated record
   */
  public SessionKey recordUsage(SessionKey key, BigInteger value, Instant now) {
    long today = dayIndex(now);
    BigInteger used = effectiveUsedToday(key, now).add(value);
    return key.withUsage(used, Math.max(key.lastUsedDay(), today));
  }

  /**
   * Usage statistics at {@code now}. The virtual reset is not persisted.
   *
   * @param key the record
   * @param now reference time
   * @return the usage
   */
  public SessionKeyUsage usage(SessionKey key, Instant now) {
    BigInteger used = effectiveUsedToday(key, now);
    Duration untilExpiry = Duration.between(now, key.expiryTime());
    return new SessionKeyUsage(
        used,
        key.dailyLimit().subtract(used),
        key.spendingLimit(),
        untilExpiry.isNegative() ? Duration.ZERO : untilExpiry);
  }
}
