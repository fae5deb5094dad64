package com.codeheadsystems.delegate.server.model;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Usage statistics for a session key, reconciled against the current day without persisting
 * the reconciliation.
 *
 * @param usedToday       consumption in the current day
 * @param remainingDaily  {@code dailyLimit - usedToday}
 * @param remainingPerTx  the per-operation cap
 * @param timeUntilExpiry time left before expiry, {@link Duration#ZERO} once expired
 */
public record SessionKeyUsage(
    BigInteger usedToday,
    BigInteger remainingDaily,
    BigInteger remainingPerTx,
    Duration timeUntilExpiry) {
}
