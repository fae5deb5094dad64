package com.codeheadsystems.delegate.server.model;

import java.math.BigInteger;

/**
 * Bounds for on-chain values. All limits and usage counters are unsigned 256-bit quantities.
 */
public final class Amounts {

  /**
   * 2^256 - 1.
   */
  public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

  private Amounts() {
  }

  /**
   * Is uint 256 boolean.
   *
   * @param value the value
   * @return true if the value is non-null and within {@code [0, 2^256 - 1]}
   */
  public static boolean isUint256(BigInteger value) {
    return value != null && value.signum() >= 0 && value.compareTo(MAX_UINT256) <= 0;
  }
}
