package com.codeheadsystems.delegate.server.resource;

import com.codeheadsystems.delegate.model.DecisionResponse;
import com.codeheadsystems.delegate.model.ErrorResponse;
import com.codeheadsystems.delegate.model.SessionKeyResponse;
import com.codeheadsystems.delegate.model.UsageResponse;
import com.codeheadsystems.delegate.server.model.AuthorizationDecision;
import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyError;
import com.codeheadsystems.delegate.server.model.SessionKeyResult;
import com.codeheadsystems.delegate.server.model.SessionKeyUsage;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;

/**
 * Conversions between engine types and the wire DTOs, shared by the JAX-RS resource and the
 * Spring controller. Kept free of any framework types.
 */
public final class WireMapper {

  private WireMapper() {
  }

  /**
   * Parses a decimal amount.
   *
   * @param value the wire value
   * @param field field name for the error message
   * @return the amount
   * @throws IllegalArgumentException if missing, not a base-10 integer, or negative
   */
  public static BigInteger parseAmount(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    BigInteger amount;
    try {
      amount = new BigInteger(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Field " + field + " is not a decimal integer");
    }
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("Field " + field + " must not be negative");
    }
    return amount;
  }

  /**
   * Parses an epoch-seconds timestamp.
   *
   * @param epochSeconds the wire value
   * @param field        field name for the error message
   * @return the instant
   * @throws IllegalArgumentException if missing or outside the supported instant range
   */
  public static Instant parseInstant(Long epochSeconds, String field) {
    if (epochSeconds == null) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    try {
      return Instant.ofEpochSecond(epochSeconds);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Field " + field + " is out of range", e);
    }
  }

  /**
   * Require non-blank string.
   *
   * @param value the value
   * @param field the field
   * @return the value
   * @throws IllegalArgumentException if null or blank
   */
  public static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    return value;
  }

  public static SessionKeyResponse toResponse(SessionKey key) {
    return new SessionKeyResponse(key.accountId(), key.keyId(),
        key.spendingLimit().toString(), key.dailyLimit().toString(), key.usedToday().toString(),
        key.lastUsedDay(), key.expiryTime().getEpochSecond(), List.copyOf(key.allowedTargets()),
        key.active());
  }

  public static DecisionResponse toResponse(AuthorizationDecision decision) {
    if (decision.allowed()) {
      return new DecisionResponse(true, null, null, null, null);
    }
    return new DecisionResponse(false, decision.reason().name(), decision.message(),
        decision.limit() == null ? null : decision.limit().toString(),
        decision.attempted() == null ? null : decision.attempted().toString());
  }

  public static UsageResponse toResponse(SessionKeyUsage usage) {
    return new UsageResponse(usage.usedToday().toString(), usage.remainingDaily().toString(),
        usage.remainingPerTx().toString(), usage.timeUntilExpiry().getSeconds());
  }

  public static ErrorResponse toError(SessionKeyResult<?> failure) {
    SessionKeyError error = failure.error().orElseThrow();
    return new ErrorResponse(error.name(), failure.message());
  }

  /**
   * HTTP status for a lifecycle error.
   *
   * @param error the error
   * @return 404 for NOT_FOUND, 409 for ALREADY_EXISTS, 400 otherwise
   */
  public static int httpStatus(SessionKeyError error) {
    return switch (error) {
      case NOT_FOUND -> 404;
      case ALREADY_EXISTS -> 409;
      default -> 400;
    };
  }
}
