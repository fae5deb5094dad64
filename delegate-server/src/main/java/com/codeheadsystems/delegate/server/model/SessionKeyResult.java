package com.codeheadsystems.delegate.server.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged result of a lifecycle or query operation: either a value or a {@link SessionKeyError}
 * with a message.
 *
 * @param <T> the success type
 */
public final class SessionKeyResult<T> {

  private final T value;
  private final SessionKeyError error;
  private final String message;

  private SessionKeyResult(T value, SessionKeyError error, String message) {
    this.value = value;
    this.error = error;
    this.message = message;
  }

  public static <T> SessionKeyResult<T> success(T value) {
    return new SessionKeyResult<>(Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> SessionKeyResult<T> failure(SessionKeyError error, String message) {
    return new SessionKeyResult<>(null, Objects.requireNonNull(error, "error"), message);
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * The success value.
   *
   * @return the value
   * @throws IllegalStateException if this result is a failure
   */
  public T value() {
    if (error != null) {
      throw new IllegalStateException("No value for failed result: " + error + " (" + message + ")");
    }
    return value;
  }

  public Optional<SessionKeyError> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Message string.
   *
   * @return the failure message, or null on success
   */
  public String message() {
    return message;
  }

  /**
   * Maps the success value, passing failures through unchanged.
   *
   * @param mapper the mapper
   * @param <U>    the new success type
   * @return the mapped result
   */
  public <U> SessionKeyResult<U> map(Function<? super T, ? extends U> mapper) {
    if (error != null) {
      return new SessionKeyResult<>(null, error, message);
    }
    return success(mapper.apply(value));
  }

  @Override
  public String toString() {
    return error == null
        ? "SessionKeyResult[success=" + value + "]"
        : "SessionKeyResult[error=" + error + ", message=" + message + "]";
  }
}
