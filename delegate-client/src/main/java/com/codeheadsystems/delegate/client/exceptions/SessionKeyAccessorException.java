package com.codeheadsystems.delegate.client.exceptions;

/**
 * Transport failure or non-success HTTP response from the session key server.
 */
public class SessionKeyAccessorException extends RuntimeException {

  private final int statusCode;
  private final String errorCode;

  /**
   * Transport failure, no HTTP status.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionKeyAccessorException(final String message, final Throwable cause) {
    this(message, cause, -1, null);
  }

  /**
   * Instantiates a new Session key accessor exception.
   *
   * @param message    the message
   * @param cause      the cause
   * @param statusCode HTTP status, -1 when the request never completed
   * @param errorCode  the server's error code (e.g. NOT_FOUND), null when not reported
   */
  public SessionKeyAccessorException(final String message, final Throwable cause,
                                     final int statusCode, final String errorCode) {
    super(message, cause);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  public int statusCode() {
    return statusCode;
  }

  public String errorCode() {
    return errorCode;
  }
}
