package com.codeheadsystems.dynamap.api.exception;

/**
 * Root of every failure raised by the storage layer.
 */
public class DynamapException extends RuntimeException {

  /**
   * Instantiates a new Dynamap exception.
   *
   * @param message the message
   */
  public DynamapException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Dynamap exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DynamapException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
