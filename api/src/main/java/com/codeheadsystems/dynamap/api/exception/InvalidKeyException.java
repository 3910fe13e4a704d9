package com.codeheadsystems.dynamap.api.exception;

/**
 * The key of a request could not be encoded, usually because the hash key is empty.
 */
public class InvalidKeyException extends DynamapException {

  /**
   * Instantiates a new Invalid key exception.
   *
   * @param message the message
   */
  public InvalidKeyException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Invalid key exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidKeyException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
