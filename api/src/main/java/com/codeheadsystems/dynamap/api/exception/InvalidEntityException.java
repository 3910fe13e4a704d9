package com.codeheadsystems.dynamap.api.exception;

/**
 * An entity could not be encoded, or a stored item could not be decoded into the entity type.
 */
public class InvalidEntityException extends DynamapException {

  /**
   * Instantiates a new Invalid entity exception.
   *
   * @param message the message
   */
  public InvalidEntityException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Invalid entity exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidEntityException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
