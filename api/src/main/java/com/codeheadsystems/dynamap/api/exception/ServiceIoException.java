package com.codeheadsystems.dynamap.api.exception;

/**
 * The backend call failed for a reason other than a failed precondition.
 */
public class ServiceIoException extends DynamapException {

  /**
   * Instantiates a new Service io exception.
   *
   * @param message the message
   * @param cause   the backend failure
   */
  public ServiceIoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
