package com.codeheadsystems.dynamap.api.exception;

import com.codeheadsystems.dynamap.api.Thing;

/**
 * No item is stored under the requested key.
 */
public class NotFoundException extends DynamapException {

  private final transient Thing key;

  /**
   * Instantiates a new Not found exception.
   *
   * @param key the requested key
   */
  public NotFoundException(final Thing key) {
    super("Not Found (" + key.hashKey() + ", " + key.sortKey() + ")");
    this.key = key;
  }

  /**
   * The requested key.
   *
   * @return the thing
   */
  public Thing key() {
    return key;
  }
}
