package com.codeheadsystems.dynamap.api.exception;

import com.codeheadsystems.dynamap.api.Thing;

/**
 * The condition attached to a write did not hold.
 *
 * <p>{@link #conflict()} is set when the condition asserted equality or absence, meaning someone else wrote first.
 * {@link #gone()} is set when it asserted inequality or presence, meaning the expected state is no longer there.
 */
public class PreConditionFailedException extends DynamapException {

  private final transient Thing key;
  private final boolean conflict;
  private final boolean gone;

  /**
   * Instantiates a new Pre condition failed exception.
   *
   * @param key      the key of the written item
   * @param conflict the conflict flag
   * @param gone     the gone flag
   * @param cause    the backend failure
   */
  public PreConditionFailedException(final Thing key,
                                     final boolean conflict,
                                     final boolean gone,
                                     final Throwable cause) {
    super("Pre Condition Failed (" + key.hashKey() + ", " + key.sortKey() + ")", cause);
    this.key = key;
    this.conflict = conflict;
    this.gone = gone;
  }

  /**
   * The key of the written item.
   *
   * @return the thing
   */
  public Thing key() {
    return key;
  }

  /**
   * Conflict boolean.
   *
   * @return the boolean
   */
  public boolean conflict() {
    return conflict;
  }

  /**
   * Gone boolean.
   *
   * @return the boolean
   */
  public boolean gone() {
    return gone;
  }
}
