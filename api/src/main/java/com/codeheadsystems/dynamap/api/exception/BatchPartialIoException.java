package com.codeheadsystems.dynamap.api.exception;

import java.util.List;

/**
 * A batch call was only partially applied.
 */
public class BatchPartialIoException extends DynamapException {

  private final transient List<?> unprocessed;

  /**
   * Instantiates a new Batch partial io exception.
   *
   * @param unprocessed the items the backend did not process
   */
  public BatchPartialIoException(final List<?> unprocessed) {
    super("Batch partially applied, " + unprocessed.size() + " item(s) unprocessed");
    this.unprocessed = List.copyOf(unprocessed);
  }

  /**
   * Items the backend did not process.
   *
   * @return the list
   */
  public List<?> unprocessed() {
    return unprocessed;
  }
}
