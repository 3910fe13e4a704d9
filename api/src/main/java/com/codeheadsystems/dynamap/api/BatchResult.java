package com.codeheadsystems.dynamap.api;

import com.codeheadsystems.dynamap.api.exception.BatchPartialIoException;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Outcome of a batch call. A partial failure is a normal result: the skipped items are listed in
 * {@link #unprocessed()} and may be retried by the caller.
 *
 * @param <T> the entity type
 */
@Value.Immutable
public interface BatchResult<T> {

  /**
   * Items returned by the backend. Only batch reads fill this in.
   *
   * @return the items
   */
  List<T> items();

  /**
   * Items (or keys, for reads) the backend did not process.
   *
   * @return the unprocessed items
   */
  List<T> unprocessed();

  /**
   * Is complete boolean.
   *
   * @return true when every item was processed
   */
  default boolean isComplete() {
    return unprocessed().isEmpty();
  }

  /**
   * The partial failure, if any.
   *
   * @return the failure
   */
  default Optional<BatchPartialIoException> failure() {
    if (isComplete()) {
      return Optional.empty();
    }
    return Optional.of(new BatchPartialIoException(unprocessed()));
  }

  /**
   * Throws the partial failure, if any.
   *
   * @return the items
   */
  default List<T> orThrow() {
    final Optional<BatchPartialIoException> failure = failure();
    if (failure.isPresent()) {
      throw failure.get();
    }
    return items();
  }
}
