package com.codeheadsystems.dynamap.api;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One page of a match.
 *
 * @param <T> the entity type
 */
@Value.Immutable
public interface Page<T> {

  /**
   * Items in sort key order.
   *
   * @return the items
   */
  List<T> items();

  /**
   * Present only when the backend reported more results.
   *
   * @return the cursor
   */
  Optional<Cursor> cursor();

  /**
   * Has more boolean.
   *
   * @return true if another page can be requested with {@link #cursor()}
   */
  default boolean hasMore() {
    return cursor().isPresent();
  }
}
