package com.codeheadsystems.dynamap.api;

/**
 * Option for a match (range query): either a page size {@link Limit} or a continuation {@link Cursor}.
 */
public sealed interface MatchOption permits Limit, Cursor {

  /**
   * Limit match option.
   *
   * @param size the page size
   * @return the limit
   */
  static Limit limit(final int size) {
    return Limit.of(size);
  }

}
