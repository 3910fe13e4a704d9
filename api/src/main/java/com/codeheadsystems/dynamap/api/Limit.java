package com.codeheadsystems.dynamap.api;

/**
 * Upper bound on the number of items a single match page returns.
 */
public final class Limit implements MatchOption {

  private final int size;

  private Limit(final int size) {
    this.size = size;
  }

  /**
   * Of limit.
   *
   * @param size must be positive
   * @return the limit
   */
  public static Limit of(final int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("Limit must be positive: " + size);
    }
    return new Limit(size);
  }

  /**
   * Size int.
   *
   * @return the page size
   */
  public int size() {
    return size;
  }

  @Override
  public boolean equals(final Object o) {
    return this == o || (o instanceof Limit && ((Limit) o).size == size);
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(size);
  }

  @Override
  public String toString() {
    return "Limit{" + size + "}";
  }
}
