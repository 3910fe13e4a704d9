package com.codeheadsystems.dynamap.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Continuation point of a paginated match: the raw key of the last item of the previous page.
 *
 * <p>Holds plain key strings rather than a decoded entity, so a cursor stays usable when the entity type changes.
 * Pass it back to the next match call to resume after that key.
 */
public final class Cursor implements MatchOption {

  private final String hashKey;
  private final String sortKey;

  private Cursor(final String hashKey, final String sortKey) {
    this.hashKey = hashKey;
    this.sortKey = sortKey;
  }

  /**
   * Of cursor.
   *
   * @param hashKey the hash key
   * @param sortKey the sort key
   * @return the cursor
   */
  @JsonCreator
  public static Cursor of(@JsonProperty("hashKey") final String hashKey,
                          @JsonProperty("sortKey") final String sortKey) {
    return new Cursor(hashKey == null ? "" : hashKey, sortKey == null ? "" : sortKey);
  }

  /**
   * Hash key string.
   *
   * @return the string
   */
  @JsonProperty("hashKey")
  public String hashKey() {
    return hashKey;
  }

  /**
   * Sort key string, empty when the last item had none.
   *
   * @return the string
   */
  @JsonProperty("sortKey")
  public String sortKey() {
    return sortKey;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Cursor)) {
      return false;
    }
    final Cursor other = (Cursor) o;
    return hashKey.equals(other.hashKey) && sortKey.equals(other.sortKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hashKey, sortKey);
  }

  @Override
  public String toString() {
    return "Cursor{" + hashKey + ", " + sortKey + "}";
  }
}
