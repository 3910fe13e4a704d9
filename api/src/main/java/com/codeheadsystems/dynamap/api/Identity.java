package com.codeheadsystems.dynamap.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compact hierarchical identifier, {@code prefix:segment/segment/...}.
 *
 * <p>The prefix names a namespace and is optional. Two identities are equal when their normalized string forms
 * are equal, and identities are ordered lexicographically on that form, so related identities share a common
 * string prefix and can be reached with a range query.
 *
 * <p>A trailing {@code /} is kept: {@code order/} names the children of {@code order} and is a different identity,
 * so a prefix scan on it does not reach siblings such as {@code orders/9}.
 */
public final class Identity implements Comparable<Identity> {

  /**
   * The empty identity. Never valid as a partition key.
   */
  public static final Identity EMPTY = new Identity("");

  private static final char PREFIX_SEPARATOR = ':';
  private static final char PATH_SEPARATOR = '/';

  private final String value;

  private Identity(final String value) {
    this.value = value;
  }

  /**
   * Parses an identity. The safe form {@code [prefix:path]} is accepted as well.
   *
   * @param value the value, may be null
   * @return the identity
   */
  @JsonCreator
  public static Identity of(final String value) {
    final String normalized = normalize(value);
    return normalized.isEmpty() ? EMPTY : new Identity(normalized);
  }

  /**
   * Builds an identity from a namespace prefix and path segments.
   *
   * @param prefix   the prefix
   * @param segments the segments
   * @return the identity
   */
  public static Identity of(final String prefix, final String... segments) {
    final String path = String.join(String.valueOf(PATH_SEPARATOR), segments);
    if (prefix == null || prefix.isBlank()) {
      return of(path);
    }
    return of(prefix.trim() + PREFIX_SEPARATOR + path);
  }

  private static String normalize(final String value) {
    if (value == null) {
      return "";
    }
    String result = value.trim();
    if (result.length() >= 2 && result.charAt(0) == '[' && result.charAt(result.length() - 1) == ']') {
      result = result.substring(1, result.length() - 1).trim();
    }
    return result;
  }

  private int prefixEnd() {
    final int colon = value.indexOf(PREFIX_SEPARATOR);
    if (colon <= 0) {
      return -1;
    }
    final int slash = value.indexOf(PATH_SEPARATOR);
    return (slash >= 0 && slash < colon) ? -1 : colon;
  }

  /**
   * Is empty boolean.
   *
   * @return true if the identity carries no value
   */
  public boolean isEmpty() {
    return value.isEmpty();
  }

  /**
   * The namespace prefix, empty when the identity has none.
   *
   * @return the prefix
   */
  public String prefix() {
    final int end = prefixEnd();
    return end < 0 ? "" : value.substring(0, end);
  }

  /**
   * The local path following the prefix.
   *
   * @return the path
   */
  public String path() {
    final int end = prefixEnd();
    return end < 0 ? value : value.substring(end + 1);
  }

  /**
   * Path segments.
   *
   * @return the segments
   */
  public List<String> segments() {
    final String path = path();
    if (path.isEmpty()) {
      return List.of();
    }
    final List<String> result = new ArrayList<>();
    for (String segment : path.split(String.valueOf(PATH_SEPARATOR))) {
      if (!segment.isEmpty()) {
        result.add(segment);
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Number of components: the prefix (when present) plus every path segment.
   *
   * @return the rank
   */
  public int rank() {
    if (isEmpty()) {
      return 0;
    }
    return (prefix().isEmpty() ? 0 : 1) + segments().size();
  }

  /**
   * Child identity with the given segments appended to the path.
   *
   * @param segments the segments
   * @return the child identity
   */
  public Identity join(final String... segments) {
    final String suffix = String.join(String.valueOf(PATH_SEPARATOR), Arrays.asList(segments));
    if (isEmpty()) {
      return of(suffix);
    }
    final char last = value.charAt(value.length() - 1);
    if (last == PREFIX_SEPARATOR || last == PATH_SEPARATOR) {
      return of(value + suffix);
    }
    return of(value + PATH_SEPARATOR + suffix);
  }

  /**
   * Identity one level up the hierarchy. The parent of a single segment identity is its bare prefix.
   *
   * @return the parent
   */
  public Identity parent() {
    final List<String> segments = segments();
    if (segments.isEmpty()) {
      return EMPTY;
    }
    final String prefix = prefix();
    final String[] head = segments.subList(0, segments.size() - 1).toArray(new String[0]);
    if (prefix.isEmpty()) {
      return of(String.join(String.valueOf(PATH_SEPARATOR), head));
    }
    return of(prefix + PREFIX_SEPARATOR + String.join(String.valueOf(PATH_SEPARATOR), head));
  }

  /**
   * True if this identity is other or lies below it.
   *
   * @param other the other
   * @return the boolean
   */
  public boolean startsWith(final Identity other) {
    return value.startsWith(other.value);
  }

  /**
   * Safe form, {@code [prefix:path]}.
   *
   * @return the string
   */
  public String safe() {
    return "[" + value + "]";
  }

  @Override
  public int compareTo(final Identity other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Identity)) {
      return false;
    }
    return value.equals(((Identity) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @JsonValue
  @Override
  public String toString() {
    return value;
  }
}
