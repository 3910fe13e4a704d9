package com.codeheadsystems.dynamap.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * Storage metadata of a field, written as {@code name[,omitempty][,stringset|numberset|binaryset]}.
 */
public final class FieldTag {

  private static final String OMIT_EMPTY = "omitempty";

  private final String storageName;
  private final boolean omitEmpty;
  private final SetKind setKind;

  private FieldTag(final String storageName, final boolean omitEmpty, final SetKind setKind) {
    this.storageName = storageName;
    this.omitEmpty = omitEmpty;
    this.setKind = setKind;
  }

  /**
   * Parses a tag.
   *
   * @param tag the tag
   * @return the field tag
   * @throws IllegalArgumentException if the tag has no storage name or an unknown option
   */
  public static FieldTag parse(final String tag) {
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("Field tag has no storage name");
    }
    final String[] parts = tag.split(",");
    final String storageName = parts[0].trim();
    if (storageName.isEmpty()) {
      throw new IllegalArgumentException("Field tag has no storage name: " + tag);
    }
    boolean omitEmpty = false;
    SetKind setKind = null;
    for (int i = 1; i < parts.length; i++) {
      final String option = parts[i].trim();
      if (OMIT_EMPTY.equals(option)) {
        omitEmpty = true;
        continue;
      }
      final Optional<SetKind> kind = SetKind.fromTag(option);
      if (kind.isEmpty() || setKind != null) {
        throw new IllegalArgumentException("Invalid option '" + option + "' in field tag: " + tag);
      }
      setKind = kind.get();
    }
    return new FieldTag(storageName, omitEmpty, setKind);
  }

  /**
   * Attribute name used by the storage.
   *
   * @return the string
   */
  public String storageName() {
    return storageName;
  }

  /**
   * Omit empty boolean.
   *
   * @return true if empty values are not written
   */
  public boolean omitEmpty() {
    return omitEmpty;
  }

  /**
   * Set kind optional.
   *
   * @return the set kind
   */
  public Optional<SetKind> setKind() {
    return Optional.ofNullable(setKind);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldTag)) {
      return false;
    }
    final FieldTag other = (FieldTag) o;
    return omitEmpty == other.omitEmpty && storageName.equals(other.storageName) && setKind == other.setKind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(storageName, omitEmpty, setKind);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(storageName);
    if (omitEmpty) {
      sb.append(',').append(OMIT_EMPTY);
    }
    if (setKind != null) {
      sb.append(',').append(setKind.tag());
    }
    return sb.toString();
  }
}
