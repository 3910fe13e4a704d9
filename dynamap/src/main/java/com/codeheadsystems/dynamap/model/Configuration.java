package com.codeheadsystems.dynamap.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Where and how entities are stored.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * The constant DEFAULT_HASH_KEY.
   */
  String DEFAULT_HASH_KEY = "prefix";

  /**
   * The constant DEFAULT_SORT_KEY.
   */
  String DEFAULT_SORT_KEY = "suffix";

  /**
   * Table name.
   *
   * @return the string
   */
  String table();

  /**
   * Secondary index used by match. Point operations always use the table.
   *
   * @return the optional
   */
  Optional<String> index();

  /**
   * Hash key attribute name.
   *
   * @return the string
   */
  @Value.Default
  default String hashKey() {
    return DEFAULT_HASH_KEY;
  }

  /**
   * Sort key attribute name.
   *
   * @return the string
   */
  @Value.Default
  default String sortKey() {
    return DEFAULT_SORT_KEY;
  }

  /**
   * Reject stored items holding attributes the schema does not declare.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean strictType() {
    return false;
  }

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (table().isBlank()) {
      throw new IllegalStateException("Table name is required");
    }
    if (hashKey().isBlank() || sortKey().isBlank()) {
      throw new IllegalStateException("Key attribute names are required");
    }
    if (hashKey().equals(sortKey())) {
      throw new IllegalStateException("Hash and sort key must differ: " + hashKey());
    }
  }
}
