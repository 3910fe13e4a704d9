package com.codeheadsystems.dynamap.schema;

import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Typed view over a stored item, handed to an entity decoder.
 *
 * @param <T> the entity type
 */
public final class ItemReader<T> {

  private final Map<String, AttributeValue> item;

  /**
   * Instantiates a new Item reader.
   *
   * @param item the item
   */
  public ItemReader(final Map<String, AttributeValue> item) {
    this.item = item;
  }

  /**
   * Value of a field, null when absent.
   *
   * @param field the field
   * @param <A>   the value type
   * @return the value
   */
  public <A> A get(final Field<T, A> field) {
    return field.decodeFrom(item);
  }

  /**
   * Value of a field.
   *
   * @param field the field
   * @param <A>   the value type
   * @return the optional
   */
  public <A> Optional<A> find(final Field<T, A> field) {
    return Optional.ofNullable(get(field));
  }

  /**
   * Value of a field or a fallback when absent.
   *
   * @param field    the field
   * @param fallback the fallback
   * @param <A>      the value type
   * @return the value
   */
  public <A> A getOrDefault(final Field<T, A> field, final A fallback) {
    final A value = get(field);
    return value == null ? fallback : value;
  }
}
