package com.codeheadsystems.dynamap.converter;

import com.codeheadsystems.dynamap.schema.SetKind;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Converts a single value to and from its storage attribute.
 *
 * @param <A> the value type
 */
public interface ValueCodec<A> {

  /**
   * Encodes a non-null value.
   *
   * @param value the value
   * @return the attribute value
   */
  AttributeValue encode(A value);

  /**
   * Decodes a non-NULL attribute.
   *
   * @param value the attribute value
   * @return the value
   * @throws IllegalArgumentException if the attribute does not hold this type
   */
  A decode(AttributeValue value);

  /**
   * Is empty boolean. Empty values are dropped from fields tagged omitempty.
   *
   * @param value the value
   * @return the boolean
   */
  default boolean isEmpty(final A value) {
    return value == null;
  }

  /**
   * Set type this codec writes, if any.
   *
   * @return the optional
   */
  default Optional<SetKind> setKind() {
    return Optional.empty();
  }
}
