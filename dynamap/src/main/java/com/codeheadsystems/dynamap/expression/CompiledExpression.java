package com.codeheadsystems.dynamap.expression;

import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import org.immutables.value.Value;

/**
 * A rendered expression with the placeholders it uses.
 */
@Value.Immutable
public interface CompiledExpression {

  /**
   * Expression optional.
   *
   * @return the expression, empty when nothing was rendered
   */
  Optional<String> expression();

  /**
   * Names map.
   *
   * @return the map
   */
  Map<String, String> names();

  /**
   * Values map.
   *
   * @return the map
   */
  Map<String, AttributeValue> values();

  /**
   * Names, or null when there are none.
   *
   * @return the map
   */
  default Map<String, String> namesOrNull() {
    return names().isEmpty() ? null : names();
  }

  /**
   * Values, or null when there are none.
   *
   * @return the map
   */
  default Map<String, AttributeValue> valuesOrNull() {
    return values().isEmpty() ? null : values();
  }
}
