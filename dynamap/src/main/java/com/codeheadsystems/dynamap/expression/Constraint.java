package com.codeheadsystems.dynamap.expression;

import java.util.Set;

/**
 * A predicate over a stored item of type {@code T}, guarding a write.
 *
 * @param <T> the entity type
 */
public interface Constraint<T> {

  /**
   * Renders the predicate, registering its placeholders.
   *
   * @param attributes the attributes
   * @return the condition expression fragment
   */
  String render(ExpressionAttributes attributes);

  /**
   * Operators used by the predicate.
   *
   * @return the set
   */
  Set<ConditionOperator> operators();
}
