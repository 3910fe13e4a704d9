package com.codeheadsystems.dynamap.expression;

/**
 * One action of an update expression, on one field.
 *
 * @param <T> the entity type
 */
public interface UpdateOperation<T> {

  /**
   * Storage name of the field the action changes.
   *
   * @return the string
   */
  String storageName();

  /**
   * Adds the action to its clause.
   *
   * @param clauses the clauses
   */
  void apply(UpdateClauses clauses);
}
