package com.codeheadsystems.dynamap.expression;

import java.util.Arrays;
import java.util.List;

/**
 * An entity together with explicit update actions on some of its fields. Fields no action touches are written
 * from the entity as plain SETs when the update is sent.
 *
 * @param <T> the entity type
 */
public final class Updater<T> {

  private final T entity;
  private final List<UpdateOperation<T>> operations;
  private final UpdateClauses clauses;

  private Updater(final T entity, final List<UpdateOperation<T>> operations) {
    this.entity = entity;
    this.operations = List.copyOf(operations);
    this.clauses = new UpdateClauses();
    this.operations.forEach(operation -> operation.apply(clauses));
  }

  /**
   * Of updater.
   *
   * @param entity     the entity, supplies the key and the implicit SETs
   * @param operations the actions
   * @param <T>        the entity type
   * @return the updater
   * @throws IllegalArgumentException if two actions change the same field
   */
  @SafeVarargs
  public static <T> Updater<T> of(final T entity, final UpdateOperation<T>... operations) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity is required");
    }
    return new Updater<>(entity, Arrays.asList(operations));
  }

  /**
   * Entity t.
   *
   * @return the entity
   */
  public T entity() {
    return entity;
  }

  /**
   * Operations list.
   *
   * @return the list
   */
  public List<UpdateOperation<T>> operations() {
    return operations;
  }

  /**
   * The clauses of the explicit actions, a fresh copy on every call.
   *
   * @return the update clauses
   */
  public UpdateClauses clauses() {
    return clauses.copy();
  }

  @Override
  public String toString() {
    return "Updater{" + entity + ", " + clauses + "}";
  }
}
