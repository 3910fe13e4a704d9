package com.codeheadsystems.dynamap.expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Accumulates the SET, ADD, REMOVE and DELETE clauses of an update expression.
 */
public final class UpdateClauses {

  private final ExpressionAttributes attributes;
  private final List<String> set;
  private final List<String> add;
  private final List<String> remove;
  private final List<String> delete;
  private final Set<String> covered;

  /**
   * Instantiates a new Update clauses.
   */
  public UpdateClauses() {
    this(new ExpressionAttributes(), List.of(), List.of(), List.of(), List.of(), Set.of());
  }

  private UpdateClauses(final ExpressionAttributes attributes,
                        final List<String> set,
                        final List<String> add,
                        final List<String> remove,
                        final List<String> delete,
                        final Set<String> covered) {
    this.attributes = attributes;
    this.set = new ArrayList<>(set);
    this.add = new ArrayList<>(add);
    this.remove = new ArrayList<>(remove);
    this.delete = new ArrayList<>(delete);
    this.covered = new LinkedHashSet<>(covered);
  }

  /**
   * Copy update clauses.
   *
   * @return an independent copy
   */
  public UpdateClauses copy() {
    return new UpdateClauses(attributes.copy(), set, add, remove, delete, covered);
  }

  /**
   * Attributes expression attributes.
   *
   * @return the expression attributes
   */
  public ExpressionAttributes attributes() {
    return attributes;
  }

  /**
   * {@code SET #__n__ = :__n__}.
   *
   * @param storageName the storage name
   * @param value       the value
   * @return the update clauses
   */
  public UpdateClauses set(final String storageName, final AttributeValue value) {
    return set(storageName, attributes.name(storageName) + " = " + attributes.value(storageName, value));
  }

  /**
   * Adds an action to the SET clause.
   *
   * @param storageName the storage name
   * @param action      the action
   * @return the update clauses
   */
  public UpdateClauses set(final String storageName, final String action) {
    return record(set, storageName, action);
  }

  /**
   * Adds an action to the ADD clause.
   *
   * @param storageName the storage name
   * @param action      the action
   * @return the update clauses
   */
  public UpdateClauses add(final String storageName, final String action) {
    return record(add, storageName, action);
  }

  /**
   * Adds an action to the REMOVE clause.
   *
   * @param storageName the storage name
   * @param action      the action
   * @return the update clauses
   */
  public UpdateClauses remove(final String storageName, final String action) {
    return record(remove, storageName, action);
  }

  /**
   * Adds an action to the DELETE clause.
   *
   * @param storageName the storage name
   * @param action      the action
   * @return the update clauses
   */
  public UpdateClauses delete(final String storageName, final String action) {
    return record(delete, storageName, action);
  }

  /**
   * Is covered boolean.
   *
   * @param storageName the storage name
   * @return true if an action already changes the attribute
   */
  public boolean isCovered(final String storageName) {
    return covered.contains(storageName);
  }

  /**
   * Storage names changed by some action.
   *
   * @return the set
   */
  public Set<String> covered() {
    return Set.copyOf(covered);
  }

  /**
   * Renders the update expression, clauses in SET, ADD, REMOVE, DELETE order.
   *
   * @return the expression, empty when there are no actions
   */
  public Optional<String> expression() {
    final String expression = Stream.of(
            clause("SET", set), clause("ADD", add), clause("REMOVE", remove), clause("DELETE", delete))
        .flatMap(Optional::stream)
        .collect(Collectors.joining(" "));
    return expression.isEmpty() ? Optional.empty() : Optional.of(expression);
  }

  private UpdateClauses record(final List<String> clause, final String storageName, final String action) {
    if (!covered.add(storageName)) {
      throw new IllegalArgumentException("Attribute " + storageName + " is updated more than once");
    }
    clause.add(action);
    return this;
  }

  private static Optional<String> clause(final String keyword, final List<String> actions) {
    if (actions.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(keyword + " " + String.join(",", actions));
  }

  @Override
  public String toString() {
    return "UpdateClauses{" + expression().orElse("") + "}";
  }
}
