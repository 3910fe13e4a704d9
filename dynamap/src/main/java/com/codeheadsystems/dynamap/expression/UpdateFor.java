package com.codeheadsystems.dynamap.expression;

import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.schema.EntitySchema;
import com.codeheadsystems.dynamap.schema.Field;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Builds update actions on one field of an entity type.
 *
 * @param <T> the entity type
 * @param <A> the value type
 */
public final class UpdateFor<T, A> {

  private final Field<T, A> field;

  private UpdateFor(final Field<T, A> field) {
    this.field = field;
  }

  /**
   * Updates of a field.
   *
   * @param field the field
   * @param <T>   the entity type
   * @param <A>   the value type
   * @return the update builder
   */
  public static <T, A> UpdateFor<T, A> of(final Field<T, A> field) {
    if (field == null) {
      throw new IllegalArgumentException("Field is required");
    }
    return new UpdateFor<>(field);
  }

  /**
   * Updates of a field looked up by its in-memory name. The value type is not checked.
   *
   * @param schema the schema
   * @param name   the field name
   * @param <T>    the entity type
   * @param <A>    the value type
   * @return the update builder
   * @throws IllegalArgumentException if the schema has no such field
   */
  @SuppressWarnings("unchecked")
  public static <T extends Thing, A> UpdateFor<T, A> of(final EntitySchema<T> schema, final String name) {
    final Field<T, ?> field = schema.field(name)
        .orElseThrow(() -> new IllegalArgumentException("No field " + name + " in " + schema.type().getName()));
    return new UpdateFor<>((Field<T, A>) field);
  }

  /**
   * {@code SET #__n__ = :__n__}.
   *
   * @param value the value
   * @return the update operation
   */
  public UpdateOperation<T> set(final A value) {
    return operation(value, (clauses, placeholders) ->
        clauses.set(field.storageName(), placeholders.name() + " = " + placeholders.value()));
  }

  /**
   * {@code SET #__n__ = if_not_exists(#__n__,:__n__)}, keeping a stored value.
   *
   * @param value the value
   * @return the update operation
   */
  public UpdateOperation<T> setNotExists(final A value) {
    return operation(value, (clauses, placeholders) -> clauses.set(field.storageName(),
        placeholders.name() + " = if_not_exists(" + placeholders.name() + "," + placeholders.value() + ")"));
  }

  /**
   * {@code ADD #__n__ :__n__}, adding to a number or a set.
   *
   * @param value the value
   * @return the update operation
   */
  public UpdateOperation<T> add(final A value) {
    return operation(value, (clauses, placeholders) ->
        clauses.add(field.storageName(), placeholders.name() + " " + placeholders.value()));
  }

  /**
   * {@code SET #__n__ = #__n__ + :__n__}.
   *
   * @param value the increment
   * @return the update operation
   */
  public UpdateOperation<T> inc(final A value) {
    return operation(value, (clauses, placeholders) -> clauses.set(field.storageName(),
        placeholders.name() + " = " + placeholders.name() + " + " + placeholders.value()));
  }

  /**
   * {@code SET #__n__ = #__n__ - :__n__}.
   *
   * @param value the decrement
   * @return the update operation
   */
  public UpdateOperation<T> dec(final A value) {
    return operation(value, (clauses, placeholders) -> clauses.set(field.storageName(),
        placeholders.name() + " = " + placeholders.name() + " - " + placeholders.value()));
  }

  /**
   * {@code SET #__n__ = list_append(#__n__,:__n__)}.
   *
   * @param values the elements to append
   * @return the update operation
   */
  public UpdateOperation<T> append(final A values) {
    return operation(values, (clauses, placeholders) -> clauses.set(field.storageName(),
        placeholders.name() + " = list_append(" + placeholders.name() + "," + placeholders.value() + ")"));
  }

  /**
   * {@code SET #__n__ = list_append(:__n__,#__n__)}.
   *
   * @param values the elements to prepend
   * @return the update operation
   */
  public UpdateOperation<T> prepend(final A values) {
    return operation(values, (clauses, placeholders) -> clauses.set(field.storageName(),
        placeholders.name() + " = list_append(" + placeholders.value() + "," + placeholders.name() + ")"));
  }

  /**
   * {@code REMOVE #__n__}.
   *
   * @return the update operation
   */
  public UpdateOperation<T> remove() {
    final String storageName = field.storageName();
    return new Operation<>(storageName, clauses ->
        clauses.remove(storageName, clauses.attributes().name(storageName)));
  }

  /**
   * {@code ADD #__n__ :__n__} on a set, adding the members.
   *
   * @param members the members
   * @return the update operation
   * @throws IllegalStateException if the field is not a set
   */
  public UpdateOperation<T> union(final A members) {
    requireSet("union");
    return add(members);
  }

  /**
   * {@code DELETE #__n__ :__n__} on a set, removing the members.
   *
   * @param members the members
   * @return the update operation
   * @throws IllegalStateException if the field is not a set
   */
  public UpdateOperation<T> minus(final A members) {
    requireSet("minus");
    return operation(members, (clauses, placeholders) ->
        clauses.delete(field.storageName(), placeholders.name() + " " + placeholders.value()));
  }

  private void requireSet(final String action) {
    if (field.setKind().isEmpty()) {
      throw new IllegalStateException("Cannot " + action + " " + field.name() + ": not a set");
    }
  }

  private UpdateOperation<T> operation(final A value,
                                       final BiFunction<UpdateClauses, Placeholders, UpdateClauses> action) {
    final AttributeValue encoded;
    try {
      encoded = field.encodeValue(value);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid value for " + field.name() + ": " + value, e);
    }
    final String storageName = field.storageName();
    return new Operation<>(storageName, clauses -> action.apply(clauses, new Placeholders(
        clauses.attributes().name(storageName), clauses.attributes().value(storageName, encoded))));
  }

  private static final class Placeholders {

    private final String name;
    private final String value;

    private Placeholders(final String name, final String value) {
      this.name = name;
      this.value = value;
    }

    String name() {
      return name;
    }

    String value() {
      return value;
    }
  }

  private static final class Operation<T> implements UpdateOperation<T> {

    private final String storageName;
    private final Consumer<UpdateClauses> action;

    private Operation(final String storageName, final Consumer<UpdateClauses> action) {
      this.storageName = storageName;
      this.action = action;
    }

    @Override
    public String storageName() {
      return storageName;
    }

    @Override
    public void apply(final UpdateClauses clauses) {
      action.accept(clauses);
    }

    @Override
    public String toString() {
      return "UpdateOperation{" + storageName + "}";
    }
  }
}
