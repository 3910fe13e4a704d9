package com.codeheadsystems.dynamap.expression;

import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.converter.EntityCodec;
import com.codeheadsystems.dynamap.schema.EntitySchema;
import com.codeheadsystems.dynamap.schema.Field;
import java.util.Arrays;
import java.util.List;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Builds constraints on one field of an entity type.
 *
 * <pre>{@code
 * ConditionFor<Person, String> name = ConditionFor.of(Person.SCHEMA, "name");
 * keyVal.put(person, name.optimistic("Joe"));
 * }</pre>
 *
 * @param <T> the entity type
 * @param <A> the value type
 */
public final class ConditionFor<T, A> {

  private final Field<T, A> field;

  private ConditionFor(final Field<T, A> field) {
    this.field = field;
  }

  /**
   * Constraints on a field.
   *
   * @param field the field
   * @param <T>   the entity type
   * @param <A>   the value type
   * @return the condition builder
   */
  public static <T, A> ConditionFor<T, A> of(final Field<T, A> field) {
    if (field == null) {
      throw new IllegalArgumentException("Field is required");
    }
    return new ConditionFor<>(field);
  }

  /**
   * Constraints on a field looked up by its in-memory name. The value type is not checked.
   *
   * @param schema the schema
   * @param name   the field name
   * @param <T>    the entity type
   * @param <A>    the value type
   * @return the condition builder
   * @throws IllegalArgumentException if the schema has no such field
   */
  @SuppressWarnings("unchecked")
  public static <T extends Thing, A> ConditionFor<T, A> of(final EntitySchema<T> schema, final String name) {
    final Field<T, ?> field = schema.field(name)
        .orElseThrow(() -> new IllegalArgumentException("No field " + name + " in " + schema.type().getName()));
    return new ConditionFor<>((Field<T, A>) field);
  }

  /**
   * Field field.
   *
   * @return the field
   */
  public Field<T, A> field() {
    return field;
  }

  /**
   * Eq constraint.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> eq(final A value) {
    return dyadic(ConditionOperator.EQ, value);
  }

  /**
   * Ne constraint.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> ne(final A value) {
    return dyadic(ConditionOperator.NE, value);
  }

  /**
   * Lt constraint.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> lt(final A value) {
    return dyadic(ConditionOperator.LT, value);
  }

  /**
   * Le constraint.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> le(final A value) {
    return dyadic(ConditionOperator.LE, value);
  }

  /**
   * Gt constraint.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> gt(final A value) {
    return dyadic(ConditionOperator.GT, value);
  }

  /**
   * Ge constraint.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> ge(final A value) {
    return dyadic(ConditionOperator.GE, value);
  }

  /**
   * Exists constraint.
   *
   * @return the constraint
   */
  public Constraint<T> exists() {
    return new Constraints.Unary<>(ConditionOperator.EXISTS, field.storageName());
  }

  /**
   * Not exists constraint.
   *
   * @return the constraint
   */
  public Constraint<T> notExists() {
    return new Constraints.Unary<>(ConditionOperator.NOT_EXISTS, field.storageName());
  }

  /**
   * Between constraint, bounds included.
   *
   * @param lower the lower bound
   * @param upper the upper bound
   * @return the constraint
   */
  public Constraint<T> between(final A lower, final A upper) {
    return new Constraints.Between<>(field.storageName(), encode(lower), encode(upper));
  }

  /**
   * In constraint.
   *
   * @param values the candidates
   * @return the constraint
   */
  @SafeVarargs
  public final Constraint<T> in(final A... values) {
    return in(Arrays.asList(values));
  }

  /**
   * In constraint.
   *
   * @param values the candidates
   * @return the constraint
   */
  public Constraint<T> in(final List<A> values) {
    return new Constraints.In<>(field.storageName(), values.stream().map(this::encode).toList());
  }

  /**
   * Has prefix constraint.
   *
   * @param prefix the prefix
   * @return the constraint
   */
  public Constraint<T> hasPrefix(final A prefix) {
    return new Constraints.Call<>(ConditionOperator.BEGINS_WITH, field.storageName(), encode(prefix));
  }

  /**
   * Contains constraint, a substring of a string or a member of a set.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> contains(final A value) {
    return new Constraints.Call<>(ConditionOperator.CONTAINS, field.storageName(), encode(value));
  }

  /**
   * The field equals the value, or is absent when the value is absent or the empty sort key sentinel.
   *
   * @param value the value
   * @return the constraint
   */
  public Constraint<T> is(final A value) {
    final AttributeValue encoded = encode(value);
    if (Boolean.TRUE.equals(encoded.nul()) || EntityCodec.SORT_KEY_SENTINEL.equals(encoded.s())) {
      return notExists();
    }
    return new Constraints.Dyadic<>(ConditionOperator.EQ, field.storageName(), encoded);
  }

  /**
   * Optimistic locking: the field is absent (first write) or still holds the expected value.
   *
   * @param expected the expected value
   * @return the constraint
   */
  public Constraint<T> optimistic(final A expected) {
    return Constraints.oneOf(notExists(), eq(expected));
  }

  private Constraint<T> dyadic(final ConditionOperator operator, final A value) {
    return new Constraints.Dyadic<>(operator, field.storageName(), encode(value));
  }

  private AttributeValue encode(final A value) {
    try {
      return field.encodeValue(value);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid value for " + field.name() + ": " + value, e);
    }
  }
}
