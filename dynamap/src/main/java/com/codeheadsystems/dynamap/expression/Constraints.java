package com.codeheadsystems.dynamap.expression;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Combines and compiles constraints.
 */
public final class Constraints {

  private Constraints() {
  }

  /**
   * All of the constraints must hold.
   *
   * @param constraints the constraints
   * @param <T>         the entity type
   * @return the constraint
   */
  @SafeVarargs
  public static <T> Constraint<T> allOf(final Constraint<T>... constraints) {
    return new Join<>(" and ", List.of(constraints));
  }

  /**
   * At least one of the constraints must hold.
   *
   * @param constraints the constraints
   * @param <T>         the entity type
   * @return the constraint
   */
  @SafeVarargs
  public static <T> Constraint<T> oneOf(final Constraint<T>... constraints) {
    return new Join<>(" or ", List.of(constraints));
  }

  /**
   * Renders the conjunction of the constraints.
   *
   * @param attributes  collects placeholders
   * @param constraints the constraints
   * @param <T>         the entity type
   * @return the condition expression, empty when there are no constraints
   */
  public static <T> Optional<String> render(final ExpressionAttributes attributes,
                                            final List<? extends Constraint<T>> constraints) {
    if (constraints.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(constraints.stream()
        .map(constraint -> constraint.render(attributes))
        .collect(Collectors.joining(" and ")));
  }

  /**
   * Compiles standalone constraints.
   *
   * @param constraints the constraints
   * @param <T>         the entity type
   * @return the compiled expression
   */
  public static <T> CompiledExpression compile(final List<? extends Constraint<T>> constraints) {
    final ExpressionAttributes attributes = new ExpressionAttributes();
    final Optional<String> expression = render(attributes, constraints);
    return ImmutableCompiledExpression.builder()
        .expression(expression)
        .names(attributes.names())
        .values(attributes.values())
        .build();
  }

  /**
   * A failed check means the item already exists or changed.
   *
   * @param constraints the constraints
   * @return the boolean
   */
  public static boolean signalsConflict(final List<? extends Constraint<?>> constraints) {
    return constraints.stream()
        .flatMap(constraint -> constraint.operators().stream())
        .anyMatch(ConditionOperator::signalsConflict);
  }

  /**
   * A failed check means the item is absent.
   *
   * @param constraints the constraints
   * @return the boolean
   */
  public static boolean signalsGone(final List<? extends Constraint<?>> constraints) {
    return constraints.stream()
        .flatMap(constraint -> constraint.operators().stream())
        .anyMatch(ConditionOperator::signalsGone);
  }

  /**
   * {@code (#__n__ op :__n__)}.
   */
  static final class Dyadic<T> implements Constraint<T> {

    private final ConditionOperator operator;
    private final String storageName;
    private final AttributeValue value;

    Dyadic(final ConditionOperator operator, final String storageName, final AttributeValue value) {
      this.operator = operator;
      this.storageName = storageName;
      this.value = value;
    }

    @Override
    public String render(final ExpressionAttributes attributes) {
      return "(" + attributes.name(storageName) + " " + operator.symbol() + " "
          + attributes.value(storageName, value) + ")";
    }

    @Override
    public Set<ConditionOperator> operators() {
      return EnumSet.of(operator);
    }
  }

  /**
   * {@code (attribute_exists(#__n__))}.
   */
  static final class Unary<T> implements Constraint<T> {

    private final ConditionOperator operator;
    private final String storageName;

    Unary(final ConditionOperator operator, final String storageName) {
      this.operator = operator;
      this.storageName = storageName;
    }

    @Override
    public String render(final ExpressionAttributes attributes) {
      return "(" + operator.symbol() + "(" + attributes.name(storageName) + "))";
    }

    @Override
    public Set<ConditionOperator> operators() {
      return EnumSet.of(operator);
    }
  }

  /**
   * {@code (begins_with(#__n__,:__n__))}.
   */
  static final class Call<T> implements Constraint<T> {

    private final ConditionOperator operator;
    private final String storageName;
    private final AttributeValue value;

    Call(final ConditionOperator operator, final String storageName, final AttributeValue value) {
      this.operator = operator;
      this.storageName = storageName;
      this.value = value;
    }

    @Override
    public String render(final ExpressionAttributes attributes) {
      return "(" + operator.symbol() + "(" + attributes.name(storageName) + ","
          + attributes.value(storageName, value) + "))";
    }

    @Override
    public Set<ConditionOperator> operators() {
      return EnumSet.of(operator);
    }
  }

  /**
   * {@code (#__n__ BETWEEN :__n_a__ AND :__n_b__)}.
   */
  static final class Between<T> implements Constraint<T> {

    private final String storageName;
    private final AttributeValue lower;
    private final AttributeValue upper;

    Between(final String storageName, final AttributeValue lower, final AttributeValue upper) {
      this.storageName = storageName;
      this.lower = lower;
      this.upper = upper;
    }

    @Override
    public String render(final ExpressionAttributes attributes) {
      return "(" + attributes.name(storageName) + " BETWEEN " + attributes.value(storageName + "_a", lower)
          + " AND " + attributes.value(storageName + "_b", upper) + ")";
    }

    @Override
    public Set<ConditionOperator> operators() {
      return EnumSet.of(ConditionOperator.BETWEEN);
    }
  }

  /**
   * {@code (#__n__ IN (:__n_0__,:__n_1__))}.
   */
  static final class In<T> implements Constraint<T> {

    private final String storageName;
    private final List<AttributeValue> candidates;

    In(final String storageName, final List<AttributeValue> candidates) {
      if (candidates.isEmpty()) {
        throw new IllegalArgumentException("IN requires at least one value for " + storageName);
      }
      this.storageName = storageName;
      this.candidates = List.copyOf(candidates);
    }

    @Override
    public String render(final ExpressionAttributes attributes) {
      final String values = IntStream.range(0, candidates.size())
          .mapToObj(i -> attributes.value(storageName + "_" + i, candidates.get(i)))
          .collect(Collectors.joining(","));
      return "(" + attributes.name(storageName) + " IN (" + values + "))";
    }

    @Override
    public Set<ConditionOperator> operators() {
      return EnumSet.of(ConditionOperator.IN);
    }
  }

  static final class Join<T> implements Constraint<T> {

    private final String separator;
    private final List<Constraint<T>> constraints;

    Join(final String separator, final List<Constraint<T>> constraints) {
      if (constraints.isEmpty()) {
        throw new IllegalArgumentException("Nothing to join");
      }
      this.separator = separator;
      this.constraints = constraints;
    }

    @Override
    public String render(final ExpressionAttributes attributes) {
      return constraints.stream()
          .map(constraint -> constraint.render(attributes))
          .collect(Collectors.joining(separator, "(", ")"));
    }

    @Override
    public Set<ConditionOperator> operators() {
      final Set<ConditionOperator> operators = EnumSet.noneOf(ConditionOperator.class);
      constraints.forEach(constraint -> operators.addAll(constraint.operators()));
      return operators;
    }

    @Override
    public String toString() {
      return "Join{" + separator.trim() + " " + constraints + "}";
    }
  }
}
