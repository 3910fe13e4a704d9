package com.codeheadsystems.dynamap.expression;

/**
 * Operators of a condition and what their failure says about the stored item.
 */
public enum ConditionOperator {
  EQ("=", true, false),
  NE("<>", false, true),
  LT("<", false, false),
  LE("<=", true, false),
  GT(">", false, false),
  GE(">=", true, false),
  EXISTS("attribute_exists", false, true),
  NOT_EXISTS("attribute_not_exists", true, false),
  BETWEEN("BETWEEN", false, false),
  IN("IN", false, false),
  BEGINS_WITH("begins_with", false, false),
  CONTAINS("contains", false, false);

  private final String symbol;
  private final boolean conflict;
  private final boolean gone;

  ConditionOperator(final String symbol, final boolean conflict, final boolean gone) {
    this.symbol = symbol;
    this.conflict = conflict;
    this.gone = gone;
  }

  /**
   * Symbol or function name in the expression language.
   *
   * @return the string
   */
  public String symbol() {
    return symbol;
  }

  /**
   * A failure means the item already exists or changed in between.
   *
   * @return the boolean
   */
  public boolean signalsConflict() {
    return conflict;
  }

  /**
   * A failure means the item is absent.
   *
   * @return the boolean
   */
  public boolean signalsGone() {
    return gone;
  }
}
