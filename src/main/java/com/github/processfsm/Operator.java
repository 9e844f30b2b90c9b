package com.github.processfsm;

/**
 * Operators of the expression constructs. The phase an instance passes through while computing an
 * operator is {@link #getPhase()}.
 */
public enum Operator {
  ADD("+"), SUB("-"), MULT("*"), DIV("/"), MOD("%"),
  EQ("=="), NEQ("!="), LT("<"), LTE("<="), GT(">"), GTE(">="),
  CONCAT("++"), DIFF("--"),
  // short-circuit
  AND("and"), OR("or"),
  NOT("not"), NEG("-"),
  INTERPOLATION("%%"),
  // strict
  CONJUNCTION("/\\"), DISJUNCTION("\\/"), NEGATION("~"),
  METHOD(".");

  private final String symbol;

  private Operator(final String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isUnary() {
    return this == NOT || this == NEG || this == NEGATION;
  }

  public Phase getPhase() {
    switch (this) {
      case INTERPOLATION:
        return Phase.INTERPOLATING;
      case CONJUNCTION:
        return Phase.CONJOINING;
      case DISJUNCTION:
        return Phase.DISJOINING;
      case NEGATION:
        return Phase.NEGATING;
      default:
        return Phase.OPERATING;
    }
  }
}
