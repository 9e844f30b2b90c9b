package com.github.processfsm;

/**
 * Raised while computing an operator or method; the transition function turns it into a
 * {@link ProcessFault} of the same kind on the evaluating instance.
 */
final class EvaluationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ProcessFault.FaultKind kind;

  EvaluationException(final ProcessFault.FaultKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  ProcessFault.FaultKind getKind() {
    return kind;
  }
}
