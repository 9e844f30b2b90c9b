package com.github.processfsm;

/**
 * This object represents an immutable state of an FSM instance: a {@link Phase} tag plus the
 * qualifier the phase is parameterized by (the term being evaluated, the receive mode, the name
 * being bound, the pattern being tried, the operator being computed...).
 */
public final class State {
  private static final State INITIAL = new State(Phase.INITIAL, null);
  private static final State TERMINATED = new State(Phase.TERMINATED, null);

  private final Phase phase;
  private final Object qualifier;

  private State(final Phase phase, final Object qualifier) {
    this.phase = phase;
    this.qualifier = qualifier;
  }

  public static State initial() {
    return INITIAL;
  }

  public static State terminated() {
    return TERMINATED;
  }

  public static State evaluating(final Term term) {
    return new State(Phase.EVALUATING, term);
  }

  public static State receiving(final ReceiveMode mode) {
    return new State(Phase.RECEIVING, mode);
  }

  public static State binding(final String name) {
    return new State(Phase.BINDING, name);
  }

  public static State matching(final Pattern pattern) {
    return new State(Phase.MATCHING, pattern);
  }

  public static State constructing(final ConstructKind kind) {
    return new State(Phase.CONSTRUCTING, kind);
  }

  public static State operating(final Operator operator) {
    return new State(operator.getPhase(), operator);
  }

  public static State bundling(final BundleMode mode) {
    return new State(Phase.BUNDLING, mode);
  }

  public static State referencing(final ReferenceMode mode) {
    return new State(Phase.REFERENCING, mode);
  }

  public static State collecting(final CollectionKind kind) {
    return new State(Phase.COLLECTING, kind);
  }

  /**
   * States that carry no qualifier.
   */
  public static State of(final Phase phase) {
    switch (phase) {
      case INITIAL:
        return INITIAL;
      case TERMINATED:
        return TERMINATED;
      case SENDING:
      case WAITING:
      case BRANCHING:
      case FORKING:
      case JOINING:
      case TERMINATING:
        return new State(phase, null);
      default:
        throw new IllegalArgumentException(phase + " needs a qualifier");
    }
  }

  public Phase getPhase() {
    return phase;
  }

  public Object getQualifier() {
    return qualifier;
  }

  public boolean is(final Phase other) {
    return phase == other;
  }

  public boolean isTerminated() {
    return phase == Phase.TERMINATED;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + phase.hashCode();
    result = prime * result + ((qualifier == null) ? 0 : qualifier.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (phase != other.phase) {
      return false;
    }
    if (qualifier == null) {
      if (other.qualifier != null) {
        return false;
      }
    } else if (!qualifier.equals(other.qualifier)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return qualifier == null ? phase.name() : phase.name() + "(" + qualifier + ")";
  }
}
