package com.github.processfsm;

/**
 * The closed set of tags an FSM instance's {@link State} can carry. TERMINATED is absorbing and
 * INITIAL has no incoming transition.
 */
public enum Phase {
  INITIAL,
  // qualified by the term being evaluated
  EVALUATING,
  SENDING,
  // qualified by a ReceiveMode
  RECEIVING,
  // synchronous send waiting for its acknowledgement
  WAITING,
  BRANCHING,
  FORKING,
  JOINING,
  // qualified by the bound name
  BINDING,
  // qualified by the pattern being tried
  MATCHING,
  // qualified by a ConstructKind
  CONSTRUCTING,
  // qualified by an Operator
  OPERATING,
  // qualified by a BundleMode
  BUNDLING,
  // qualified by a ReferenceMode
  REFERENCING,
  INTERPOLATING,
  CONJOINING,
  DISJOINING,
  NEGATING,
  // qualified by a CollectionKind
  COLLECTING,
  TERMINATING,
  TERMINATED;

  /**
   * Suspension phases are the only ones an instance may sit in without further local progress.
   */
  public boolean isSuspension() {
    return this == SENDING || this == RECEIVING || this == JOINING || this == WAITING;
  }
}
