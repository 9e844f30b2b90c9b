package com.github.processfsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One running FSM. An instance executes exactly one term; everything it is waiting on lives in its
 * state, frame and pending children. Instances are only ever changed by the scheduler applying a
 * {@link StepOutcome}, or by cancellation.
 */
final class FsmInstance {
  enum Purpose {
    // evaluates an expression for its parent, reports EXPRESSION_EVALUATED
    OPERAND,
    // runs a process body or branch for its parent, reports CHILD_TERMINATED
    BODY;
  }

  private final String id;
  private final String parentId;
  private final Term term;
  private final Purpose purpose;
  private final Deque<State> route = new ArrayDeque<>();

  private State state = State.initial();
  private Environment environment;
  private Frame frame = new Frame();
  private Set<String> pendingChildren = Collections.emptySet();
  private List<Restriction> restrictions;
  private Value result;
  private ProcessFault fault;
  private boolean cancelled;

  FsmInstance(final String id, final String parentId, final Term term, final Purpose purpose,
      final Environment environment, final List<Restriction> restrictions) {
    this.id = id;
    this.parentId = parentId;
    this.term = term;
    this.purpose = purpose;
    this.environment = environment;
    this.restrictions = Collections.unmodifiableList(new ArrayList<>(restrictions));
    route.add(state);
  }

  void apply(final StepOutcome outcome, final int maxRouteLength) {
    final State next = outcome.getState();
    if (!next.equals(state)) {
      route.add(next);
      while (route.size() > maxRouteLength) {
        route.removeFirst();
      }
    }
    state = next;
    environment = outcome.getEnvironment();
    frame = outcome.getFrame();
    pendingChildren = outcome.getPendingChildren();
    restrictions = outcome.getRestrictions();
    result = outcome.getResult();
    fault = outcome.getFault();
  }

  void cancel(final int maxRouteLength) {
    cancelled = true;
    state = State.terminated();
    result = Value.nil();
    pendingChildren = Collections.emptySet();
    route.add(state);
    while (route.size() > maxRouteLength) {
      route.removeFirst();
    }
  }

  String getId() {
    return id;
  }

  String getParentId() {
    return parentId;
  }

  Term getTerm() {
    return term;
  }

  Purpose getPurpose() {
    return purpose;
  }

  State getState() {
    return state;
  }

  Environment getEnvironment() {
    return environment;
  }

  Frame getFrame() {
    return frame;
  }

  Set<String> getPendingChildren() {
    return pendingChildren;
  }

  boolean hasPendingChild(final String childId) {
    return pendingChildren.contains(childId);
  }

  List<Restriction> getRestrictions() {
    return restrictions;
  }

  Value getResult() {
    return result;
  }

  ProcessFault getFault() {
    return fault;
  }

  boolean isCancelled() {
    return cancelled;
  }

  boolean isTerminated() {
    return state.isTerminated();
  }

  List<State> getRoute() {
    return Collections.unmodifiableList(new ArrayList<>(route));
  }

  @Override
  public String toString() {
    return "FsmInstance [id=" + id + ", term=" + term + ", state=" + state + ", children="
        + new LinkedHashSet<>(pendingChildren) + "]";
  }
}
