package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * This object encapsulates the result of applying the transition function to an instance and an
 * event. Either the instance progressed, in which case the outcome carries everything the instance
 * becomes plus the ordered effects to apply, or the event did not enable any transition
 * ({@link #isProgressed()} is false) and it was not consumed.
 */
final class StepOutcome {
  private static final StepOutcome NOT_READY =
      new StepOutcome(false, null, null, null, null, null, null, null, null);

  private final boolean progressed;
  private final State state;
  private final Environment environment;
  private final Frame frame;
  private final Set<String> pendingChildren;
  private final Value result;
  private final ProcessFault fault;
  private final List<Restriction> restrictions;
  private final List<Effect> effects;

  private StepOutcome(final boolean progressed, final State state, final Environment environment,
      final Frame frame, final Set<String> pendingChildren, final Value result,
      final ProcessFault fault, final List<Restriction> restrictions, final List<Effect> effects) {
    this.progressed = progressed;
    this.state = state;
    this.environment = environment;
    this.frame = frame;
    this.pendingChildren = pendingChildren;
    this.result = result;
    this.fault = fault;
    this.restrictions = restrictions;
    this.effects = effects;
  }

  static StepOutcome notReady() {
    return NOT_READY;
  }

  static StepOutcome progressed(final State state, final Environment environment,
      final Frame frame, final Set<String> pendingChildren, final Value result,
      final ProcessFault fault, final List<Restriction> restrictions, final List<Effect> effects) {
    return new StepOutcome(true, state, environment, frame,
        Collections.unmodifiableSet(new LinkedHashSet<>(pendingChildren)), result, fault,
        restrictions, Collections.unmodifiableList(new ArrayList<>(effects)));
  }

  boolean isProgressed() {
    return progressed;
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

  Value getResult() {
    return result;
  }

  ProcessFault getFault() {
    return fault;
  }

  List<Restriction> getRestrictions() {
    return restrictions;
  }

  List<Effect> getEffects() {
    return effects;
  }

  @Override
  public String toString() {
    if (!progressed) {
      return "StepOutcome [NOT_READY]";
    }
    return "StepOutcome [state=" + state + ", effects=" + effects.size()
        + (fault == null ? "" : ", fault=" + fault.getKind()) + "]";
  }
}
