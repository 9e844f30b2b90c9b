package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one {@link ProcessEngine#run()} ended with.
 */
public final class RunReport {
  public enum Outcome {
    // the root terminated and nothing is left waiting
    COMPLETED,
    // only persistent listeners, and parents waiting on them, are left
    QUIESCENT,
    // some live instance waits for an event that can never arrive
    DEADLOCKED,
    // the root instance failed
    FAILED,
    // the run used up its step budget and every live instance was timed out
    STEP_LIMIT_EXCEEDED;
  }

  /**
   * A live instance at the end of a run, with what it is waiting for.
   */
  public static final class BlockedInstance {
    private final String instanceId;
    private final State state;
    private final String reason;

    BlockedInstance(final String instanceId, final State state, final String reason) {
      this.instanceId = instanceId;
      this.state = state;
      this.reason = reason;
    }

    public String getInstanceId() {
      return instanceId;
    }

    public State getState() {
      return state;
    }

    public String getReason() {
      return reason;
    }

    @Override
    public String toString() {
      return instanceId + " " + state + ": " + reason;
    }
  }

  private final Outcome outcome;
  private final String rootId;
  private final Value rootResult;
  private final Environment rootEnvironment;
  private final List<ProcessFault> faults;
  private final List<BlockedInstance> blocked;
  private final List<BlockedInstance> listeners;
  private final List<MatchRecord> matches;
  private final List<String> output;
  private final RunStatistics statistics;

  RunReport(final Outcome outcome, final String rootId, final Value rootResult,
      final Environment rootEnvironment, final List<ProcessFault> faults,
      final List<BlockedInstance> blocked, final List<BlockedInstance> listeners,
      final List<MatchRecord> matches, final List<String> output,
      final RunStatistics statistics) {
    this.outcome = outcome;
    this.rootId = rootId;
    this.rootResult = rootResult;
    this.rootEnvironment = rootEnvironment;
    this.faults = Collections.unmodifiableList(new ArrayList<>(faults));
    this.blocked = Collections.unmodifiableList(new ArrayList<>(blocked));
    this.listeners = Collections.unmodifiableList(new ArrayList<>(listeners));
    this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    this.output = Collections.unmodifiableList(new ArrayList<>(output));
    this.statistics = statistics;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public String getRootId() {
    return rootId;
  }

  /**
   * Value the root terminated with, null while it is still alive or when it failed.
   */
  public Value getRootResult() {
    return rootResult;
  }

  /**
   * Final environment of the root scope.
   */
  public Environment getRootEnvironment() {
    return rootEnvironment;
  }

  /**
   * Faults raised during the run, in the order they were raised.
   */
  public List<ProcessFault> getFaults() {
    return faults;
  }

  public List<BlockedInstance> getBlocked() {
    return blocked;
  }

  public List<BlockedInstance> getListeners() {
    return listeners;
  }

  public List<MatchRecord> getMatches() {
    return matches;
  }

  /**
   * Lines written to output sinks during the run.
   */
  public List<String> getOutput() {
    return output;
  }

  public RunStatistics getStatistics() {
    return statistics;
  }

  public boolean isSuccessful() {
    return outcome == Outcome.COMPLETED || outcome == Outcome.QUIESCENT;
  }

  @Override
  public String toString() {
    return "RunReport [outcome=" + outcome + ", rootResult=" + rootResult + ", faults=" + faults
        + ", blocked=" + blocked + ", listeners=" + listeners.size() + ", matches="
        + matches.size() + ", statistics=" + statistics + "]";
  }
}
