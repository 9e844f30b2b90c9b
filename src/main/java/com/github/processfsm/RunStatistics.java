package com.github.processfsm;

/**
 * Simple counters for an engine or for one run of it.
 */
public final class RunStatistics {
  private final long startMillis = System.currentTimeMillis();
  long steps;
  long deferred;
  long dropped;
  long spawned;
  long terminated;
  long cancelled;
  long matches;
  long faults;
  int peakLive;

  public long getStartTimeMillis() {
    return startMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  /**
   * Events applied to an instance, whether or not they changed its state.
   */
  public long getSteps() {
    return steps;
  }

  /**
   * Events parked because their target was not ready for them.
   */
  public long getDeferred() {
    return deferred;
  }

  /**
   * Events addressed to instances that had already terminated or were gone.
   */
  public long getDropped() {
    return dropped;
  }

  public long getSpawned() {
    return spawned;
  }

  public long getTerminated() {
    return terminated;
  }

  public long getCancelled() {
    return cancelled;
  }

  public long getMatches() {
    return matches;
  }

  public long getFaults() {
    return faults;
  }

  public int getPeakLive() {
    return peakLive;
  }

  RunStatistics copy() {
    final RunStatistics copy = new RunStatistics();
    copy.steps = steps;
    copy.deferred = deferred;
    copy.dropped = dropped;
    copy.spawned = spawned;
    copy.terminated = terminated;
    copy.cancelled = cancelled;
    copy.matches = matches;
    copy.faults = faults;
    copy.peakLive = peakLive;
    return copy;
  }

  void add(final RunStatistics run) {
    steps += run.steps;
    deferred += run.deferred;
    dropped += run.dropped;
    spawned += run.spawned;
    terminated += run.terminated;
    cancelled += run.cancelled;
    matches += run.matches;
    faults += run.faults;
    peakLive = Math.max(peakLive, run.peakLive);
  }

  @Override
  public String toString() {
    return "RunStatistics [steps=" + steps + ", deferred=" + deferred + ", dropped=" + dropped
        + ", spawned=" + spawned + ", terminated=" + terminated + ", cancelled=" + cancelled
        + ", matches=" + matches + ", faults=" + faults + ", peakLive=" + peakLive
        + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

}
