package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An instance-level failure. Faults are values, not exceptions: they travel up the instance tree as
 * ERROR events and every one of them ends up in the {@link RunReport}.
 */
public final class ProcessFault {
  public enum FaultKind {
    // no match case accepted the value
    UNMATCHED_VALUE,
    // a bundle-restricted operation was attempted
    CAPABILITY_VIOLATION,
    TYPE_MISMATCH,
    UNBOUND_VARIABLE,
    ARITHMETIC,
    UNKNOWN_METHOD,
    // a child failed and its parent surfaced the failure as its own
    CHILD_FAILED,
    // the run ran out of steps while the instance was alive
    TIMEOUT;
  }

  private final FaultKind kind;
  private final String instanceId;
  private final String message;
  private final Value value;
  private final List<String> details;
  private final ProcessFault cause;

  ProcessFault(final FaultKind kind, final String instanceId, final String message,
      final Value value, final List<String> details, final ProcessFault cause) {
    this.kind = kind;
    this.instanceId = instanceId;
    this.message = message;
    this.value = value;
    this.details = Collections.unmodifiableList(new ArrayList<>(details));
    this.cause = cause;
  }

  static ProcessFault of(final FaultKind kind, final String instanceId, final String message) {
    return new ProcessFault(kind, instanceId, message, null, Collections.<String>emptyList(),
        null);
  }

  static ProcessFault childFailed(final String instanceId, final ProcessFault cause) {
    return new ProcessFault(FaultKind.CHILD_FAILED, instanceId,
        "Child " + cause.getInstanceId() + " failed", null, Collections.<String>emptyList(),
        cause);
  }

  public FaultKind getKind() {
    return kind;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getMessage() {
    return message;
  }

  /**
   * The offending value, where there is one.
   */
  public Value getValue() {
    return value;
  }

  /**
   * Extra diagnostic lines, e.g. the patterns that were attempted.
   */
  public List<String> getDetails() {
    return details;
  }

  public ProcessFault getCause() {
    return cause;
  }

  /**
   * Follows the CHILD_FAILED chain down to the fault that started it.
   */
  public ProcessFault getRootCause() {
    ProcessFault fault = this;
    while (fault.cause != null) {
      fault = fault.cause;
    }
    return fault;
  }

  @Override
  public String toString() {
    return "ProcessFault [kind=" + kind + ", instanceId=" + instanceId + ", message=" + message
        + (value == null ? "" : ", value=" + value)
        + (details.isEmpty() ? "" : ", details=" + details)
        + (cause == null ? "" : ", cause=" + cause) + "]";
  }
}
