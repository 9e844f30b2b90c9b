package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable event addressed to one FSM instance.
 */
public final class Event {
  public enum Type {
    MESSAGE_AVAILABLE, CONDITION_MET, EXPRESSION_EVALUATED, PATTERN_MATCHED, TIMEOUT, ERROR, SIGNAL;
  }

  public enum Signal {
    // first event of every instance
    START,
    // self-addressed, moves an instance out of a state that completes in one step
    CONTINUE,
    // a body or branch child terminated
    CHILD_TERMINATED,
    // a synchronous send was consumed
    ACK;
  }

  private final Type type;
  private final Signal signal;
  private final String targetId;
  private final String sourceId;
  private final ChannelName channel;
  private final List<Value> payload;
  private final Map<String, Value> bindings;
  private final Value value;
  private final int armIndex;
  private final String movedName;
  private final ProcessFault fault;

  private Event(final Type type, final Signal signal, final String targetId,
      final String sourceId, final ChannelName channel, final List<Value> payload,
      final Map<String, Value> bindings, final Value value, final int armIndex,
      final String movedName, final ProcessFault fault) {
    this.type = type;
    this.signal = signal;
    this.targetId = targetId;
    this.sourceId = sourceId;
    this.channel = channel;
    this.payload = payload == null ? Collections.<Value>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(payload));
    this.bindings = bindings == null ? Collections.<String, Value>emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    this.value = value;
    this.armIndex = armIndex;
    this.movedName = movedName;
    this.fault = fault;
  }

  static Event signal(final Signal signal, final String targetId, final String sourceId) {
    return new Event(Type.SIGNAL, signal, targetId, sourceId, null, null, null, null, -1, null,
        null);
  }

  static Event childTerminated(final String targetId, final String sourceId, final Value value) {
    return new Event(Type.SIGNAL, Signal.CHILD_TERMINATED, targetId, sourceId, null, null, null,
        value, -1, null, null);
  }

  static Event messageAvailable(final String targetId, final ChannelName channel,
      final List<Value> payload, final Map<String, Value> bindings, final int armIndex) {
    return new Event(Type.MESSAGE_AVAILABLE, null, targetId, null, channel, payload, bindings,
        null, armIndex, null, null);
  }

  static Event conditionMet(final String targetId, final boolean condition) {
    return new Event(Type.CONDITION_MET, null, targetId, targetId, null, null, null,
        Value.ofBool(condition), -1, null, null);
  }

  static Event expressionEvaluated(final String targetId, final String sourceId,
      final Value value, final String movedName) {
    return new Event(Type.EXPRESSION_EVALUATED, null, targetId, sourceId, null, null, null, value,
        -1, movedName, null);
  }

  static Event patternMatched(final String targetId, final Map<String, Value> bindings) {
    return new Event(Type.PATTERN_MATCHED, null, targetId, targetId, null, null, bindings, null,
        -1, null, null);
  }

  static Event timeout(final String targetId) {
    return new Event(Type.TIMEOUT, null, targetId, null, null, null, null, null, -1, null, null);
  }

  static Event error(final String targetId, final String sourceId, final ProcessFault fault) {
    return new Event(Type.ERROR, null, targetId, sourceId, null, null, null, null, -1, null,
        fault);
  }

  public Type getType() {
    return type;
  }

  public Signal getSignal() {
    return signal;
  }

  public boolean is(final Signal other) {
    return type == Type.SIGNAL && signal == other;
  }

  public String getTargetId() {
    return targetId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public ChannelName getChannel() {
    return channel;
  }

  public List<Value> getPayload() {
    return payload;
  }

  public Map<String, Value> getBindings() {
    return bindings;
  }

  public Value getValue() {
    return value;
  }

  /**
   * Index of the select arm that was satisfied, -1 for plain receives.
   */
  public int getArmIndex() {
    return armIndex;
  }

  public String getMovedName() {
    return movedName;
  }

  public ProcessFault getFault() {
    return fault;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder(type == Type.SIGNAL ? signal.name() : type.name());
    builder.append(" [target=").append(targetId);
    if (sourceId != null && !sourceId.equals(targetId)) {
      builder.append(", source=").append(sourceId);
    }
    if (channel != null) {
      builder.append(", channel=").append(channel).append(", payload=").append(payload);
    }
    if (value != null) {
      builder.append(", value=").append(value);
    }
    if (fault != null) {
      builder.append(", fault=").append(fault.getKind());
    }
    return builder.append(']').toString();
  }
}
