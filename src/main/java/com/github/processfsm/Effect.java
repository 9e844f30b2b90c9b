package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One side effect produced by a step. The scheduler applies a step's effects in order and as a
 * whole before any other step runs.
 */
final class Effect {
  enum Kind {
    SPAWN, ENQUEUE, PUBLISH, REQUEST, SELECT, RETRACT;
  }

  private final Kind kind;
  private final FsmInstance child;
  private final Event event;
  private final ChannelName channel;
  private final List<Value> payload;
  private final Persistence persistence;
  private final Pattern pattern;
  private final ReceiveMode mode;
  private final List<ChannelStore.Arm> arms;
  private final String instanceId;

  private Effect(final Kind kind, final FsmInstance child, final Event event,
      final ChannelName channel, final List<Value> payload, final Persistence persistence,
      final Pattern pattern, final ReceiveMode mode, final List<ChannelStore.Arm> arms,
      final String instanceId) {
    this.kind = kind;
    this.child = child;
    this.event = event;
    this.channel = channel;
    this.payload = payload;
    this.persistence = persistence;
    this.pattern = pattern;
    this.mode = mode;
    this.arms = arms;
    this.instanceId = instanceId;
  }

  static Effect spawn(final FsmInstance child) {
    return new Effect(Kind.SPAWN, child, null, null, null, null, null, null, null,
        child.getId());
  }

  static Effect enqueue(final Event event) {
    return new Effect(Kind.ENQUEUE, null, event, null, null, null, null, null, null,
        event.getTargetId());
  }

  /**
   * @param ackTarget instance to acknowledge on the first delivery, null for asynchronous
   *        sends
   */
  static Effect publish(final ChannelName channel, final List<Value> payload,
      final Persistence persistence, final String ackTarget) {
    return new Effect(Kind.PUBLISH, null, null, channel,
        Collections.unmodifiableList(new ArrayList<>(payload)), persistence, null, null, null,
        ackTarget);
  }

  static Effect request(final ChannelName channel, final Pattern pattern, final ReceiveMode mode,
      final String continuationId) {
    return new Effect(Kind.REQUEST, null, null, channel, null, null, pattern, mode, null,
        continuationId);
  }

  static Effect select(final List<ChannelStore.Arm> arms, final String continuationId) {
    return new Effect(Kind.SELECT, null, null, null, null, null, null, ReceiveMode.RACE,
        Collections.unmodifiableList(new ArrayList<>(arms)), continuationId);
  }

  static Effect retract(final String ownerId) {
    return new Effect(Kind.RETRACT, null, null, null, null, null, null, null, null, ownerId);
  }

  Kind getKind() {
    return kind;
  }

  FsmInstance getChild() {
    return child;
  }

  Event getEvent() {
    return event;
  }

  ChannelName getChannel() {
    return channel;
  }

  List<Value> getPayload() {
    return payload;
  }

  Persistence getPersistence() {
    return persistence;
  }

  Pattern getPattern() {
    return pattern;
  }

  ReceiveMode getMode() {
    return mode;
  }

  List<ChannelStore.Arm> getArms() {
    return arms;
  }

  /**
   * The spawned child, the event target, the ack target, the continuation or the retracted owner,
   * depending on the kind.
   */
  String getInstanceId() {
    return instanceId;
  }

  @Override
  public String toString() {
    switch (kind) {
      case SPAWN:
        return "SPAWN " + instanceId;
      case ENQUEUE:
        return "ENQUEUE " + event;
      case PUBLISH:
        return "PUBLISH " + channel + payload + " " + persistence;
      case REQUEST:
        return "REQUEST " + channel + " " + pattern + " " + mode;
      case SELECT:
        return "SELECT " + arms;
      default:
        return "RETRACT " + instanceId;
    }
  }
}
