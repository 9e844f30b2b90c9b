package com.github.processfsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A send paired with a receive by the channel store, with the bindings the receive's pattern
 * produced and what the persistence policy removed.
 */
final class ChannelMatch {
  private final ChannelStore.SendEntry send;
  private final ChannelStore.ReceiveEntry receive;
  private final Map<String, Value> bindings;
  private final boolean sendRemoved;
  private final boolean receiveRemoved;

  ChannelMatch(final ChannelStore.SendEntry send, final ChannelStore.ReceiveEntry receive,
      final Map<String, Value> bindings, final boolean sendRemoved,
      final boolean receiveRemoved) {
    this.send = send;
    this.receive = receive;
    this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    this.sendRemoved = sendRemoved;
    this.receiveRemoved = receiveRemoved;
  }

  ChannelStore.SendEntry getSend() {
    return send;
  }

  ChannelStore.ReceiveEntry getReceive() {
    return receive;
  }

  ChannelName getChannel() {
    return send.getChannel();
  }

  Map<String, Value> getBindings() {
    return bindings;
  }

  boolean isSendRemoved() {
    return sendRemoved;
  }

  boolean isReceiveRemoved() {
    return receiveRemoved;
  }

  boolean involvesPersistent() {
    return send.getPersistence() == Persistence.PERSISTENT
        || receive.getMode() == ReceiveMode.PERSISTENT;
  }

  @Override
  public String toString() {
    return "ChannelMatch [channel=" + getChannel() + ", payload=" + send.getPayload()
        + ", receiver=" + receive.getContinuationId() + "]";
  }
}
