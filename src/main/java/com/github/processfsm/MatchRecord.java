package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One send delivered to one receive, in the order the engine performed the matches.
 */
public final class MatchRecord {
  private final long order;
  private final ChannelName channel;
  private final List<Value> payload;
  private final String receiverId;
  private final ReceiveMode mode;
  private final int armIndex;

  MatchRecord(final long order, final ChannelName channel, final List<Value> payload,
      final String receiverId, final ReceiveMode mode, final int armIndex) {
    this.order = order;
    this.channel = channel;
    this.payload = Collections.unmodifiableList(new ArrayList<>(payload));
    this.receiverId = receiverId;
    this.mode = mode;
    this.armIndex = armIndex;
  }

  public long getOrder() {
    return order;
  }

  public ChannelName getChannel() {
    return channel;
  }

  public List<Value> getPayload() {
    return payload;
  }

  public String getReceiverId() {
    return receiverId;
  }

  public ReceiveMode getMode() {
    return mode;
  }

  /**
   * Winning arm of a select, -1 for other receives.
   */
  public int getArmIndex() {
    return armIndex;
  }

  @Override
  public String toString() {
    return "MatchRecord [order=" + order + ", channel=" + channel + ", payload=" + payload
        + ", receiver=" + receiverId + ", mode=" + mode
        + (armIndex >= 0 ? ", arm=" + armIndex : "") + "]";
  }
}
