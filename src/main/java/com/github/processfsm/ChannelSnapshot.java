package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Point-in-time view of what is pending on one channel.
 */
public final class ChannelSnapshot {
  private final ChannelName channel;
  private final List<List<Value>> pendingSends;
  private final List<String> pendingReceivers;

  ChannelSnapshot(final ChannelName channel, final List<List<Value>> pendingSends,
      final List<String> pendingReceivers) {
    this.channel = channel;
    this.pendingSends = Collections.unmodifiableList(new ArrayList<>(pendingSends));
    this.pendingReceivers = Collections.unmodifiableList(new ArrayList<>(pendingReceivers));
  }

  public ChannelName getChannel() {
    return channel;
  }

  /**
   * Payloads of the pending sends, oldest first.
   */
  public List<List<Value>> getPendingSends() {
    return pendingSends;
  }

  /**
   * Ids of the instances with a pending receive, in registration order.
   */
  public List<String> getPendingReceivers() {
    return pendingReceivers;
  }

  public int sendCount() {
    return pendingSends.size();
  }

  public int receiveCount() {
    return pendingReceivers.size();
  }

  @Override
  public String toString() {
    return "ChannelSnapshot [channel=" + channel + ", sends=" + pendingSends + ", receivers="
        + pendingReceivers + "]";
  }
}
