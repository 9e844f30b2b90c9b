package com.github.processfsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pending sends and receives, per channel, in arrival order. Every mutating call performs at most
 * one match; matches involving a persistent entry may enable further matches, which the caller
 * drives through {@link #rescan(ChannelName)}.
 *
 * <p>
 * Removal after a match follows the persistence policy:
 * <ul>
 * <li>a ONCE send is removed unless the receive was a PEEK</li>
 * <li>a PERSISTENT send is never removed</li>
 * <li>ONE_SHOT and PEEK receives are removed</li>
 * <li>a PERSISTENT receive is never removed</li>
 * <li>a RACE receive is removed together with every other arm of its select</li>
 * </ul>
 * A persistent send and a persistent receive match each other at most once.
 *
 * <p>
 * Not thread-safe, it is owned by one scheduler.
 */
final class ChannelStore {
  private final Map<ChannelName, Queues> channels = new LinkedHashMap<>();
  // persistent send sequence to the persistent receive sequences it was delivered to
  private final Map<Long, Set<Long>> deliveredPairs = new HashMap<>();
  private long sequence;
  private long raceGroups;

  Optional<ChannelMatch> publish(final ChannelName channel, final List<Value> payload,
      final Persistence persistence, final String ackTarget) {
    final SendEntry send = new SendEntry(++sequence, channel, payload, persistence, ackTarget);
    final Queues queues = queues(channel);
    for (ReceiveEntry receive : new ArrayList<>(queues.receives)) {
      final Optional<ChannelMatch> match = attempt(send, receive);
      if (match.isPresent()) {
        if (!match.get().isSendRemoved()) {
          queues(channel).sends.addLast(send);
        }
        return match;
      }
    }
    queues.sends.addLast(send);
    return Optional.empty();
  }

  Optional<ChannelMatch> request(final ChannelName channel, final Pattern pattern,
      final ReceiveMode mode, final String continuationId) {
    final ReceiveEntry receive =
        new ReceiveEntry(++sequence, channel, pattern, mode, continuationId, -1L, -1);
    final Queues queues = queues(channel);
    for (SendEntry send : new ArrayList<>(queues.sends)) {
      final Optional<ChannelMatch> match = attempt(send, receive);
      if (match.isPresent()) {
        if (!match.get().isReceiveRemoved()) {
          queues(channel).receives.addLast(receive);
        }
        return match;
      }
    }
    queues.receives.addLast(receive);
    return Optional.empty();
  }

  /**
   * Tries the arms in order against what is already pending; when nothing matches every arm is
   * registered as a RACE receive of one group, so the first later match retracts all of them.
   */
  Optional<ChannelMatch> select(final List<Arm> arms, final String continuationId) {
    final long group = ++raceGroups;
    final List<ReceiveEntry> entries = new ArrayList<>(arms.size());
    for (Arm arm : arms) {
      entries.add(new ReceiveEntry(++sequence, arm.getChannel(), arm.getPattern(),
          ReceiveMode.RACE, continuationId, group, arm.getIndex()));
    }
    for (ReceiveEntry receive : entries) {
      final Queues queues = channels.get(receive.getChannel());
      if (queues == null) {
        continue;
      }
      for (SendEntry send : new ArrayList<>(queues.sends)) {
        final Optional<ChannelMatch> match = attempt(send, receive);
        if (match.isPresent()) {
          return match;
        }
      }
    }
    for (ReceiveEntry receive : entries) {
      queues(receive.getChannel()).receives.addLast(receive);
    }
    return Optional.empty();
  }

  /**
   * Performs the first match that pending entries on the channel still allow, if any.
   */
  Optional<ChannelMatch> rescan(final ChannelName channel) {
    final Queues queues = channels.get(channel);
    if (queues == null) {
      return Optional.empty();
    }
    for (SendEntry send : new ArrayList<>(queues.sends)) {
      for (ReceiveEntry receive : new ArrayList<>(queues.receives)) {
        final Optional<ChannelMatch> match = attempt(send, receive);
        if (match.isPresent()) {
          return match;
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Removes every receive registered by the owner and every synchronous send still waiting to be
   * acknowledged to it.
   *
   * @return the number of entries removed
   */
  int retract(final String ownerId) {
    int removed = 0;
    final Iterator<Map.Entry<ChannelName, Queues>> iterator = channels.entrySet().iterator();
    while (iterator.hasNext()) {
      final Queues queues = iterator.next().getValue();
      final Iterator<ReceiveEntry> receives = queues.receives.iterator();
      while (receives.hasNext()) {
        final ReceiveEntry receive = receives.next();
        if (receive.getContinuationId().equals(ownerId)) {
          receives.remove();
          forgetReceive(receive.getSequence());
          removed++;
        }
      }
      final Iterator<SendEntry> sends = queues.sends.iterator();
      while (sends.hasNext()) {
        final SendEntry send = sends.next();
        if (ownerId.equals(send.getAckTarget()) && !send.isAcknowledged()) {
          sends.remove();
          deliveredPairs.remove(send.getSequence());
          removed++;
        }
      }
      if (queues.isEmpty()) {
        iterator.remove();
      }
    }
    return removed;
  }

  /**
   * Channels the owner currently has receives registered on.
   */
  List<ChannelName> registrationsOf(final String ownerId) {
    final List<ChannelName> registered = new ArrayList<>();
    for (Map.Entry<ChannelName, Queues> entry : channels.entrySet()) {
      for (ReceiveEntry receive : entry.getValue().receives) {
        if (receive.getContinuationId().equals(ownerId) && !registered.contains(entry.getKey())) {
          registered.add(entry.getKey());
        }
      }
    }
    return registered;
  }

  ChannelSnapshot snapshot(final ChannelName channel) {
    final Queues queues = channels.get(channel);
    final List<List<Value>> sends = new ArrayList<>();
    final List<String> receivers = new ArrayList<>();
    if (queues != null) {
      for (SendEntry send : queues.sends) {
        sends.add(send.getPayload());
      }
      for (ReceiveEntry receive : queues.receives) {
        receivers.add(receive.getContinuationId());
      }
    }
    return new ChannelSnapshot(channel, sends, receivers);
  }

  int pendingSends() {
    int count = 0;
    for (Queues queues : channels.values()) {
      count += queues.sends.size();
    }
    return count;
  }

  /**
   * Number of persistent send and receive pairs remembered as already delivered.
   */
  int deliveredPairCount() {
    int count = 0;
    for (Set<Long> receives : deliveredPairs.values()) {
      count += receives.size();
    }
    return count;
  }

  int pendingReceives() {
    int count = 0;
    for (Queues queues : channels.values()) {
      count += queues.receives.size();
    }
    return count;
  }

  void clear() {
    channels.clear();
    deliveredPairs.clear();
  }

  private Optional<ChannelMatch> attempt(final SendEntry send, final ReceiveEntry receive) {
    final boolean bothPersistent = send.getPersistence() == Persistence.PERSISTENT
        && receive.getMode() == ReceiveMode.PERSISTENT;
    if (bothPersistent && deliveredPairs.containsKey(send.getSequence())
        && deliveredPairs.get(send.getSequence()).contains(receive.getSequence())) {
      return Optional.empty();
    }
    final Optional<Map<String, Value>> bindings =
        PatternMatcher.matchArguments(receive.getPattern(), send.getPayload());
    if (!bindings.isPresent()) {
      return Optional.empty();
    }
    if (bothPersistent) {
      Set<Long> receives = deliveredPairs.get(send.getSequence());
      if (receives == null) {
        receives = new HashSet<>();
        deliveredPairs.put(send.getSequence(), receives);
      }
      receives.add(receive.getSequence());
    }
    final boolean sendRemoved =
        send.getPersistence() == Persistence.ONCE && receive.getMode() != ReceiveMode.PEEK;
    final boolean receiveRemoved = receive.getMode() != ReceiveMode.PERSISTENT;
    final Queues queues = queues(send.getChannel());
    if (sendRemoved) {
      queues.sends.remove(send);
    }
    if (receiveRemoved) {
      if (receive.getRaceGroup() >= 0) {
        removeRaceGroup(receive.getRaceGroup());
      } else {
        queues.receives.remove(receive);
      }
    }
    if (queues.isEmpty()) {
      channels.remove(send.getChannel());
    }
    return Optional.of(new ChannelMatch(send, receive, bindings.get(), sendRemoved,
        receiveRemoved));
  }

  private void forgetReceive(final long receiveSequence) {
    final Iterator<Set<Long>> iterator = deliveredPairs.values().iterator();
    while (iterator.hasNext()) {
      final Set<Long> receives = iterator.next();
      receives.remove(receiveSequence);
      if (receives.isEmpty()) {
        iterator.remove();
      }
    }
  }

  private void removeRaceGroup(final long group) {
    final Iterator<Map.Entry<ChannelName, Queues>> iterator = channels.entrySet().iterator();
    while (iterator.hasNext()) {
      final Queues queues = iterator.next().getValue();
      final Iterator<ReceiveEntry> receives = queues.receives.iterator();
      while (receives.hasNext()) {
        if (receives.next().getRaceGroup() == group) {
          receives.remove();
        }
      }
      if (queues.isEmpty()) {
        iterator.remove();
      }
    }
  }

  private Queues queues(final ChannelName channel) {
    Queues queues = channels.get(channel);
    if (queues == null) {
      queues = new Queues();
      channels.put(channel, queues);
    }
    return queues;
  }

  private static final class Queues {
    private final Deque<SendEntry> sends = new ArrayDeque<>();
    private final Deque<ReceiveEntry> receives = new ArrayDeque<>();

    private boolean isEmpty() {
      return sends.isEmpty() && receives.isEmpty();
    }
  }

  /**
   * One arm of a select: the channel to listen on, its pattern and its position in the select.
   */
  static final class Arm {
    private final ChannelName channel;
    private final Pattern pattern;
    private final int index;

    Arm(final ChannelName channel, final Pattern pattern, final int index) {
      this.channel = channel;
      this.pattern = pattern;
      this.index = index;
    }

    ChannelName getChannel() {
      return channel;
    }

    Pattern getPattern() {
      return pattern;
    }

    int getIndex() {
      return index;
    }

    @Override
    public String toString() {
      return index + ":" + channel + "<-" + pattern;
    }
  }

  static final class SendEntry {
    private final long sequence;
    private final ChannelName channel;
    private final List<Value> payload;
    private final Persistence persistence;
    private final String ackTarget;
    private boolean acknowledged;

    SendEntry(final long sequence, final ChannelName channel, final List<Value> payload,
        final Persistence persistence, final String ackTarget) {
      this.sequence = sequence;
      this.channel = channel;
      this.payload = Collections.unmodifiableList(new ArrayList<>(payload));
      this.persistence = persistence;
      this.ackTarget = ackTarget;
    }

    long getSequence() {
      return sequence;
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

    String getAckTarget() {
      return ackTarget;
    }

    boolean isAcknowledged() {
      return acknowledged;
    }

    /**
     * Marks the first delivery of a synchronous send.
     *
     * @return false when there is no sender to acknowledge or it was already acknowledged
     */
    boolean acknowledge() {
      if (ackTarget == null || acknowledged) {
        return false;
      }
      acknowledged = true;
      return true;
    }

    @Override
    public String toString() {
      return "SendEntry [seq=" + sequence + ", channel=" + channel + ", payload=" + payload
          + ", persistence=" + persistence + "]";
    }
  }

  static final class ReceiveEntry {
    private final long sequence;
    private final ChannelName channel;
    private final Pattern pattern;
    private final ReceiveMode mode;
    private final String continuationId;
    private final long raceGroup;
    private final int armIndex;

    ReceiveEntry(final long sequence, final ChannelName channel, final Pattern pattern,
        final ReceiveMode mode, final String continuationId, final long raceGroup,
        final int armIndex) {
      this.sequence = sequence;
      this.channel = channel;
      this.pattern = pattern;
      this.mode = mode;
      this.continuationId = continuationId;
      this.raceGroup = raceGroup;
      this.armIndex = armIndex;
    }

    long getSequence() {
      return sequence;
    }

    ChannelName getChannel() {
      return channel;
    }

    Pattern getPattern() {
      return pattern;
    }

    ReceiveMode getMode() {
      return mode;
    }

    String getContinuationId() {
      return continuationId;
    }

    long getRaceGroup() {
      return raceGroup;
    }

    int getArmIndex() {
      return armIndex;
    }

    @Override
    public String toString() {
      return "ReceiveEntry [seq=" + sequence + ", channel=" + channel + ", pattern=" + pattern
          + ", mode=" + mode + ", continuation=" + continuationId + "]";
    }
  }
}
