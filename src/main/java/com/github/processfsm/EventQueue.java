package com.github.processfsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-instance mailboxes served round-robin: each call to {@link #next()} takes the oldest event of
 * the next instance in the ring, so no instance with deliverable events is starved. Events an
 * instance was not ready for are parked until {@link #release(String)}.
 */
final class EventQueue {
  private final Map<String, Deque<Event>> mailboxes = new LinkedHashMap<>();
  private final Deque<String> ring = new ArrayDeque<>();
  private final Map<String, List<Event>> deferred = new LinkedHashMap<>();

  void enqueue(final Event event) {
    mailbox(event.getTargetId()).addLast(event);
  }

  /**
   * @return the next event, or null when no mailbox holds one
   */
  Event next() {
    final String target = ring.pollFirst();
    if (target == null) {
      return null;
    }
    final Deque<Event> mailbox = mailboxes.get(target);
    final Event event = mailbox.pollFirst();
    if (mailbox.isEmpty()) {
      mailboxes.remove(target);
    } else {
      ring.addLast(target);
    }
    return event;
  }

  void defer(final Event event) {
    List<Event> parked = deferred.get(event.getTargetId());
    if (parked == null) {
      parked = new ArrayList<>();
      deferred.put(event.getTargetId(), parked);
    }
    parked.add(event);
  }

  /**
   * Puts the instance's parked events back at the head of its mailbox, oldest first.
   */
  void release(final String instanceId) {
    final List<Event> parked = deferred.remove(instanceId);
    if (parked == null) {
      return;
    }
    final Deque<Event> mailbox = mailbox(instanceId);
    for (int i = parked.size() - 1; i >= 0; i--) {
      mailbox.addFirst(parked.get(i));
    }
  }

  /**
   * Drops everything addressed to the instance.
   *
   * @return the number of events dropped
   */
  int discard(final String instanceId) {
    int dropped = 0;
    final Deque<Event> mailbox = mailboxes.remove(instanceId);
    if (mailbox != null) {
      dropped += mailbox.size();
      ring.remove(instanceId);
    }
    final List<Event> parked = deferred.remove(instanceId);
    if (parked != null) {
      dropped += parked.size();
    }
    return dropped;
  }

  List<Event> deferredFor(final String instanceId) {
    final List<Event> parked = deferred.get(instanceId);
    return parked == null ? new ArrayList<Event>() : new ArrayList<>(parked);
  }

  int size() {
    int size = 0;
    for (Deque<Event> mailbox : mailboxes.values()) {
      size += mailbox.size();
    }
    return size;
  }

  int deferredSize() {
    int size = 0;
    for (List<Event> parked : deferred.values()) {
      size += parked.size();
    }
    return size;
  }

  boolean isEmpty() {
    return ring.isEmpty();
  }

  void clear() {
    mailboxes.clear();
    ring.clear();
    deferred.clear();
  }

  private Deque<Event> mailbox(final String instanceId) {
    Deque<Event> mailbox = mailboxes.get(instanceId);
    if (mailbox == null) {
      mailbox = new ArrayDeque<>();
      mailboxes.put(instanceId, mailbox);
      ring.addLast(instanceId);
    }
    return mailbox;
  }
}
