package com.github.processfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the channel store's matching and persistence
 * policy.
 */
public class ChannelStoreTest {
  private static final ChannelName CHANNEL = ChannelName.of("c");
  private static final Pattern ONE_VAR = Terms.formals(Pattern.var("x"));

  @Test
  public void testSendsAreMatchedInArrivalOrder() {
    final ChannelStore store = new ChannelStore();
    assertFalse(store.publish(CHANNEL, payload(1), Persistence.ONCE, null).isPresent());
    assertFalse(store.publish(CHANNEL, payload(2), Persistence.ONCE, null).isPresent());

    final Optional<ChannelMatch> first = store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r1");
    assertTrue(first.isPresent());
    assertEquals(Value.ofInt(1), first.get().getBindings().get("x"));
    assertTrue(first.get().isSendRemoved());
    assertTrue(first.get().isReceiveRemoved());

    final Optional<ChannelMatch> second =
        store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r2");
    assertEquals(Value.ofInt(2), second.get().getBindings().get("x"));
    assertEquals(0, store.snapshot(CHANNEL).sendCount());
    assertEquals(0, store.snapshot(CHANNEL).receiveCount());
  }

  @Test
  public void testReceivesAreServedInRegistrationOrder() {
    final ChannelStore store = new ChannelStore();
    store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r1");
    store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r2");
    final ChannelMatch match = store.publish(CHANNEL, payload(7), Persistence.ONCE, null).get();
    assertEquals("r1", match.getReceive().getContinuationId());
    assertEquals(Arrays.asList("r2"), store.snapshot(CHANNEL).getPendingReceivers());
  }

  @Test
  public void testPatternFiltersMessages() {
    final ChannelStore store = new ChannelStore();
    store.request(CHANNEL, Terms.formals(Pattern.literal(Value.ofInt(2))), ReceiveMode.ONE_SHOT,
        "r1");
    assertFalse(store.publish(CHANNEL, payload(1), Persistence.ONCE, null).isPresent());
    final Optional<ChannelMatch> match = store.publish(CHANNEL, payload(2), Persistence.ONCE, null);
    assertTrue(match.isPresent());
    assertTrue(match.get().getBindings().isEmpty());
    // the non-matching send is still pending
    assertEquals(Arrays.asList(payload(1)), store.snapshot(CHANNEL).getPendingSends());
  }

  @Test
  public void testPersistentSendSurvivesMatches() {
    final ChannelStore store = new ChannelStore();
    store.publish(CHANNEL, payload(5), Persistence.PERSISTENT, null);
    for (String receiver : Arrays.asList("r1", "r2", "r3")) {
      final ChannelMatch match =
          store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, receiver).get();
      assertFalse(match.isSendRemoved());
      assertTrue(match.involvesPersistent());
    }
    assertEquals(1, store.snapshot(CHANNEL).sendCount());
  }

  @Test
  public void testPersistentReceiveSurvivesMatches() {
    final ChannelStore store = new ChannelStore();
    assertFalse(store.request(CHANNEL, ONE_VAR, ReceiveMode.PERSISTENT, "contract").isPresent());
    for (int i = 0; i < 3; i++) {
      final ChannelMatch match = store.publish(CHANNEL, payload(i), Persistence.ONCE, null).get();
      assertTrue(match.isSendRemoved());
      assertFalse(match.isReceiveRemoved());
    }
    final ChannelSnapshot snapshot = store.snapshot(CHANNEL);
    assertEquals(0, snapshot.sendCount());
    assertEquals(Arrays.asList("contract"), snapshot.getPendingReceivers());
  }

  @Test
  public void testPeekLeavesTheSendInPlace() {
    final ChannelStore store = new ChannelStore();
    store.publish(CHANNEL, payload(3), Persistence.ONCE, null);
    final ChannelMatch peeked = store.request(CHANNEL, ONE_VAR, ReceiveMode.PEEK, "p1").get();
    assertFalse(peeked.isSendRemoved());
    assertTrue(peeked.isReceiveRemoved());
    assertEquals(1, store.snapshot(CHANNEL).sendCount());
    assertEquals(0, store.snapshot(CHANNEL).receiveCount());

    final ChannelMatch taken = store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r1").get();
    assertTrue(taken.isSendRemoved());
    assertEquals(0, store.snapshot(CHANNEL).sendCount());
  }

  @Test
  public void testPersistentPairMatchesOnce() {
    final ChannelStore store = new ChannelStore();
    store.request(CHANNEL, ONE_VAR, ReceiveMode.PERSISTENT, "contract");
    assertTrue(store.publish(CHANNEL, payload(1), Persistence.PERSISTENT, null).isPresent());
    assertFalse(store.rescan(CHANNEL).isPresent());
    assertEquals(1, store.snapshot(CHANNEL).sendCount());
    assertEquals(1, store.snapshot(CHANNEL).receiveCount());
  }

  @Test
  public void testRetractForgetsDeliveredPersistentPairs() {
    final ChannelStore store = new ChannelStore();
    store.request(CHANNEL, ONE_VAR, ReceiveMode.PERSISTENT, "contract");
    store.publish(CHANNEL, payload(1), Persistence.PERSISTENT, null);
    store.publish(CHANNEL, payload(2), Persistence.PERSISTENT, null);
    assertEquals(2, store.deliveredPairCount());
    assertFalse(store.rescan(CHANNEL).isPresent());

    assertEquals(1, store.retract("contract"));
    assertEquals(0, store.deliveredPairCount());
    assertEquals(2, store.snapshot(CHANNEL).sendCount());
  }

  @Test
  public void testRetractWithdrawsUnacknowledgedSynchronousSend() {
    final ChannelStore store = new ChannelStore();
    store.publish(CHANNEL, payload(1), Persistence.ONCE, "sender");
    store.publish(CHANNEL, payload(2), Persistence.ONCE, null);
    assertEquals(1, store.retract("sender"));
    assertEquals(Arrays.asList(payload(2)), store.snapshot(CHANNEL).getPendingSends());
  }

  @Test
  public void testPeekedSynchronousSendIsAcknowledgedOnce() {
    final ChannelStore store = new ChannelStore();
    store.publish(CHANNEL, payload(3), Persistence.ONCE, "sender");
    final ChannelMatch peeked = store.request(CHANNEL, ONE_VAR, ReceiveMode.PEEK, "p1").get();
    assertTrue(peeked.getSend().acknowledge());
    assertFalse(peeked.getSend().acknowledge());

    // an acknowledged send belongs to the channel, not to its sender
    assertEquals(0, store.retract("sender"));
    final ChannelMatch taken = store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r1").get();
    assertTrue(taken.isSendRemoved());
    assertFalse(taken.getSend().acknowledge());
  }

  @Test
  public void testRescanPairsEntriesLeftBehind() {
    final ChannelStore store = new ChannelStore();
    store.request(CHANNEL, ONE_VAR, ReceiveMode.PEEK, "p1");
    store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "r1");
    // the peek is served first and leaves the send for the one-shot receive
    final ChannelMatch peeked = store.publish(CHANNEL, payload(9), Persistence.ONCE, null).get();
    assertEquals("p1", peeked.getReceive().getContinuationId());
    final ChannelMatch taken = store.rescan(CHANNEL).get();
    assertEquals("r1", taken.getReceive().getContinuationId());
    assertFalse(store.rescan(CHANNEL).isPresent());
  }

  @Test
  public void testSelectRetractsLosingArms() {
    final ChannelStore store = new ChannelStore();
    final ChannelName left = ChannelName.of("left");
    final ChannelName right = ChannelName.of("right");
    assertFalse(store.select(Arrays.asList(new ChannelStore.Arm(left, ONE_VAR, 0),
        new ChannelStore.Arm(right, ONE_VAR, 1)), "sel").isPresent());
    assertEquals(1, store.snapshot(left).receiveCount());
    assertEquals(1, store.snapshot(right).receiveCount());

    final ChannelMatch match = store.publish(right, payload(4), Persistence.ONCE, null).get();
    assertEquals(1, match.getReceive().getArmIndex());
    assertEquals(0, store.snapshot(left).receiveCount());
    assertEquals(0, store.snapshot(right).receiveCount());

    // nobody is left to take this one
    assertFalse(store.publish(left, payload(5), Persistence.ONCE, null).isPresent());
    assertEquals(1, store.snapshot(left).sendCount());
  }

  @Test
  public void testSelectPrefersEarlierArms() {
    final ChannelStore store = new ChannelStore();
    final ChannelName left = ChannelName.of("left");
    final ChannelName right = ChannelName.of("right");
    store.publish(right, payload(1), Persistence.ONCE, null);
    store.publish(left, payload(2), Persistence.ONCE, null);
    final ChannelMatch match = store.select(Arrays.asList(new ChannelStore.Arm(left, ONE_VAR, 0),
        new ChannelStore.Arm(right, ONE_VAR, 1)), "sel").get();
    assertEquals(0, match.getReceive().getArmIndex());
    assertEquals(1, store.snapshot(right).sendCount());
    assertEquals(0, store.snapshot(left).receiveCount());
    assertEquals(0, store.snapshot(right).receiveCount());
  }

  @Test
  public void testRetract() {
    final ChannelStore store = new ChannelStore();
    store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "0.1");
    store.request(ChannelName.of("other"), ONE_VAR, ReceiveMode.PERSISTENT, "0.1");
    store.request(CHANNEL, ONE_VAR, ReceiveMode.ONE_SHOT, "0.2");
    assertEquals(2, store.retract("0.1"));
    assertEquals(Arrays.asList("0.2"), store.snapshot(CHANNEL).getPendingReceivers());
    assertEquals(1, store.pendingReceives());
    assertEquals(0, store.retract("0.1"));
  }

  private static List<Value> payload(final long value) {
    return Collections.singletonList(Value.ofInt(value));
  }
}
