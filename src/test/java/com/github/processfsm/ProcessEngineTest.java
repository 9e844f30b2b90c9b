package com.github.processfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.processfsm.EngineConfiguration.EngineConfigurationBuilder;
import com.github.processfsm.EngineException.Code;
import com.github.processfsm.ProcessEngine.ProcessEngineBuilder;
import com.github.processfsm.ProcessFault.FaultKind;
import com.github.processfsm.RunReport.Outcome;

/**
 * Tests that run whole process terms through the engine.
 */
public class ProcessEngineTest {
  private static final Logger logger =
      LogManager.getLogger(ProcessEngineTest.class.getSimpleName());

  @Test
  public void testSendThenReceive() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    assertTrue(engine.alive());
    final Term program = withStdout(Terms.newNames(
        Terms.par(Terms.send(Terms.var("x"), Terms.string("hello")),
            Terms.receive(Terms.var("x"), Terms.formals(Pattern.var("msg")),
                Terms.send(Terms.var("out"), Terms.var("msg")))),
        "x"));
    final RunReport report = engine.run(program);

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertTrue(report.isSuccessful());
    assertEquals(Collections.singletonList("hello"), report.getOutput());
    assertEquals(Value.nil(), report.getRootResult());
    assertTrue(report.getFaults().isEmpty());
    assertEquals(1, report.getMatches().size());
    assertEquals(1L, report.getStatistics().getMatches());
    assertTrue(report.getStatistics().getPeakLive() > 1);
    assertTrue(report.getRootEnvironment().isBound("out"));
    assertTrue(report.getRootEnvironment().isBound("x"));
    assertTrue(engine.demolish());
    assertFalse(engine.alive());
  }

  @Test
  public void testRunsAreDeterministic() throws EngineException {
    final Term program = withStdout(Terms.par(
        Terms.send(Terms.name("a"), Terms.integer(1)),
        Terms.send(Terms.name("b"), Terms.integer(2)),
        Terms.send(Terms.name("a"), Terms.integer(3)),
        Terms.receive(Terms.name("a"), Terms.formals(Pattern.var("x")),
            Terms.send(Terms.var("out"), Terms.var("x"))),
        Terms.select(
            Terms.branch(Terms.name("a"), Terms.formals(Pattern.var("y")),
                Terms.send(Terms.var("out"), Terms.var("y"))),
            Terms.branch(Terms.name("b"), Terms.formals(Pattern.var("z")),
                Terms.send(Terms.var("out"), Terms.var("z"))))));

    final ProcessEngine first = ProcessEngineBuilder.newBuilder().build();
    final ProcessEngine second = ProcessEngineBuilder.newBuilder().build();
    final RunReport one = first.run(program);
    final RunReport two = second.run(program);
    assertEquals(one.getOutcome(), two.getOutcome());
    assertEquals(one.getOutput(), two.getOutput());
    assertEquals(one.getMatches().toString(), two.getMatches().toString());
    assertEquals(one.getStatistics().getSteps(), two.getStatistics().getSteps());
    assertEquals(one.getStatistics().getSpawned(), two.getStatistics().getSpawned());
    first.demolish();
    second.demolish();
  }

  @Test
  public void testInjectedMessagesAreConsumedInOrder() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport idle = engine.run(withStdout(Terms.receivePersistent(Terms.name("in"),
        Terms.formals(Pattern.var("n")), Terms.send(Terms.var("out"), Terms.var("n")))));
    assertEquals(Outcome.QUIESCENT, idle.getOutcome());
    assertEquals(1, idle.getListeners().size());

    for (long n = 1; n <= 3; n++) {
      engine.inject(ChannelName.of("in"), Collections.singletonList(Value.ofInt(n)));
    }
    final RunReport report = engine.run();
    assertEquals(Outcome.QUIESCENT, report.getOutcome());
    assertEquals(Arrays.asList("1", "2", "3"), report.getOutput());
    assertEquals(0, engine.channelSnapshot(ChannelName.of("in")).sendCount());
    engine.demolish();
  }

  @Test
  public void testContractServesRequestsAndKeepsListening() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final Term program = withStdout(Terms.par(
        Terms.contract(Terms.name("double"),
            Terms.formals(Pattern.var("n"), Pattern.var("ret")),
            Terms.send(Terms.var("ret"),
                Terms.binary(Operator.MULT, Terms.var("n"), Terms.integer(2)))),
        Terms.send(Terms.name("double"), Terms.integer(21), Terms.var("out"))));
    final RunReport report = engine.run(program);

    assertEquals(Outcome.QUIESCENT, report.getOutcome());
    assertTrue(report.isSuccessful());
    assertEquals(Collections.singletonList("42"), report.getOutput());
    assertEquals(1, report.getListeners().size());
    assertTrue(report.getBlocked().isEmpty());
    assertNull(report.getRootResult());

    final ChannelSnapshot snapshot = engine.channelSnapshot(ChannelName.of("double"));
    assertEquals(1, snapshot.receiveCount());
    assertEquals(0, snapshot.sendCount());
    engine.demolish();
  }

  @Test
  public void testEarlierSendIsConsumedFirst() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(Terms.par(
        Terms.send(Terms.name("c"), Terms.integer(1)),
        Terms.send(Terms.name("c"), Terms.integer(2)),
        Terms.receive(Terms.name("c"), Terms.formals(Pattern.var("x")),
            Terms.send(Terms.var("out"), Terms.var("x"))))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Collections.singletonList("1"), report.getOutput());
    final ChannelSnapshot snapshot = engine.channelSnapshot(ChannelName.of("c"));
    assertEquals(Collections.singletonList(Collections.singletonList(Value.ofInt(2))),
        snapshot.getPendingSends());
    engine.demolish();
  }

  @Test
  public void testContractSurvivesEveryCall() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(Terms.par(
        Terms.contract(Terms.name("greet"), Terms.formals(Pattern.var("who")),
            Terms.send(Terms.var("out"), Terms.var("who"))),
        Terms.send(Terms.name("greet"), Terms.string("ann")),
        Terms.send(Terms.name("greet"), Terms.string("bo")))));

    assertEquals(Outcome.QUIESCENT, report.getOutcome());
    assertEquals(2, report.getOutput().size());
    assertTrue(report.getOutput().contains("ann"));
    assertTrue(report.getOutput().contains("bo"));
    assertEquals(1, engine.channelSnapshot(ChannelName.of("greet")).receiveCount());
    engine.demolish();
  }

  @Test
  public void testReceiveWithoutSenderDeadlocks() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(Terms.newNames(Terms.par(Terms.nil(),
        Terms.receive(Terms.var("x"), Terms.formals(Pattern.var("y")), Terms.nil())), "x"));

    assertEquals(Outcome.DEADLOCKED, report.getOutcome());
    assertFalse(report.isSuccessful());
    final List<String> blocked = blockedIds(report);
    assertTrue(blocked.contains("0"));
    assertTrue(blocked.contains("0.0"));
    assertTrue(blocked.contains("0.0.1"));
    assertFalse(blocked.contains("0.0.0"));
    assertEquals(State.of(Phase.JOINING), engine.readState("0.0"));
    assertEquals(State.receiving(ReceiveMode.ONE_SHOT), engine.readState("0.0.1"));
    engine.demolish();
  }

  @Test
  public void testSelectConsumesExactlyOneMessage() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final Term program = withStdout(Terms.par(
        Terms.send(Terms.name("a"), Terms.integer(1)),
        Terms.send(Terms.name("b"), Terms.integer(2)),
        Terms.select(
            Terms.branch(Terms.name("a"), Terms.formals(Pattern.var("x")),
                Terms.send(Terms.var("out"), Terms.var("x"))),
            Terms.branch(Terms.name("b"), Terms.formals(Pattern.var("y")),
                Terms.send(Terms.var("out"), Terms.var("y"))))));
    final RunReport report = engine.run(program);

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(1, report.getOutput().size());
    final ChannelSnapshot a = engine.channelSnapshot(ChannelName.of("a"));
    final ChannelSnapshot b = engine.channelSnapshot(ChannelName.of("b"));
    assertEquals(1, a.sendCount() + b.sendCount());
    assertEquals(0, a.receiveCount());
    assertEquals(0, b.receiveCount());

    engine.inject(ChannelName.of("a"), Collections.singletonList(Value.ofInt(3)));
    engine.inject(ChannelName.of("b"), Collections.singletonList(Value.ofInt(4)));
    final RunReport again = engine.run();
    assertTrue(again.getOutput().isEmpty());
    assertEquals(0L, again.getStatistics().getMatches());
    assertEquals(3, engine.channelSnapshot(ChannelName.of("a")).sendCount()
        + engine.channelSnapshot(ChannelName.of("b")).sendCount());
    engine.demolish();
  }

  @Test
  public void testAndShortCircuits() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(Terms.and(Terms.bool(false),
        Terms.binary(Operator.DIV, Terms.integer(1), Terms.integer(0))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Value.ofBool(false), report.getRootResult());
    // the right operand never got an instance
    assertEquals(1L, report.getStatistics().getSpawned());
    engine.demolish();
  }

  @Test
  public void testWriteBundleForbidsReceiving() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(Terms.newNames(Terms.bundle(BundleMode.WRITE,
        Terms.receive(Terms.var("x"), Terms.formals(Pattern.var("y")), Terms.nil())), "x"));

    assertEquals(Outcome.FAILED, report.getOutcome());
    assertNull(report.getRootResult());
    assertEquals(FaultKind.CAPABILITY_VIOLATION, report.getFaults().get(0).getKind());
    final ProcessFault rootFault = report.getFaults().get(report.getFaults().size() - 1);
    assertEquals("0", rootFault.getInstanceId());
    assertEquals(FaultKind.CHILD_FAILED, rootFault.getKind());
    assertEquals(FaultKind.CAPABILITY_VIOLATION, rootFault.getRootCause().getKind());
    engine.demolish();
  }

  @Test
  public void testUnmatchedValueListsAttemptedPatterns() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(Terms.match(Terms.integer(5),
        Terms.matchCase(Pattern.literal(Value.ofInt(1)), Terms.nil()),
        Terms.matchCase(Pattern.literal(Value.ofInt(2)), Terms.nil())));

    assertEquals(Outcome.FAILED, report.getOutcome());
    assertEquals(1, report.getFaults().size());
    final ProcessFault fault = report.getFaults().get(0);
    assertEquals(FaultKind.UNMATCHED_VALUE, fault.getKind());
    assertEquals(Value.ofInt(5), fault.getValue());
    assertEquals(2, fault.getDetails().size());
    engine.demolish();
  }

  @Test
  public void testFailureLeavesSiblingsRunning() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(Terms.par(
        Terms.receive(Terms.name("never"), Terms.formals(Pattern.var("y")), Terms.nil()),
        Terms.binary(Operator.DIV, Terms.integer(1), Terms.integer(0))));

    assertEquals(Outcome.FAILED, report.getOutcome());
    assertEquals(FaultKind.ARITHMETIC, report.getFaults().get(0).getKind());
    assertEquals(State.terminated(), engine.readState("0"));
    assertEquals(State.receiving(ReceiveMode.ONE_SHOT), engine.readState("0.0"));
    assertEquals(1, engine.channelSnapshot(ChannelName.of("never")).receiveCount());
    engine.demolish();
  }

  @Test
  public void testCancelUnblocksTheParent() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport blocked = engine.run(Terms.newNames(
        Terms.receive(Terms.var("x"), Terms.formals(Pattern.var("y")), Terms.nil()), "x"));
    assertEquals(Outcome.DEADLOCKED, blocked.getOutcome());
    assertEquals(1, engine.channelSnapshot(ChannelName.unforgeable("0#0")).receiveCount());

    assertTrue(engine.cancel("0.0"));
    assertEquals(State.terminated(), engine.readState("0.0"));
    assertFalse(engine.cancel("0.0"));
    assertEquals(0, engine.channelSnapshot(ChannelName.unforgeable("0#0")).receiveCount());

    final RunReport report = engine.run();
    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Value.nil(), report.getRootResult());
    assertEquals(1L, engine.getStatistics().getCancelled());
    try {
      engine.readState("0.0");
      fail("Expected the cancelled instance to be gone");
    } catch (EngineException expected) {
      assertEquals(Code.ILLEGAL_INSTANCE_ID, expected.getCode());
    }
    engine.demolish();
  }

  @Test
  public void testCancelTearsDownNestedContractAndItsInvocations() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport blocked = engine.run(Terms.par(
        Terms.par(
            Terms.contract(Terms.name("k"), Terms.formals(Pattern.var("x")),
                Terms.receive(Terms.name("never"), Terms.formals(Pattern.var("y")), Terms.nil())),
            Terms.receive(Terms.name("r"), Terms.formals(Pattern.var("z")), Terms.nil())),
        Terms.send(Terms.name("k"), Terms.integer(1))));
    assertEquals(Outcome.DEADLOCKED, blocked.getOutcome());
    assertEquals(State.receiving(ReceiveMode.PERSISTENT), engine.readState("0.0.0"));
    assertEquals(1, engine.channelSnapshot(ChannelName.of("k")).receiveCount());
    assertEquals(1, engine.channelSnapshot(ChannelName.of("never")).receiveCount());
    assertEquals(1, engine.channelSnapshot(ChannelName.of("r")).receiveCount());

    assertTrue(engine.cancel("0.0"));
    assertEquals(State.terminated(), engine.readState("0.0"));
    assertEquals(0, engine.channelSnapshot(ChannelName.of("k")).receiveCount());
    assertEquals(0, engine.channelSnapshot(ChannelName.of("never")).receiveCount());
    assertEquals(0, engine.channelSnapshot(ChannelName.of("r")).receiveCount());
    // the contract, its invocation and the receive on r go with the parallel
    assertEquals(4L, engine.getStatistics().getCancelled());
    try {
      engine.readState("0.0.0");
      fail("Expected the cancelled contract to be gone");
    } catch (EngineException expected) {
      assertEquals(Code.ILLEGAL_INSTANCE_ID, expected.getCode());
    }

    final RunReport report = engine.run();
    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertTrue(report.getListeners().isEmpty());
    engine.demolish();
  }

  @Test
  public void testCancelWithdrawsWaitingSynchronousSend() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport waiting = engine.run(Terms.par(
        Terms.sendSync(Terms.name("c"), Terms.nil(), Terms.integer(7)),
        Terms.contract(Terms.name("other"), Terms.formals(Pattern.var("y")), Terms.nil())));
    assertEquals(Outcome.DEADLOCKED, waiting.getOutcome());
    assertEquals(1, engine.channelSnapshot(ChannelName.of("c")).sendCount());

    assertTrue(engine.cancel("0"));
    assertEquals(0, engine.channelSnapshot(ChannelName.of("c")).sendCount());
    assertEquals(0, engine.channelSnapshot(ChannelName.of("other")).receiveCount());

    // nothing from the cancelled sender is left to consume
    final RunReport report = engine.run();
    assertEquals(Outcome.COMPLETED, report.getOutcome());
    engine.inject(ChannelName.of("c"), Collections.singletonList(Value.ofInt(8)));
    assertEquals(Collections.singletonList(Collections.singletonList(Value.ofInt(8))),
        engine.channelSnapshot(ChannelName.of("c")).getPendingSends());
    engine.demolish();
  }

  @Test
  public void testContractKeepsListeningAfterFailedInvocation() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport listening = engine.run(Terms.contract(Terms.name("svc"),
        Terms.formals(Pattern.var("x")), Terms.match(Terms.var("x"),
            Terms.matchCase(Pattern.literal(Value.ofInt(1)), Terms.nil()))));
    assertEquals(Outcome.QUIESCENT, listening.getOutcome());

    engine.inject(ChannelName.of("svc"), Collections.singletonList(Value.ofInt(2)));
    final RunReport failed = engine.run();
    assertEquals(Outcome.QUIESCENT, failed.getOutcome());
    assertEquals(1, failed.getListeners().size());
    assertEquals(FaultKind.UNMATCHED_VALUE, failed.getFaults().get(0).getKind());
    assertEquals(State.receiving(ReceiveMode.PERSISTENT), engine.readState("0"));
    assertEquals(1, engine.channelSnapshot(ChannelName.of("svc")).receiveCount());

    engine.inject(ChannelName.of("svc"), Collections.singletonList(Value.ofInt(1)));
    final RunReport served = engine.run();
    assertEquals(Outcome.QUIESCENT, served.getOutcome());
    assertEquals(2L, engine.getStatistics().getMatches());
    assertEquals(0, engine.channelSnapshot(ChannelName.of("svc")).sendCount());
    assertEquals(1, engine.channelSnapshot(ChannelName.of("svc")).receiveCount());
    engine.demolish();
  }

  @Test
  public void testPeekAcknowledgesSynchronousSend() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(Terms.par(
        Terms.sendSync(Terms.name("c"), Terms.send(Terms.var("out"), Terms.string("acked")),
            Terms.integer(7)),
        Terms.peek(Terms.name("c"), Terms.formals(Pattern.var("x")),
            Terms.send(Terms.var("out"), Terms.var("x"))))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    final List<String> output = new ArrayList<>(report.getOutput());
    Collections.sort(output);
    assertEquals(Arrays.asList("7", "acked"), output);
    // the peeked message stays for a consuming receive
    assertEquals(1, engine.channelSnapshot(ChannelName.of("c")).sendCount());
    engine.demolish();
  }

  @Test
  public void testInjectWakesUpReceiver() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport waiting = engine.run(withStdout(Terms.receive(Terms.name("in"),
        Terms.formals(Pattern.var("n")),
        Terms.send(Terms.var("out"), Terms.add(Terms.var("n"), Terms.integer(1))))));
    assertEquals(Outcome.DEADLOCKED, waiting.getOutcome());

    engine.inject(ChannelName.of("in"), Collections.singletonList(Value.ofInt(6)));
    final RunReport report = engine.run();
    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Collections.singletonList("7"), report.getOutput());
    engine.demolish();
  }

  @Test
  public void testMalformedInjectionsAreRejected() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    engine.run(Terms.newNames(Terms.nil(), "x"));

    assertMalformed(engine, ChannelName.unforgeable("9.9#0"),
        Collections.singletonList(Value.nil()));
    assertMalformed(engine, ChannelName.of("in"),
        Collections.singletonList(Value.ofProcess(Terms.nil(), Environment.empty())));
    assertMalformed(engine, ChannelName.of("in"),
        Collections.singletonList(Value.list(Value.ofName(ChannelName.unforgeable("7#0")))));
    assertMalformed(engine, null, Collections.<Value>emptyList());
    assertMalformed(engine, ChannelName.of("in"), null);

    // names minted by the engine may be handed back to it
    engine.inject(ChannelName.unforgeable("0#0"), Collections.singletonList(Value.nil()));
    assertEquals(1, engine.channelSnapshot(ChannelName.unforgeable("0#0")).sendCount());
    engine.demolish();
  }

  @Test
  public void testStepLimitTimesOutLiveInstances() throws EngineException {
    final EngineConfiguration config =
        EngineConfigurationBuilder.newBuilder().maxSteps(500L).build();
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().config(config).build();
    final RunReport report = engine.run(Terms.par(
        Terms.contract(Terms.name("loop"), Terms.formals(Pattern.var("n")),
            Terms.send(Terms.name("loop"), Terms.add(Terms.var("n"), Terms.integer(1)))),
        Terms.send(Terms.name("loop"), Terms.integer(0))));

    assertEquals(Outcome.STEP_LIMIT_EXCEEDED, report.getOutcome());
    assertEquals(500L, report.getStatistics().getSteps());
    assertFalse(report.getFaults().isEmpty());
    for (ProcessFault fault : report.getFaults()) {
      assertEquals(FaultKind.TIMEOUT, fault.getKind());
    }
    assertNull(report.getRootResult());
    assertTrue(engine.readState("0").isTerminated());
    engine.demolish();
  }

  @Test
  public void testSynchronousSendRunsContinuationAfterDelivery() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(Terms.sendSync(Terms.var("out"),
        Terms.send(Terms.var("out"), Terms.string("bye")), Terms.string("hi"))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Arrays.asList("hi", "bye"), report.getOutput());
    engine.demolish();
  }

  @Test
  public void testSynchronousSendWaitsForItsReceiver() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport waiting = engine.run(withStdout(Terms.sendSync(Terms.name("box"),
        Terms.send(Terms.var("out"), Terms.string("delivered")), Terms.integer(1))));
    assertEquals(Outcome.DEADLOCKED, waiting.getOutcome());
    assertEquals(State.of(Phase.WAITING), engine.readState("0.0"));
    assertEquals(1, engine.channelSnapshot(ChannelName.of("box")).sendCount());
    engine.demolish();
  }

  @Test
  public void testSendReceiveGetsTheReply() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final Term program = withStdout(Terms.par(
        Terms.contract(Terms.name("double"),
            Terms.formals(Pattern.var("ret"), Pattern.var("n")),
            Terms.send(Terms.var("ret"),
                Terms.binary(Operator.MULT, Terms.var("n"), Terms.integer(2)))),
        Terms.receive(
            Terms.bindSendReceive(Terms.name("double"), Terms.formals(Pattern.var("r")),
                Terms.integer(21)),
            ReceiveMode.ONE_SHOT, Terms.send(Terms.var("out"), Terms.var("r")))));
    final RunReport report = engine.run(program);

    assertEquals(Outcome.QUIESCENT, report.getOutcome());
    assertEquals(Collections.singletonList("42"), report.getOutput());
    engine.demolish();
  }

  @Test
  public void testReceiveSendAcknowledgesTheSender() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final Term program = withStdout(Terms.par(
        Terms.receive(Terms.bindReceiveSend(Terms.name("svc"), Terms.formals(Pattern.var("x"))),
            ReceiveMode.ONE_SHOT, Terms.send(Terms.var("out"), Terms.var("x"))),
        Terms.receive(
            Terms.bindSendReceive(Terms.name("svc"), Terms.formals(Pattern.wildcard()),
                Terms.integer(5)),
            ReceiveMode.ONE_SHOT, Terms.send(Terms.var("out"), Terms.string("acked")))));
    final RunReport report = engine.run(program);

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(2, report.getOutput().size());
    assertTrue(report.getOutput().contains("5"));
    assertTrue(report.getOutput().contains("acked"));
    engine.demolish();
  }

  @Test
  public void testSequentialLetSeesEarlierBindings() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(Terms.let(
        Arrays.asList(Terms.letBinding(Pattern.var("x"), Terms.integer(1)),
            Terms.letBinding(Pattern.var("y"), Terms.add(Terms.var("x"), Terms.integer(1)))),
        Terms.send(Terms.var("out"), Terms.var("y")))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Collections.singletonList("2"), report.getOutput());
    engine.demolish();
  }

  @Test
  public void testConcurrentLetBindsEveryValue() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(Terms.letConcurrent(
        Arrays.asList(Terms.letBinding(Pattern.var("x"), Terms.integer(1)),
            Terms.letBinding(Pattern.list(Pattern.var("y"), Pattern.wildcard()),
                Terms.list(Terms.integer(2), Terms.integer(9)))),
        Terms.send(Terms.var("out"), Terms.add(Terms.var("x"), Terms.var("y"))))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Collections.singletonList("3"), report.getOutput());
    engine.demolish();
  }

  @Test
  public void testEvalRunsAQuotedProcess() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    final RunReport report = engine.run(withStdout(
        Terms.eval(Terms.quote(Terms.send(Terms.var("out"), Terms.string("quoted"))))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Collections.singletonList("quoted"), report.getOutput());
    engine.demolish();
  }

  @Test
  public void testCustomSinkReceivesWrites() throws EngineException {
    final StringBuilder written = new StringBuilder();
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder()
        .sink("rho:test:capture", new ChannelSink() {
          @Override
          public void write(final ChannelName channel, final List<Value> payload) {
            written.append(channel.getId()).append('=').append(payload);
          }
        }).build();
    final RunReport report = engine.run(Terms.newScope(
        Collections.singletonList(Terms.decl("capture", "rho:test:capture")),
        Terms.send(Terms.var("capture"), Terms.integer(3))));

    assertEquals(Outcome.COMPLETED, report.getOutcome());
    assertEquals(Collections.singletonList("3"), report.getOutput());
    assertTrue(written.toString().startsWith("rho:test:capture="));
    engine.demolish();
  }

  @Test
  public void testStateRouteIsRecorded() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    engine.run(Terms.integer(1));
    assertEquals(Arrays.asList(State.initial(), State.terminated()),
        engine.readStateRoute("0"));
    engine.demolish();
  }

  @Test
  public void testApiMisuse() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    assertNotNull(engine.getId());
    assertNotNull(engine.getConfiguration());
    try {
      engine.run();
      fail("Expected run without a process to fail");
    } catch (EngineException expected) {
      assertEquals(Code.NOTHING_LOADED, expected.getCode());
    }
    try {
      engine.load(null);
      fail("Expected a null process to be rejected");
    } catch (EngineException expected) {
      assertEquals(Code.INVALID_TERM, expected.getCode());
    }
    try {
      engine.load(Terms.select());
      fail("Expected an empty select to be rejected");
    } catch (EngineException expected) {
      assertEquals(Code.INVALID_TERM, expected.getCode());
    }
    assertEquals("0", engine.load(Terms.nil()));
    try {
      engine.load(Terms.nil());
      fail("Expected a second load to fail");
    } catch (EngineException expected) {
      assertEquals(Code.ALREADY_LOADED, expected.getCode());
    }
    try {
      engine.readState("42");
      fail("Expected an unknown instance to be rejected");
    } catch (EngineException expected) {
      assertEquals(Code.ILLEGAL_INSTANCE_ID, expected.getCode());
    }
    try {
      engine.channelSnapshot(null);
      fail("Expected a null channel to be rejected");
    } catch (EngineException expected) {
      assertEquals(Code.MALFORMED_EVENT, expected.getCode());
    }
    assertTrue(engine.demolish());
    try {
      engine.run();
      fail("Expected a demolished engine to refuse work");
    } catch (EngineException expected) {
      assertEquals(Code.ENGINE_NOT_ALIVE, expected.getCode());
    }
  }

  @Test
  public void testEngineThreadSafety() throws Exception {
    final EngineConfiguration config =
        EngineConfigurationBuilder.newBuilder().lockAcquisitionMillis(5_000L).build();
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().config(config).build();
    engine.run(withStdout(Terms.contract(Terms.name("in"), Terms.formals(Pattern.var("n")),
        Terms.send(Terms.var("out"), Terms.var("n")))));

    final AtomicInteger injected = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();
    final int perWorker = 20;
    final Runnable injectWorker = new Runnable() {
      @Override
      public void run() {
        try {
          for (int iter = 0; iter < perWorker; iter++) {
            engine.inject(ChannelName.of("in"),
                Collections.singletonList(Value.ofString(Thread.currentThread().getName())));
            injected.incrementAndGet();
          }
        } catch (EngineException problem) {
          failed.incrementAndGet();
          logger.error("engine:" + engine.getId() + " encountered an issue", problem);
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      workers.add(new Thread(injectWorker, "test-inject-worker-" + iter));
    }
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    assertEquals(0, failed.get());
    assertEquals(workerCount * perWorker, injected.get());
    final RunReport report = engine.run();
    assertEquals(Outcome.QUIESCENT, report.getOutcome());
    assertEquals(workerCount * perWorker, report.getOutput().size());
    logger.info(engine.getStatistics().toString());
    assertTrue(engine.demolish());
  }

  @Test
  public void testMultipleEngines() throws Exception {
    final Term program = withStdout(Terms.par(
        Terms.send(Terms.name("a"), Terms.integer(1)),
        Terms.send(Terms.name("a"), Terms.integer(2)),
        Terms.receivePersistent(Terms.name("a"), Terms.formals(Pattern.var("x")),
            Terms.send(Terms.var("out"), Terms.var("x")))));
    final List<List<String>> outputs = new CopyOnWriteArrayList<>();
    final Runnable engineWorker = new Runnable() {
      @Override
      public void run() {
        ProcessEngine engine = null;
        try {
          engine = ProcessEngineBuilder.newBuilder().build();
          outputs.add(engine.run(program).getOutput());
          assertTrue(engine.demolish());
        } catch (EngineException problem) {
          logger.error("engine encountered an issue", problem);
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      workers.add(new Thread(engineWorker, "test-engine-worker-" + iter));
    }
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    assertEquals(workerCount, outputs.size());
    for (List<String> output : outputs) {
      assertEquals(outputs.get(0), output);
      assertEquals(2, output.size());
    }
  }

  private static Term withStdout(final Term body) {
    return Terms.newScope(Collections.singletonList(Terms.decl("out", ChannelSink.STDOUT)), body);
  }

  private static List<String> blockedIds(final RunReport report) {
    final List<String> ids = new ArrayList<>();
    for (RunReport.BlockedInstance blocked : report.getBlocked()) {
      ids.add(blocked.getInstanceId());
    }
    return ids;
  }

  private static void assertMalformed(final ProcessEngine engine, final ChannelName channel,
      final List<Value> payload) {
    try {
      engine.inject(channel, payload);
      fail("Expected " + payload + " on " + channel + " to be rejected");
    } catch (EngineException expected) {
      assertEquals(Code.MALFORMED_EVENT, expected.getCode());
    }
  }
}
