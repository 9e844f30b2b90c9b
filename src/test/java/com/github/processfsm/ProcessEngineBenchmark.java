package com.github.processfsm;

import java.util.Collections;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.processfsm.EngineConfiguration.EngineConfigurationBuilder;
import com.github.processfsm.ProcessEngine.ProcessEngineBuilder;

public class ProcessEngineBenchmark {

  @Benchmark
  public RunReport benchmarkRequestReply() throws EngineException {
    // 1. a service that doubles its input and a client that asks it once
    final Term program = Terms.newScope(
        Collections.singletonList(Terms.decl("out", ChannelSink.STDOUT)),
        Terms.par(
            Terms.contract(Terms.name("double"),
                Terms.formals(Pattern.var("ret"), Pattern.var("n")),
                Terms.send(Terms.var("ret"),
                    Terms.binary(Operator.MULT, Terms.var("n"), Terms.integer(2)))),
            Terms.receive(
                Terms.bindSendReceive(Terms.name("double"), Terms.formals(Pattern.var("r")),
                    Terms.integer(21)),
                ReceiveMode.ONE_SHOT, Terms.send(Terms.var("out"), Terms.var("r")))));

    // 2. run it on a fresh engine
    final EngineConfiguration config =
        EngineConfigurationBuilder.newBuilder().recordMatches(false).build();
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().config(config).build();
    final RunReport report = engine.run(program);

    // 3. tear down
    engine.demolish();
    return report;
  }

  @Benchmark
  public RunReport benchmarkInjectedStream() throws EngineException {
    final ProcessEngine engine = ProcessEngineBuilder.newBuilder().build();
    engine.run(Terms.receivePersistent(Terms.name("in"), Terms.formals(Pattern.var("n")),
        Terms.add(Terms.var("n"), Terms.integer(1))));
    for (long n = 0; n < 100; n++) {
      engine.inject(ChannelName.of("in"), Collections.singletonList(Value.ofInt(n)));
    }
    final RunReport report = engine.run();
    engine.demolish();
    return report;
  }

  public static void main(String args[]) throws EngineException {
    final ProcessEngineBenchmark benchmark = new ProcessEngineBenchmark();
    System.out.println(benchmark.benchmarkRequestReply());
    System.out.println(benchmark.benchmarkInjectedStream());
  }

}
