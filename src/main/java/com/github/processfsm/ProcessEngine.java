package com.github.processfsm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a process term as a tree of finite state machines that communicate over channels.
 *
 * Notes for users:<br>
 * 1. an engine runs one top-level process; {@link #load(Term)} it once, then {@link #run()} it as
 * often as needed. A run ends when no instance can progress; {@link #inject(ChannelName, List)}
 * and {@link #cancel(String)} between runs are how callers talk to a long-lived process tree.<br>
 *
 * 2. runs are deterministic: the same term and the same sequence of injections yield the same
 * report, the same instance ids and the same channel-match order.<br>
 *
 * 3. this engine is thread-safe; every call takes the engine lock and gives up with
 * OPERATION_LOCK_ACQUISITION_FAILURE after the configured wait.<br>
 *
 * 4. failures of the process itself are never thrown, they are reported in the
 * {@link RunReport}. {@link EngineException} is reserved for misuse of this API.<br>
 */
public interface ProcessEngine {

  ///// Process API /////
  /**
   * Install the top-level process. Returns the id of its root instance.
   */
  String load(final Term root) throws EngineException;

  /**
   * Drive every instance until none can progress any more.
   */
  RunReport run() throws EngineException;

  /**
   * Shorthand for {@link #load(Term)} followed by {@link #run()}.
   */
  RunReport run(final Term root) throws EngineException;

  /**
   * Send a payload on a channel from outside the process. The send is matched right away; the
   * receivers it wakes up progress during the next {@link #run()}.
   */
  void inject(final ChannelName channel, final List<Value> payload) throws EngineException;

  /**
   * Cancel an instance together with all its live descendants. Returns false if the instance had
   * already terminated.
   */
  boolean cancel(final String instanceId) throws EngineException;

  /**
   * Read the current state of an instance.
   */
  State readState(final String instanceId) throws EngineException;

  /**
   * Pull the last states an instance went through, oldest first. The route is bounded by
   * {@link EngineConfiguration#getMaxRouteLength()}, so earlier states may have been pruned.
   */
  List<State> readStateRoute(final String instanceId) throws EngineException;

  /**
   * Pending sends and receives of a channel.
   */
  ChannelSnapshot channelSnapshot(final ChannelName channel) throws EngineException;


  ///// Engine functions /////
  /**
   * Reports the id of this engine. You can have as many engines as you like.
   */
  String getId();

  /**
   * Returns the config that this engine is wired with.
   */
  EngineConfiguration getConfiguration();

  /**
   * Report statistics for this engine, cumulative over its runs.
   */
  RunStatistics getStatistics();

  /**
   * Check if the engine is alive.
   */
  boolean alive();

  /**
   * Shutdown the engine and clear all instances and intermediate data structures.
   */
  boolean demolish() throws EngineException;

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class ProcessEngineBuilder {
    private EngineConfiguration config;
    private final Map<String, ChannelSink> sinks = new LinkedHashMap<>();

    public static ProcessEngineBuilder newBuilder() {
      return new ProcessEngineBuilder();
    }

    public ProcessEngineBuilder config(final EngineConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Route sends on the system channel with the given uri to the sink. Replaces the built-in
     * sinks of {@link ChannelSink#STDOUT} and {@link ChannelSink#STDERR} when given their uris.
     */
    public ProcessEngineBuilder sink(final String uri, final ChannelSink sink) {
      this.sinks.put(uri, sink);
      return this;
    }

    public ProcessEngine build() throws EngineException {
      return new ProcessEngineImpl(config, sinks);
    }

    private ProcessEngineBuilder() {}
  }

}
