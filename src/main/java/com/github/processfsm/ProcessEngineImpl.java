package com.github.processfsm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.processfsm.EngineException.Code;

/**
 * Default {@link ProcessEngine}. All mutable engine state lives in one {@link Scheduler}; this
 * class guards it with a fair read/write lock, validates what callers hand in and logs the engine
 * lifecycle.
 */
public final class ProcessEngineImpl implements ProcessEngine {
  private static final Logger logger =
      LogManager.getLogger(ProcessEngineImpl.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();
  private final AtomicBoolean engineAlive = new AtomicBoolean();
  private final EngineConfiguration config;
  private final Scheduler scheduler;

  // global engine level locks
  private final ReentrantReadWriteLock engineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock engineWriteLock = engineSuperLock.writeLock();
  private final ReadLock engineReadLock = engineSuperLock.readLock();

  ProcessEngineImpl(final EngineConfiguration config, final Map<String, ChannelSink> sinks)
      throws EngineException {
    logInfo(engineId, null, "Firing up process engine");
    this.config = config != null ? config
        : EngineConfiguration.EngineConfigurationBuilder.newBuilder().build();
    final Map<ChannelName, ChannelSink> channelSinks = new LinkedHashMap<>();
    channelSinks.put(ChannelName.uri(ChannelSink.STDOUT), new LoggingSink(Level.INFO));
    channelSinks.put(ChannelName.uri(ChannelSink.STDERR), new LoggingSink(Level.WARN));
    for (Map.Entry<String, ChannelSink> sink : sinks.entrySet()) {
      if (sink.getKey() == null || sink.getValue() == null) {
        throw new EngineException(Code.INVALID_ENGINE_CONFIG,
            "Sink uri and sink cannot be null");
      }
      channelSinks.put(ChannelName.uri(sink.getKey()), sink.getValue());
    }
    this.scheduler = new Scheduler(engineId, this.config, channelSinks);
    engineAlive.set(true);
    logInfo(engineId, null, "Successfully fired up process engine with " + this.config);
  }

  @Override
  public String load(final Term root) throws EngineException {
    engineAlive();
    if (root == null) {
      throw new EngineException(Code.INVALID_TERM, "Top-level process cannot be null");
    }
    validate(root);
    String rootId = null;
    try {
      if (engineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          if (scheduler.isLoaded()) {
            throw new EngineException(Code.ALREADY_LOADED);
          }
          rootId = scheduler.load(root);
          logInfo(engineId, rootId, "Loaded top-level process " + root);
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to load process");
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return rootId;
  }

  @Override
  public RunReport run() throws EngineException {
    engineAlive();
    RunReport report = null;
    try {
      if (engineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          if (!scheduler.isLoaded()) {
            throw new EngineException(Code.NOTHING_LOADED);
          }
          report = scheduler.run();
        } catch (RuntimeException problem) {
          logError(engineId, null, "Run failed unexpectedly", problem);
          throw new EngineException(Code.UNKNOWN_FAILURE, problem);
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to run process");
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return report;
  }

  @Override
  public RunReport run(final Term root) throws EngineException {
    load(root);
    return run();
  }

  @Override
  public void inject(final ChannelName channel, final List<Value> payload)
      throws EngineException {
    engineAlive();
    if (channel == null || payload == null) {
      throw new EngineException(Code.MALFORMED_EVENT, "Channel and payload cannot be null");
    }
    try {
      if (engineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          checkInjectable(channel);
          for (Value value : payload) {
            checkInjectable(value);
          }
          scheduler.inject(channel, new ArrayList<>(payload));
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to inject event");
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  @Override
  public boolean cancel(final String instanceId) throws EngineException {
    engineAlive();
    boolean success = false;
    try {
      if (engineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          lookupInstance(instanceId);
          success = scheduler.cancel(instanceId);
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to cancel instance");
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return success;
  }

  @Override
  public State readState(final String instanceId) throws EngineException {
    engineAlive();
    State state = null;
    try {
      if (engineReadLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          state = lookupInstance(instanceId).getState();
        } finally {
          engineReadLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE);
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return state;
  }

  @Override
  public List<State> readStateRoute(final String instanceId) throws EngineException {
    engineAlive();
    List<State> route = null;
    try {
      if (engineReadLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          route = lookupInstance(instanceId).getRoute();
        } finally {
          engineReadLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE);
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return route;
  }

  @Override
  public ChannelSnapshot channelSnapshot(final ChannelName channel) throws EngineException {
    engineAlive();
    if (channel == null) {
      throw new EngineException(Code.MALFORMED_EVENT, "Channel cannot be null");
    }
    ChannelSnapshot snapshot = null;
    try {
      if (engineReadLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          snapshot = scheduler.snapshot(channel);
        } finally {
          engineReadLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE);
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return snapshot;
  }

  @Override
  public String getId() {
    return engineId;
  }

  @Override
  public EngineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public RunStatistics getStatistics() {
    return scheduler.getStatistics();
  }

  @Override
  public boolean alive() {
    return engineAlive.get();
  }

  @Override
  public boolean demolish() throws EngineException {
    boolean success = false;
    if (!engineAlive.get()) {
      logInfo(engineId, null, "Process engine is already demolished");
      return true;
    }
    logInfo(engineId, null, "Demolishing process engine");
    try {
      if (engineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        // 1. signal death
        engineAlive.set(false);
        try {
          // 2. print engine stats
          logInfo(engineId, null, scheduler.getStatistics().toString());

          // 3. drop all instances, events and pending channel entries
          scheduler.clear();

          logInfo(engineId, null, "Successfully shut down process engine");
          success = true;
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to shutdown process engine");
      }
    } catch (InterruptedException exception) {
      throw new EngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return success;
  }

  private void engineAlive() throws EngineException {
    if (!alive()) {
      throw new EngineException(Code.ENGINE_NOT_ALIVE,
          "Process engine id:" + engineId + " is not alive");
    }
  }

  private FsmInstance lookupInstance(final String instanceId) throws EngineException {
    final FsmInstance instance = instanceId == null ? null : scheduler.lookup(instanceId);
    if (instance == null) {
      throw new EngineException(Code.ILLEGAL_INSTANCE_ID,
          "No instance with id:" + instanceId);
    }
    return instance;
  }

  /**
   * Callers may only use names they could have learned: quoted and uri names, or unforgeable
   * names this engine minted.
   */
  private void checkInjectable(final ChannelName channel) throws EngineException {
    if (channel.getKind() == ChannelName.Kind.UNFORGEABLE && !scheduler.minted(channel)) {
      throw new EngineException(Code.MALFORMED_EVENT,
          "Unforgeable name " + channel + " was not minted by this engine");
    }
    if (channel.getKind() == ChannelName.Kind.QUOTED) {
      checkInjectable(channel.getQuoted());
    }
  }

  private void checkInjectable(final Value value) throws EngineException {
    if (value == null) {
      throw new EngineException(Code.MALFORMED_EVENT, "Payload values cannot be null");
    }
    switch (value.getKind()) {
      case PROCESS:
        throw new EngineException(Code.MALFORMED_EVENT, "Processes cannot be injected");
      case NAME:
        checkInjectable(value.asName());
        break;
      case LIST:
      case TUPLE:
        for (Value element : value.asList()) {
          checkInjectable(element);
        }
        break;
      case SET:
        for (Value element : value.asSet()) {
          checkInjectable(element);
        }
        break;
      case MAP:
        for (Map.Entry<Value, Value> entry : value.asMap().entrySet()) {
          checkInjectable(entry.getKey());
          checkInjectable(entry.getValue());
        }
        break;
      default:
        break;
    }
  }

  private static void validate(final Term term) throws EngineException {
    switch (term.getKind()) {
      case SELECT:
        if (((Term.Select) term).getBranches().isEmpty()) {
          throw new EngineException(Code.INVALID_TERM, "Select needs at least one branch");
        }
        break;
      case OPERATION: {
        final Term.Operation operation = (Term.Operation) term;
        final int operands = operation.getOperands().size();
        final boolean wellFormed;
        if (operation.getOperator() == Operator.METHOD) {
          wellFormed = operands >= 1 && operation.getMethod() != null;
        } else if (operation.getOperator().isUnary()) {
          wellFormed = operands == 1;
        } else {
          wellFormed = operands == 2;
        }
        if (!wellFormed) {
          throw new EngineException(Code.INVALID_TERM,
              "Operator " + operation.getOperator() + " applied to " + operands + " operand(s)");
        }
        break;
      }
      case COLLECTION: {
        final Term.Collection collection = (Term.Collection) term;
        if (collection.getCollectionKind() == CollectionKind.MAP
            && collection.getElements().size() % 2 != 0) {
          throw new EngineException(Code.INVALID_TERM, "Map needs key value pairs");
        }
        break;
      }
      default:
        break;
    }
    for (Term child : term.children()) {
      if (child == null) {
        throw new EngineException(Code.INVALID_TERM, "Null sub-term in " + term);
      }
      validate(child);
    }
  }

  private static void logError(final String engineId, final String instanceId,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString(), error);
  }

  private static void logInfo(final String engineId, final String instanceId,
      final String message) {
    logger.info(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString());
  }
}
