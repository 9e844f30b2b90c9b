package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.processfsm.Event.Signal;
import com.github.processfsm.RunReport.BlockedInstance;
import com.github.processfsm.RunReport.Outcome;

/**
 * Drives FSM instances: takes the next event round-robin, applies the transition function to its
 * target and applies the outcome's effects as one unit before the next event is taken. The
 * instance table, the event queue and the channel store are owned here and handed explicitly to
 * whoever needs them; nothing is global.
 *
 * <p>
 * Not thread-safe. {@link ProcessEngineImpl} serializes access to it.
 */
final class Scheduler {
  private static final Logger logger = LogManager.getLogger(Scheduler.class.getSimpleName());
  static final String ROOT_ID = "0";

  private final String engineId;
  private final EngineConfiguration config;
  private final TransitionFunction transitions = new TransitionFunction();
  private final ChannelStore store = new ChannelStore();
  private final EventQueue queue = new EventQueue();
  private final Map<String, FsmInstance> instances = new LinkedHashMap<>();
  private final Set<String> everSpawned = new HashSet<>();
  private final Map<ChannelName, ChannelSink> sinks;
  private final RunStatistics lifetime = new RunStatistics();

  // channels where a match left an entry behind that may now match something else
  private final Set<ChannelName> rescans = new LinkedHashSet<>();

  // per run
  private RunStatistics run = new RunStatistics();
  private final List<ProcessFault> faults = new ArrayList<>();
  private final List<MatchRecord> matches = new ArrayList<>();
  private final List<String> output = new ArrayList<>();
  private long matchOrder;
  private int live;

  Scheduler(final String engineId, final EngineConfiguration config,
      final Map<ChannelName, ChannelSink> sinks) {
    this.engineId = engineId;
    this.config = config;
    this.sinks = Collections.unmodifiableMap(new LinkedHashMap<>(sinks));
  }

  String load(final Term root) {
    final FsmInstance instance = new FsmInstance(ROOT_ID, null, root, FsmInstance.Purpose.BODY,
        Environment.empty(), Collections.<Restriction>emptyList());
    register(instance);
    queue.enqueue(Event.signal(Signal.START, ROOT_ID, null));
    return ROOT_ID;
  }

  boolean isLoaded() {
    return instances.containsKey(ROOT_ID);
  }

  RunReport run() {
    // matches made by injections since the last run
    lifetime.add(run);
    run = new RunStatistics();
    run.peakLive = live;
    faults.clear();
    matches.clear();
    output.clear();
    boolean exhausted = false;
    logInfo(engineId, null, "Running with " + live + " live instance(s), " + queue.size()
        + " queued and " + queue.deferredSize() + " parked event(s)");
    while (true) {
      if (!rescans.isEmpty()) {
        rescan();
        continue;
      }
      if (queue.isEmpty()) {
        break;
      }
      if (run.steps >= config.getMaxSteps()) {
        exhausted = true;
        break;
      }
      dispatch(queue.next());
    }
    if (exhausted) {
      timeOutAll();
    }
    final RunReport report = report(exhausted);
    lifetime.add(run);
    run = new RunStatistics();
    logInfo(engineId, null, "Run finished with " + report.getOutcome() + ", "
        + report.getStatistics() + ", " + store.pendingSends() + " pending send(s), "
        + store.pendingReceives() + " pending receive(s)");
    return report;
  }

  void inject(final ChannelName channel, final List<Value> payload) {
    logInfo(engineId, null, "Injecting " + payload + " on " + channel);
    final ChannelSink sink = sinks.get(channel);
    if (sink != null) {
      write(sink, channel, payload);
      return;
    }
    final Optional<ChannelMatch> match = store.publish(channel, payload, Persistence.ONCE, null);
    if (match.isPresent()) {
      deliver(match.get());
    }
  }

  /**
   * Cancels the instance and every live descendant. The parent, when alive, is notified as if the
   * instance had terminated with Nil.
   */
  boolean cancel(final String instanceId) {
    final FsmInstance target = instances.get(instanceId);
    if (target == null || target.isTerminated()) {
      return false;
    }
    final List<FsmInstance> doomed = new ArrayList<>();
    for (FsmInstance instance : instances.values()) {
      if (!instance.isTerminated() && descendsFrom(instance, instanceId)) {
        doomed.add(instance);
      }
    }
    Collections.reverse(doomed);
    doomed.add(target);
    for (FsmInstance instance : doomed) {
      store.retract(instance.getId());
      lifetime.dropped += queue.discard(instance.getId());
      instance.cancel(config.getMaxRouteLength());
      lifetime.cancelled++;
      live--;
      if (instance != target) {
        instances.remove(instance.getId());
      }
    }
    final FsmInstance parent =
        target.getParentId() == null ? null : instances.get(target.getParentId());
    if (parent != null && !parent.isTerminated()) {
      queue.enqueue(target.getPurpose() == FsmInstance.Purpose.OPERAND
          ? Event.expressionEvaluated(parent.getId(), instanceId, Value.nil(), null)
          : Event.childTerminated(parent.getId(), instanceId, Value.nil()));
    } else if (!ROOT_ID.equals(instanceId)) {
      instances.remove(instanceId);
    }
    logInfo(engineId, instanceId, "Cancelled along with " + (doomed.size() - 1)
        + " descendant(s)");
    return true;
  }

  FsmInstance lookup(final String instanceId) {
    return instances.get(instanceId);
  }

  ChannelSnapshot snapshot(final ChannelName channel) {
    return store.snapshot(channel);
  }

  /**
   * Whether an unforgeable name was minted by an instance of this engine.
   */
  boolean minted(final ChannelName name) {
    final String id = name.getId();
    final int separator = id.lastIndexOf('#');
    return separator > 0 && everSpawned.contains(id.substring(0, separator));
  }

  RunStatistics getStatistics() {
    return lifetime;
  }

  void clear() {
    instances.clear();
    queue.clear();
    rescans.clear();
    store.clear();
  }

  private void dispatch(final Event event) {
    final FsmInstance target = instances.get(event.getTargetId());
    if (target == null || target.isTerminated()) {
      run.dropped++;
      if (target == null) {
        logWarning(engineId, event.getTargetId(), "Dropped event for unknown instance " + event);
      } else {
        logDebug(engineId, event.getTargetId(), "Dropped event for "
            + (target.isCancelled() ? "cancelled" : "terminated") + " instance " + event);
      }
      return;
    }
    run.steps++;
    final State before = target.getState();
    final StepOutcome outcome = transitions.step(target, event);
    if (!outcome.isProgressed()) {
      queue.defer(event);
      run.deferred++;
      logDebug(engineId, target.getId(), "Deferred " + event + " in " + before);
      return;
    }
    target.apply(outcome, config.getMaxRouteLength());
    logDebug(engineId, target.getId(), event + ": " + before + " -> " + target.getState());
    if (!before.equals(target.getState())) {
      queue.release(target.getId());
    }
    if (target.isTerminated()) {
      terminated(target);
    }
    for (Effect effect : outcome.getEffects()) {
      apply(effect);
    }
    if (isChildNotification(event)) {
      final FsmInstance child = instances.get(event.getSourceId());
      if (child != null && child.isTerminated()
          && target.getId().equals(child.getParentId())) {
        instances.remove(child.getId());
      }
    }
    if (target.isTerminated() && !ROOT_ID.equals(target.getId())) {
      final FsmInstance parent = instances.get(target.getParentId());
      if (parent == null || parent.isTerminated()) {
        instances.remove(target.getId());
      }
    }
  }

  private void terminated(final FsmInstance instance) {
    live--;
    run.terminated++;
    run.dropped += queue.discard(instance.getId());
    final ProcessFault fault = instance.getFault();
    if (fault != null) {
      faults.add(fault);
      run.faults++;
      logError(engineId, instance.getId(), fault.toString());
    }
  }

  private void apply(final Effect effect) {
    switch (effect.getKind()) {
      case SPAWN:
        register(effect.getChild());
        run.spawned++;
        break;
      case ENQUEUE:
        queue.enqueue(effect.getEvent());
        break;
      case PUBLISH: {
        final ChannelSink sink = sinks.get(effect.getChannel());
        if (sink != null) {
          write(sink, effect.getChannel(), effect.getPayload());
          if (effect.getInstanceId() != null) {
            queue.enqueue(Event.signal(Signal.ACK, effect.getInstanceId(), null));
          }
          break;
        }
        final Optional<ChannelMatch> match = store.publish(effect.getChannel(),
            effect.getPayload(), effect.getPersistence(), effect.getInstanceId());
        if (match.isPresent()) {
          deliver(match.get());
        }
        break;
      }
      case REQUEST: {
        final Optional<ChannelMatch> match = store.request(effect.getChannel(),
            effect.getPattern(), effect.getMode(), effect.getInstanceId());
        if (match.isPresent()) {
          deliver(match.get());
        }
        break;
      }
      case SELECT: {
        final Optional<ChannelMatch> match =
            store.select(effect.getArms(), effect.getInstanceId());
        if (match.isPresent()) {
          deliver(match.get());
        }
        break;
      }
      case RETRACT:
        store.retract(effect.getInstanceId());
        break;
      default:
        break;
    }
  }

  private void deliver(final ChannelMatch match) {
    run.matches++;
    final ChannelStore.ReceiveEntry receive = match.getReceive();
    final ChannelStore.SendEntry send = match.getSend();
    if (config.getRecordMatches()) {
      matches.add(new MatchRecord(++matchOrder, match.getChannel(), send.getPayload(),
          receive.getContinuationId(), receive.getMode(), receive.getArmIndex()));
    }
    logDebug(engineId, receive.getContinuationId(), "Matched " + match);
    queue.enqueue(Event.messageAvailable(receive.getContinuationId(), match.getChannel(),
        send.getPayload(), match.getBindings(), receive.getArmIndex()));
    if (send.acknowledge()) {
      queue.enqueue(Event.signal(Signal.ACK, send.getAckTarget(), receive.getContinuationId()));
    }
    if (!match.isSendRemoved() || !match.isReceiveRemoved()) {
      rescans.add(match.getChannel());
    }
  }

  private void rescan() {
    final Iterator<ChannelName> iterator = rescans.iterator();
    final ChannelName channel = iterator.next();
    iterator.remove();
    final Optional<ChannelMatch> match = store.rescan(channel);
    if (match.isPresent()) {
      deliver(match.get());
    }
  }

  private void write(final ChannelSink sink, final ChannelName channel,
      final List<Value> payload) {
    output.add(LoggingSink.render(payload));
    sink.write(channel, payload);
  }

  private void timeOutAll() {
    logWarning(engineId, null, "Step limit of " + config.getMaxSteps()
        + " reached, timing out " + live + " live instance(s)");
    for (FsmInstance instance : new ArrayList<>(instances.values())) {
      if (instance.isTerminated()) {
        continue;
      }
      final StepOutcome outcome = transitions.step(instance, Event.timeout(instance.getId()));
      instance.apply(outcome, config.getMaxRouteLength());
      store.retract(instance.getId());
      terminated(instance);
    }
    queue.clear();
    rescans.clear();
  }

  private RunReport report(final boolean exhausted) {
    final FsmInstance root = instances.get(ROOT_ID);
    final List<BlockedInstance> blocked = new ArrayList<>();
    final List<BlockedInstance> listeners = new ArrayList<>();
    final Map<String, Boolean> idle = new HashMap<>();
    if (!exhausted) {
      for (FsmInstance instance : instances.values()) {
        if (instance.isTerminated()) {
          continue;
        }
        if (isIdle(instance, idle)) {
          if (isListener(instance)) {
            listeners.add(new BlockedInstance(instance.getId(), instance.getState(),
                "listening on " + store.registrationsOf(instance.getId())));
          }
        } else {
          blocked.add(new BlockedInstance(instance.getId(), instance.getState(),
              reason(instance)));
        }
      }
    }
    final Outcome outcome;
    if (exhausted) {
      outcome = Outcome.STEP_LIMIT_EXCEEDED;
    } else if (root.isTerminated() && root.getFault() != null) {
      outcome = Outcome.FAILED;
    } else if (!blocked.isEmpty()) {
      outcome = Outcome.DEADLOCKED;
      logWarning(engineId, null, "Deadlocked, blocked instances: " + blocked);
    } else if (root.isTerminated()) {
      outcome = Outcome.COMPLETED;
    } else {
      outcome = Outcome.QUIESCENT;
    }
    run.peakLive = Math.max(run.peakLive, live);
    return new RunReport(outcome, ROOT_ID,
        root.isTerminated() && root.getFault() == null ? root.getResult() : null,
        root.getEnvironment(), faults, blocked, listeners, matches, output, run.copy());
  }

  /**
   * Persistent listeners are idle, and so is an instance that only waits on idle children.
   */
  private boolean isIdle(final FsmInstance instance, final Map<String, Boolean> memo) {
    final Boolean known = memo.get(instance.getId());
    if (known != null) {
      return known;
    }
    boolean idle;
    if (isListener(instance)) {
      idle = true;
    } else {
      final List<FsmInstance> children = liveChildren(instance);
      idle = !children.isEmpty();
      for (FsmInstance child : children) {
        if (!isIdle(child, memo)) {
          idle = false;
        }
      }
    }
    memo.put(instance.getId(), idle);
    return idle;
  }

  private static boolean isListener(final FsmInstance instance) {
    return instance.getState().is(Phase.RECEIVING)
        && instance.getState().getQualifier() == ReceiveMode.PERSISTENT;
  }

  private String reason(final FsmInstance instance) {
    final State state = instance.getState();
    if (state.is(Phase.RECEIVING)) {
      return "waiting for a message on " + store.registrationsOf(instance.getId());
    }
    if (state.is(Phase.WAITING)) {
      return "waiting for its send on " + instance.getFrame().channel + " to be consumed";
    }
    final List<FsmInstance> children = liveChildren(instance);
    if (!children.isEmpty()) {
      final List<String> ids = new ArrayList<>();
      for (FsmInstance child : children) {
        ids.add(child.getId());
      }
      return "waiting on children " + ids;
    }
    final List<Event> parked = queue.deferredFor(instance.getId());
    if (!parked.isEmpty()) {
      return "not ready for " + parked;
    }
    return "no event can move it out of " + state;
  }

  private List<FsmInstance> liveChildren(final FsmInstance instance) {
    final List<FsmInstance> children = new ArrayList<>();
    for (String childId : instance.getPendingChildren()) {
      final FsmInstance child = instances.get(childId);
      if (child != null && !child.isTerminated()) {
        children.add(child);
      }
    }
    return children;
  }

  private boolean descendsFrom(final FsmInstance instance, final String ancestorId) {
    String parentId = instance.getParentId();
    while (parentId != null) {
      if (parentId.equals(ancestorId)) {
        return true;
      }
      final FsmInstance parent = instances.get(parentId);
      parentId = parent == null ? null : parent.getParentId();
    }
    return false;
  }

  private void register(final FsmInstance instance) {
    instances.put(instance.getId(), instance);
    everSpawned.add(instance.getId());
    live++;
    run.peakLive = Math.max(run.peakLive, live);
  }

  private static boolean isChildNotification(final Event event) {
    return event.getType() == Event.Type.EXPRESSION_EVALUATED
        || event.getType() == Event.Type.ERROR || event.is(Signal.CHILD_TERMINATED);
  }

  private static void logError(final String engineId, final String instanceId,
      final String message) {
    logger.error(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString());
  }

  private static void logWarning(final String engineId, final String instanceId,
      final String message) {
    logger.warn(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString());
  }

  private static void logInfo(final String engineId, final String instanceId,
      final String message) {
    logger.info(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString());
  }

  private static void logDebug(final String engineId, final String instanceId,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[e:").append(engineId).append("][i:")
          .append(instanceId).append("] ").append(message).toString());
    }
  }
}
