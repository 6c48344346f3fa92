package com.github.behaviorengine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.DispatchResult.Outcome;
import com.github.behaviorengine.InstanceStatistics.StateTimePair;
import com.github.behaviorengine.expression.EvaluationContext;
import com.github.behaviorengine.expression.EvaluationContext.EvaluationContextBuilder;
import com.github.behaviorengine.expression.Evaluator;
import com.github.behaviorengine.expression.Expression;
import com.github.behaviorengine.expression.Expression.Reference;
import com.github.behaviorengine.expression.Effects;
import com.github.behaviorengine.expression.Undefined;

/**
 * The behavior engine.
 *
 * Notes for users:<br>
 * 1. every instance owns a work queue. A host call enqueues its event and drains the queue; events
 * emitted by effects are appended and processed before the call returns<br>
 * 2. a call arriving while the same instance is draining on the current thread (a sink calling
 * back into the engine) is queued and reported as {@link Outcome#QUEUED}<br>
 * 3. a fault aborts the effect list in progress and drops the rest of the queue; the state change
 * and the effects applied so far stay<br>
 * 4. timers and fixed-interval ticks run on the {@link Scheduler} and go through the same
 * serialized path as host events<br>
 */
public final class BehaviorEngineImpl implements BehaviorEngine {
  private static final Logger logger =
      LogManager.getLogger(BehaviorEngineImpl.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();

  private final AtomicBoolean engineAlive = new AtomicBoolean();

  private final BehaviorRegistry registry;
  private final EngineConfiguration config;
  private final EffectSink sink;
  private final Scheduler scheduler;
  // only set when the engine runs its own timer thread
  private final ScheduledExecutorService ownedExecutor;
  private final Evaluator evaluator;
  private final long lockAcquisitionMillis;

  // K=instance.instanceId, V=instance
  final ConcurrentMap<String, Instance> allInstancesTable = new ConcurrentHashMap<>();

  // K=behavior name, V=singleton records shared by the live instances of that behavior
  private final Map<String, SingletonGroup> singletonGroups = new HashMap<>();

  private final AtomicLong activationSequence = new AtomicLong();

  private final EngineStatistics engineStats;

  private InstancePurger instancePurgerDaemon;

  // global engine level locks guarding the instance table and singleton groups
  private final ReentrantReadWriteLock engineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock engineWriteLock = engineSuperLock.writeLock();
  private final ReadLock engineReadLock = engineSuperLock.readLock();

  BehaviorEngineImpl(final BehaviorRegistry registry, final EngineConfiguration config,
      final EffectSink sink, final Scheduler scheduler) {
    logInfo(engineId, null, "Firing up behavior engine with " + config);
    this.registry = registry;
    this.config = config;
    this.sink = sink;
    this.lockAcquisitionMillis = config.getLockAcquisitionMillis();
    if (scheduler == null) {
      ownedExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        final Thread thread = new Thread(runnable, "Behavior-Timer");
        thread.setDaemon(true);
        return thread;
      });
      this.scheduler = new ScheduledExecutorScheduler(ownedExecutor);
    } else {
      ownedExecutor = null;
      this.scheduler = scheduler;
    }
    this.evaluator = new Evaluator(registry.getOperators());
    this.engineStats = new EngineStatistics(engineId, this, config.getClock().millis());

    instancePurgerDaemon = new InstancePurger(config.getPurgerSleepMillis());
    instancePurgerDaemon.start();

    engineAlive.set(true);
    logInfo(engineId, null,
        "Successfully fired up behavior engine with " + registry.size() + " behaviors");
  }

  @Override
  public String activate(final String behaviorName, final Map<String, Object> subject,
      final Map<String, Object> activationConfig) throws BehaviorEngineException {
    engineAlive();
    final BehaviorDefinition definition = registry.get(behaviorName);
    if (definition == null) {
      throw new BehaviorEngineException(Code.UNKNOWN_BEHAVIOR,
          "Behavior is not registered: " + behaviorName);
    }
    final Map<String, Object> resolvedConfig = definition.getConfigSchema()
        .resolve(activationConfig == null ? Collections.<String, Object>emptyMap()
            : activationConfig);
    Instance instance = null;
    try {
      if (engineWriteLock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        try {
          SingletonGroup group = null;
          if (definition.hasSingletonEntities()) {
            group = singletonGroups.get(behaviorName);
            if (group == null) {
              group = new SingletonGroup(definition);
              singletonGroups.put(behaviorName, group);
            }
            group.references++;
          }
          instance = new Instance(definition, resolvedConfig, subject, group);
          allInstancesTable.put(instance.instanceId, instance);
          engineStats.totalActivated++;
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to activate " + behaviorName);
      }
    } catch (InterruptedException exception) {
      throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    logInfo(engineId, instance.instanceId,
        String.format("Activated %s in state %s", behaviorName, instance.currentState));

    startIntervalTicks(instance);
    if (!definition.getInitialEffects().isEmpty()) {
      final DispatchResult result = submit(instance,
          new EffectsWork(definition.getInitialEffects(), Undefined.INSTANCE,
              Collections.<String, Object>emptyMap()), "initialEffects", Outcome.TICKED);
      if (!result.isSuccessful()) {
        logWarning(engineId, instance.instanceId,
            "Initial effects did not complete: " + result.getError().getMessage());
      }
    }
    return instance.instanceId;
  }

  @Override
  public DispatchResult dispatch(final String instanceId, final String eventKey,
      final Object payload) throws BehaviorEngineException {
    engineAlive();
    if (eventKey == null || eventKey.isEmpty()) {
      throw new BehaviorEngineException(Code.INVALID_EFFECT, "Event key cannot be empty");
    }
    final Instance instance = lookupInstance(instanceId);
    return submit(instance, new EventWork(eventKey, payload), eventKey, Outcome.TRANSITIONED);
  }

  @Override
  public List<DispatchResult> broadcast(final String eventKey, final Object payload)
      throws BehaviorEngineException {
    engineAlive();
    final List<Instance> listening = new ArrayList<>();
    for (final Instance instance : allInstancesTable.values()) {
      if (!instance.listenersFor(eventKey).isEmpty()) {
        listening.add(instance);
      }
    }
    Collections.sort(listening, (one, two) -> Long.compare(one.sequence, two.sequence));
    final List<DispatchResult> results = new ArrayList<>();
    for (final Instance instance : listening) {
      for (final Listener listener : instance.listenersFor(eventKey)) {
        try {
          results.add(submit(instance, new ListenerWork(listener, payload),
              eventKey + "->" + listener.getTriggers(), Outcome.TRANSITIONED));
        } catch (BehaviorEngineException exception) {
          logWarning(engineId, instance.instanceId,
              "Skipped broadcast of " + eventKey + ": " + exception.getMessage());
        }
      }
    }
    logDebug(engineId, null,
        String.format("Broadcast %s to %d instances", eventKey, listening.size()));
    return results;
  }

  @Override
  public DispatchResult frame(final String instanceId) throws BehaviorEngineException {
    engineAlive();
    final Instance instance = lookupInstance(instanceId);
    return submit(instance, new FrameWork(), "frame", Outcome.TICKED);
  }

  @Override
  public String readCurrentState(final String instanceId) throws BehaviorEngineException {
    final Instance instance = lookupInstance(instanceId);
    lockInstance(instance, "read current state");
    try {
      return instance.currentState;
    } finally {
      instance.lock.unlock();
    }
  }

  @Override
  public Map<String, Object> readEntity(final String instanceId) throws BehaviorEngineException {
    final Instance instance = lookupInstance(instanceId);
    lockInstance(instance, "read entity");
    try {
      return DataEntity.copyOfRecord(instance.record);
    } finally {
      instance.lock.unlock();
    }
  }

  @Override
  public Map<String, Object> readSingleton(final String instanceId, final String entityName)
      throws BehaviorEngineException {
    final Instance instance = lookupInstance(instanceId);
    if (instance.group == null || !instance.group.records.containsKey(entityName)) {
      return null;
    }
    lockInstance(instance, "read singleton");
    try {
      return DataEntity.copyOfRecord(instance.group.records.get(entityName));
    } finally {
      instance.lock.unlock();
    }
  }

  @Override
  public StateTimePair[] getStateTransitionRoute(final String instanceId)
      throws BehaviorEngineException {
    final Instance instance = lookupInstance(instanceId);
    lockInstance(instance, "read state transition route");
    try {
      return instance.stats.boundedStateRoute
          .toArray(new StateTimePair[instance.stats.boundedStateRoute.size()]);
    } finally {
      instance.lock.unlock();
    }
  }

  @Override
  public boolean destroy(final String instanceId) throws BehaviorEngineException {
    engineAlive();
    final Instance instance = allInstancesTable.get(instanceId);
    if (instance == null) {
      return false;
    }
    return destroy(instance, false);
  }

  private boolean destroy(final Instance instance, final boolean purging)
      throws BehaviorEngineException {
    lockInstance(instance, "destroy instance");
    try {
      if (engineWriteLock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        try {
          if (!instance.alive) {
            return false;
          }
          instance.alive = false;
          final int cancelled = instance.cancelTimers();
          instance.queue.clear();
          allInstancesTable.remove(instance.instanceId);
          if (instance.group != null && --instance.group.references == 0) {
            singletonGroups.remove(instance.definition.getName());
          }
          if (purging) {
            engineStats.totalPurged++;
          } else {
            engineStats.totalDestroyed++;
          }
          logInfo(engineId, instance.instanceId, String.format(
              "%s instance, cancelled %d timers, %s", purging ? "Purged" : "Destroyed",
              cancelled, instance.stats));
          return true;
        } finally {
          engineWriteLock.unlock();
        }
      } else {
        throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to destroy instance");
      }
    } catch (InterruptedException exception) {
      throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    } finally {
      instance.lock.unlock();
    }
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
  public BehaviorRegistry getRegistry() {
    return registry;
  }

  @Override
  public EngineStatistics getStatistics() {
    return engineStats;
  }

  @Override
  public boolean alive() {
    return engineAlive.get();
  }

  @Override
  public boolean demolish() throws BehaviorEngineException {
    if (!engineAlive.get()) {
      logInfo(engineId, null, "Behavior engine is already demolished");
      return true;
    }
    logInfo(engineId, null, "Demolishing behavior engine");
    // 1. destroy all instances, cancelling their timers
    for (final Instance instance : new ArrayList<>(allInstancesTable.values())) {
      destroy(instance, false);
    }
    // 2. signal death
    engineAlive.set(false);
    // 3. interrupt instance purger
    instancePurgerDaemon.interrupt();
    try {
      instancePurgerDaemon.join();
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new BehaviorEngineException(Code.INTERRUPTED, exception);
    }
    instancePurgerDaemon = null;
    // 4. stop the timer thread we own
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
    }
    logInfo(engineId, null, engineStats.toString());
    logInfo(engineId, null, "Successfully shut down behavior engine");
    return true;
  }

  /**
   * Removes instances idle past the configured expiration. Returns how many were purged.
   */
  int purgeExpiredInstances() {
    final long nowMillis = config.getClock().millis();
    int purged = 0;
    final Iterator<Instance> instances = allInstancesTable.values().iterator();
    while (instances.hasNext()) {
      final Instance instance = instances.next();
      if (nowMillis > instance.stats.lastTouchTimeMillis
          + config.getInstanceExpirationMillis()) {
        try {
          if (destroy(instance, true)) {
            purged++;
          }
        } catch (BehaviorEngineException exception) {
          logWarning(engineId, instance.instanceId,
              "Failed to purge expired instance: " + exception.getMessage());
        }
      }
    }
    return purged;
  }

  private void startIntervalTicks(final Instance instance) {
    for (final Tick tick : instance.definition.getTicks()) {
      if (!tick.isFrameTick()) {
        final TickWork work = new TickWork(tick);
        instance.timers.add(scheduler.scheduleAtFixedRate(tick.getIntervalMillis(),
            tick.getIntervalMillis(), () -> fireTimer(instance, work, "tick " + tick.getName())));
      }
    }
  }

  /**
   * Runs on the scheduler's thread. Nothing escapes into the host's timer loop. Work that finds
   * the instance busy past the lock timeout is retried one lock timeout later until it runs or
   * the instance goes away.
   */
  private void fireTimer(final Instance instance, final Work work, final String label) {
    if (!instance.alive || !alive()) {
      return;
    }
    try {
      submit(instance, work, label, Outcome.TICKED);
    } catch (BehaviorEngineException exception) {
      if (exception.getCode() == Code.OPERATION_LOCK_ACQUISITION_FAILURE && instance.alive
          && alive()) {
        logDebug(engineId, instance.instanceId, "Instance busy, retrying " + label);
        try {
          instance.scheduleOnce(lockAcquisitionMillis, work, label);
        } catch (RuntimeException rejected) {
          logError(engineId, instance.instanceId, "Failed to retry " + label, rejected);
        }
      } else {
        logWarning(engineId, instance.instanceId,
            "Skipped " + label + ": " + exception.getMessage());
      }
    } catch (RuntimeException exception) {
      logError(engineId, instance.instanceId, "Unexpected failure running " + label, exception);
    }
  }

  private DispatchResult submit(final Instance instance, final Work work, final String label,
      final Outcome successOutcome) throws BehaviorEngineException {
    lockInstance(instance, "process " + label);
    try {
      if (!instance.alive) {
        throw new BehaviorEngineException(Code.ILLEGAL_INSTANCE_ID,
            "Instance " + instance.instanceId + " was destroyed");
      }
      instance.touch();
      if (instance.draining) {
        instance.queue.addLast(work);
        logDebug(engineId, instance.instanceId, "Queued re-entrant " + label);
        return new DispatchResult(Outcome.QUEUED, instance.instanceId, label,
            instance.currentState, instance.currentState, 0, 0, null);
      }
      return drain(instance, work, label, successOutcome);
    } finally {
      instance.lock.unlock();
    }
  }

  /**
   * Processes the work and everything it enqueues. Caller holds the instance lock.
   */
  private DispatchResult drain(final Instance instance, final Work work, final String label,
      final Outcome successOutcome) {
    final String fromState = instance.currentState;
    final Tally tally = new Tally();
    boolean matched = false;
    BehaviorEngineException fault = null;
    instance.queue.addLast(work);
    instance.draining = true;
    try {
      while (!instance.queue.isEmpty()) {
        if (tally.events >= config.getMaxCascadeDepth()) {
          fault = new BehaviorEngineException(Code.CASCADE_LIMIT,
              String.format("Processed %d events for %s, dropping %d still queued", tally.events,
                  label, instance.queue.size()));
          break;
        }
        final Work next = instance.queue.pollFirst();
        final boolean performed = next.perform(instance, tally);
        if (tally.events++ == 0) {
          matched = performed;
        }
      }
    } catch (BehaviorEngineException exception) {
      fault = exception;
    } catch (RuntimeException exception) {
      fault = new BehaviorEngineException(Code.UNKNOWN_FAILURE, String.valueOf(exception),
          exception);
    } finally {
      instance.draining = false;
    }
    if (fault != null) {
      instance.queue.clear();
      instance.stats.faults++;
      logError(engineId, instance.instanceId, String.format("Fault processing %s in state %s: %s",
          label, instance.currentState, fault.getMessage()));
      return new DispatchResult(Outcome.FAULT, instance.instanceId, label, fromState,
          instance.currentState, tally.effects, tally.events, fault);
    }
    return new DispatchResult(matched ? successOutcome : Outcome.MISS, instance.instanceId, label,
        fromState, instance.currentState, tally.effects, tally.events, null);
  }

  /**
   * Takes at most one transition for the event. Guards see the pre-transition state; effects see
   * the new one.
   */
  private boolean step(final Instance instance, final String event, final Object payload,
      final Tally tally) throws BehaviorEngineException {
    final StateMachineSpec machine = instance.definition.getStateMachine();
    final String fromState = instance.currentState;
    Transition chosen = null;
    if (machine != null) {
      final EvaluationContext guardContext = instance.context(payload, false);
      for (final Transition transition : machine.getTransitions()) {
        if (event.equals(transition.getEvent()) && transition.matchesFrom(fromState)
            && evaluator.evaluateGuard(transition.getGuard(), guardContext)) {
          chosen = transition;
          break;
        }
      }
    }
    if (chosen == null) {
      instance.stats.misses++;
      logDebug(engineId, instance.instanceId,
          String.format("No transition for %s in state %s", event, fromState));
      return false;
    }
    if (!chosen.isSelfLoop() && !chosen.getTo().equals(fromState)) {
      instance.currentState = chosen.getTo();
      instance.stats.enter(instance.currentState, config.getClock().millis());
    }
    instance.stats.transitions++;
    logDebug(engineId, instance.instanceId,
        String.format("%s: %s->%s", event, fromState, instance.currentState));
    tally.effects +=
        evaluator.executeEffects(chosen.getEffects(), instance.context(payload, true));
    return true;
  }

  private boolean runTick(final Instance instance, final Tick tick, final Tally tally)
      throws BehaviorEngineException {
    if (!evaluator.evaluateGuard(tick.getGuard(),
        instance.context(Undefined.INSTANCE, false))) {
      return false;
    }
    instance.stats.ticks++;
    tally.effects +=
        evaluator.executeEffects(tick.getEffects(), instance.context(Undefined.INSTANCE, true));
    return true;
  }

  private void lockInstance(final Instance instance, final String operation)
      throws BehaviorEngineException {
    try {
      if (!instance.lock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  private Instance lookupInstance(final String instanceId) throws BehaviorEngineException {
    Instance instance = null;
    try {
      if (engineReadLock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        try {
          instance = instanceId == null ? null : allInstancesTable.get(instanceId);
          if (instance == null) {
            throw new BehaviorEngineException(Code.ILLEGAL_INSTANCE_ID,
                "No live instance with id " + instanceId);
          }
        } finally {
          engineReadLock.unlock();
        }
      } else {
        throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE);
      }
    } catch (InterruptedException exception) {
      throw new BehaviorEngineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    return instance;
  }

  private void engineAlive() throws BehaviorEngineException {
    if (!engineAlive.get()) {
      throw new BehaviorEngineException(Code.ENGINE_NOT_ALIVE,
          "Behavior engine id:" + engineId + " is not alive");
    }
  }

  private static void logError(final String engineId, final String instanceId,
      final String message) {
    logger.error(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString());
  }

  private static void logError(final String engineId, final String instanceId,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[e:").append(engineId).append("][i:")
        .append(instanceId).append("] ").append(message).toString(), error);
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

  private static final class Tally {
    private int events;
    private int effects;
  }

  /**
   * A unit of serialized work on an instance. Returns whether it matched anything: a transition,
   * a passing tick guard.
   */
  private interface Work {
    boolean perform(final Instance instance, final Tally tally) throws BehaviorEngineException;
  }

  private final class EventWork implements Work {
    private final String event;
    private final Object payload;

    private EventWork(final String event, final Object payload) {
      this.event = event;
      this.payload = payload;
    }

    @Override
    public boolean perform(final Instance instance, final Tally tally)
        throws BehaviorEngineException {
      return step(instance, event, payload, tally);
    }
  }

  private final class ListenerWork implements Work {
    private final Listener listener;
    private final Object payload;

    private ListenerWork(final Listener listener, final Object payload) {
      this.listener = listener;
      this.payload = payload;
    }

    @Override
    public boolean perform(final Instance instance, final Tally tally)
        throws BehaviorEngineException {
      if (!evaluator.evaluateGuard(listener.getGuard(), instance.context(payload, false))) {
        return false;
      }
      return step(instance, listener.getTriggers(), payload, tally);
    }
  }

  /**
   * Effects run outside any transition: initial effects and timers. Timers keep the payload and
   * locals of the scope that scheduled them.
   */
  private final class EffectsWork implements Work {
    private final List<Expression> effects;
    private final Object payload;
    private final Map<String, Object> locals;

    private EffectsWork(final List<Expression> effects, final Object payload,
        final Map<String, Object> locals) {
      this.effects = effects;
      this.payload = payload;
      this.locals = locals;
    }

    @Override
    public boolean perform(final Instance instance, final Tally tally)
        throws BehaviorEngineException {
      EvaluationContext context = instance.context(payload, true);
      if (!locals.isEmpty()) {
        context = context.child(locals);
      }
      tally.effects += evaluator.executeEffects(effects, context);
      return true;
    }
  }

  private final class TickWork implements Work {
    private final Tick tick;

    private TickWork(final Tick tick) {
      this.tick = tick;
    }

    @Override
    public boolean perform(final Instance instance, final Tally tally)
        throws BehaviorEngineException {
      return runTick(instance, tick, tally);
    }
  }

  private final class FrameWork implements Work {
    @Override
    public boolean perform(final Instance instance, final Tally tally)
        throws BehaviorEngineException {
      boolean ran = false;
      for (final Tick tick : instance.frameTicks) {
        ran |= runTick(instance, tick, tally);
      }
      return ran;
    }
  }

  /**
   * Records of singleton entities shared by every live instance of one behavior, together with
   * the lock serializing those instances.
   */
  static final class SingletonGroup {
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<String, Map<String, Object>> records = new LinkedHashMap<>();
    private int references;

    private SingletonGroup(final BehaviorDefinition definition) {
      for (final DataEntity entity : definition.getDataEntities()) {
        if (entity.isSingleton()) {
          records.put(entity.getName(), entity.newRecord());
        }
      }
    }
  }

  /**
   * A live behavior instance. All mutable state here is guarded by {@link #lock}.
   */
  final class Instance implements Effects {
    private final String instanceId = UUID.randomUUID().toString();
    private final long sequence = activationSequence.incrementAndGet();
    private final BehaviorDefinition definition;
    private final Map<String, Object> instanceConfig;
    private final Map<String, Object> record = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> namedRecords = new LinkedHashMap<>();
    private final SingletonGroup group;
    private final ReentrantLock lock;
    private final List<Tick> frameTicks = new ArrayList<>();
    private final Deque<Work> queue = new ArrayDeque<>();
    private final Set<Cancellable> timers = ConcurrentHashMap.newKeySet();
    private volatile boolean alive = true;
    private boolean draining;
    private String currentState;
    final InstanceStatistics stats;

    private Instance(final BehaviorDefinition definition, final Map<String, Object> instanceConfig,
        final Map<String, Object> subject, final SingletonGroup group) {
      this.definition = definition;
      this.instanceConfig = instanceConfig;
      this.group = group;
      this.lock = group != null ? group.lock : new ReentrantLock(true);
      for (final DataEntity entity : definition.getDataEntities()) {
        if (!entity.isSingleton()) {
          record.putAll(entity.newRecord());
        }
      }
      if (subject != null) {
        for (final Map.Entry<String, Object> field : subject.entrySet()) {
          record.put(field.getKey(), DataEntity.copyOf(field.getValue()));
        }
      }
      for (final DataEntity entity : definition.getDataEntities()) {
        namedRecords.put(entity.getName(),
            entity.isSingleton() ? group.records.get(entity.getName()) : record);
      }
      for (final Tick tick : definition.getTicks()) {
        if (tick.isFrameTick()) {
          frameTicks.add(tick);
        }
      }
      // stable: equal priorities keep declaration order
      Collections.sort(frameTicks, (one, two) -> Integer.compare(two.getPriority(),
          one.getPriority()));
      final long nowMillis = config.getClock().millis();
      this.stats = new InstanceStatistics(instanceId, definition.getName(), nowMillis);
      if (definition.hasStateMachine()) {
        currentState = definition.getStateMachine().getInitial();
        stats.enter(currentState, nowMillis);
      }
    }

    private void touch() {
      stats.lastTouchTimeMillis = config.getClock().millis();
    }

    private List<Listener> listenersFor(final String eventKey) {
      final List<Listener> listeners = new ArrayList<>();
      for (final Listener listener : definition.getListens()) {
        if (listener.getEvent().equals(eventKey)) {
          listeners.add(listener);
        }
      }
      return listeners;
    }

    private EvaluationContext context(final Object payload, final boolean live) {
      final EvaluationContextBuilder builder = EvaluationContext.newBuilder().entity(record)
          .config(instanceConfig).payload(payload).state(currentState)
          .now(config.getClock().millis());
      for (final Map.Entry<String, Map<String, Object>> named : namedRecords.entrySet()) {
        builder.namedEntity(named.getKey(), named.getValue());
      }
      if (live) {
        builder.effects(this);
      }
      return builder.build();
    }

    private int cancelTimers() {
      int cancelled = 0;
      for (final Cancellable timer : timers) {
        if (timer.cancel()) {
          cancelled++;
        }
      }
      timers.clear();
      return cancelled;
    }

    @Override
    public void assign(final Reference target, final Object value)
        throws BehaviorEngineException {
      final Map<String, Object> root = "entity".equals(target.getRoot()) ? record
          : namedRecords.get(target.getRoot());
      if (root == null || target.getPath().isEmpty()) {
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "Cannot assign to " + target.getText() + ": only entity fields are writable");
      }
      final List<String> path = target.getPath();
      Map<String, Object> container = root;
      for (int iter = 0; iter < path.size() - 1; iter++) {
        final Object next = container.get(path.get(iter));
        if (next instanceof Map) {
          // nested records are re-keyed on write so the path below stays typed
          final Map<String, Object> nested = DataEntity.copyOfRecord((Map<?, ?>) next);
          container.put(path.get(iter), nested);
          container = nested;
        } else {
          final Map<String, Object> created = new LinkedHashMap<>();
          container.put(path.get(iter), created);
          container = created;
        }
      }
      container.put(path.get(path.size() - 1), value);
    }

    @Override
    public void emit(final String event, final Object payload) {
      queue.addLast(new EventWork(event, payload));
      logDebug(engineId, instanceId, "Emitted " + event);
    }

    @Override
    public void render(final String slot, final String componentType,
        final Map<String, Object> props) throws BehaviorEngineException {
      try {
        sink.render(instanceId, slot, componentType, componentType == null ? null : props);
      } catch (RuntimeException exception) {
        throw sinkFailure("render", exception);
      }
    }

    @Override
    public void persist(final PersistOperation operation, final String entityName,
        final Object payload) throws BehaviorEngineException {
      try {
        sink.persist(instanceId, operation, entityName, payload);
      } catch (RuntimeException exception) {
        throw sinkFailure("persist", exception);
      }
    }

    @Override
    public void notify(final NotificationType type, final String message, final Object action)
        throws BehaviorEngineException {
      try {
        sink.notify(instanceId, type, message, action);
      } catch (RuntimeException exception) {
        throw sinkFailure("notify", exception);
      }
    }

    @Override
    public void navigate(final String path, final Map<String, Object> params)
        throws BehaviorEngineException {
      try {
        sink.navigate(instanceId, path, params);
      } catch (RuntimeException exception) {
        throw sinkFailure("navigate", exception);
      }
    }

    private BehaviorEngineException sinkFailure(final String effect,
        final RuntimeException exception) {
      return new BehaviorEngineException(Code.SINK_FAILURE,
          "Sink failed to " + effect + ": " + exception.getMessage(), exception);
    }

    @Override
    public void schedule(final long delayMillis, final long periodMillis,
        final List<Expression> effects, final EvaluationContext scope) {
      final EffectsWork work = new EffectsWork(new ArrayList<>(effects), scope.getPayload(),
          new HashMap<>(scope.getLocals()));
      if (periodMillis > 0L) {
        timers.add(scheduler.scheduleAtFixedRate(delayMillis, periodMillis,
            () -> fireTimer(this, work, "interval")));
        return;
      }
      scheduleOnce(delayMillis, work, "delay");
    }

    private void scheduleOnce(final long delayMillis, final Work work, final String label) {
      final AtomicReference<Cancellable> handle = new AtomicReference<>();
      handle.set(scheduler.schedule(delayMillis, () -> {
        final Cancellable self = handle.get();
        if (self != null) {
          timers.remove(self);
        }
        fireTimer(this, work, label);
      }));
      timers.add(handle.get());
    }
  }

  /**
   * This daemon exists to purge instances that their host never destroyed and that have been idle
   * past their TTL.
   */
  private final class InstancePurger extends Thread {
    private final long sleepMillis;

    private InstancePurger(final long sleepMillis) {
      setName("Instance-Purger");
      setDaemon(true);
      this.sleepMillis = sleepMillis;
    }

    @Override
    public void run() {
      while (!isInterrupted()) {
        logDebug(engineId, null, "Instance purger woke up to scan expired instances");
        final int scanned = allInstancesTable.size();
        final int purged = purgeExpiredInstances();
        logInfo(engineId, null,
            String.format("Instance purger run stats::scanned:%d, purged:%d", scanned, purged));
        try {
          Thread.sleep(sleepMillis);
        } catch (InterruptedException exception) {
          Thread.currentThread().interrupt();
        }
      }
      logInfo(engineId, null, "Successfully shut down instance purger");
    }
  }
}
