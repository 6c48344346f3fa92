package com.github.behaviorengine;

import java.util.List;
import java.util.Map;

import com.github.behaviorengine.InstanceStatistics.StateTimePair;

/**
 * Runtime for registered behaviors. A host activates a behavior for a subject, feeds it events and
 * frames, and receives render, persist, notify and navigate requests through its
 * {@link EffectSink}.
 *
 * Notes for users:<br>
 * 1. the engine is thread-safe; it is not a singleton, build as many as needed<br>
 * 2. dispatch is synchronous and run-to-completion: events emitted by effects are processed before
 * the call returns<br>
 * 3. calls for the same instance are serialized; different instances run independently, except
 * instances of one behavior sharing singleton entities, which are serialized together<br>
 * 4. engine faults never escape dispatch, they are reported in the {@link DispatchResult}; only
 * lifecycle problems (unknown behavior or instance, bad activation config, lock timeouts, a
 * demolished engine) are thrown<br>
 */
public interface BehaviorEngine {

  ///// Instance-specific API /////
  /**
   * Create an instance of a registered behavior and return its id. The subject's values overlay
   * the instance record's defaults; config is resolved against the behavior's config schema.
   */
  String activate(final String behaviorName, final Map<String, Object> subject,
      final Map<String, Object> config) throws BehaviorEngineException;

  /**
   * Hand an event to an instance. At most one transition is taken for the event itself.
   */
  DispatchResult dispatch(final String instanceId, final String eventKey, final Object payload)
      throws BehaviorEngineException;

  /**
   * Deliver an event to every live instance with a listener for it, in activation order. Returns
   * one result per matching listener; a listener whose guard does not hold reports a miss.
   */
  List<DispatchResult> broadcast(final String eventKey, final Object payload)
      throws BehaviorEngineException;

  /**
   * Run the instance's frame ticks once, higher priority first.
   */
  DispatchResult frame(final String instanceId) throws BehaviorEngineException;

  String readCurrentState(final String instanceId) throws BehaviorEngineException;

  /**
   * A deep copy of the instance's own record.
   */
  Map<String, Object> readEntity(final String instanceId) throws BehaviorEngineException;

  /**
   * A deep copy of a singleton entity record visible to the instance, or null when the behavior
   * declares no such singleton.
   */
  Map<String, Object> readSingleton(final String instanceId, final String entityName)
      throws BehaviorEngineException;

  /**
   * The last states the instance went through, oldest first. Older entries are pruned.
   */
  StateTimePair[] getStateTransitionRoute(final String instanceId) throws BehaviorEngineException;

  /**
   * Destroy an instance, cancelling its timers. Returns false when no such instance is live.
   */
  boolean destroy(final String instanceId) throws BehaviorEngineException;

  ///// Engine-wide API /////
  String getId();

  EngineConfiguration getConfiguration();

  BehaviorRegistry getRegistry();

  EngineStatistics getStatistics();

  boolean alive();

  /**
   * Destroy all instances, stop the purger and shut the engine down.
   */
  boolean demolish() throws BehaviorEngineException;

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class BehaviorEngineBuilder {
    private BehaviorRegistry registry;
    private EngineConfiguration config;
    private EffectSink sink;
    private Scheduler scheduler;

    public static BehaviorEngineBuilder newBuilder() {
      return new BehaviorEngineBuilder();
    }

    public BehaviorEngineBuilder registry(final BehaviorRegistry registry) {
      this.registry = registry;
      return this;
    }

    public BehaviorEngineBuilder config(final EngineConfiguration config) {
      this.config = config;
      return this;
    }

    public BehaviorEngineBuilder sink(final EffectSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Without a scheduler the engine runs its own single daemon timer thread.
     */
    public BehaviorEngineBuilder scheduler(final Scheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public BehaviorEngine build() throws BehaviorEngineException {
      if (registry == null) {
        throw new BehaviorEngineException(BehaviorEngineException.Code.INVALID_ENGINE_CONFIG,
            "BehaviorRegistry cannot be null");
      }
      return new BehaviorEngineImpl(registry,
          config == null ? EngineConfiguration.EngineConfigurationBuilder.newBuilder().build()
              : config,
          sink == null ? NullEffectSink.INSTANCE : sink, scheduler);
    }

    private BehaviorEngineBuilder() {}
  }

}
