package com.github.behaviorengine;

import java.util.Map;

/**
 * Host side of the effects a behavior cannot apply by itself. Calls arrive on the thread running
 * the dispatch, while the instance is locked; a sink may call back into the engine, in which case
 * dispatches to the same instance are queued behind the running one.
 *
 * A sink that throws aborts the running effect list with a SINK_FAILURE fault.
 */
public interface EffectSink {

  /**
   * Mount a component in a slot. A null componentType (and null props) clears the slot.
   */
  void render(final String instanceId, final String slot, final String componentType,
      final Map<String, Object> props) throws BehaviorEngineException;

  void persist(final String instanceId, final PersistOperation operation, final String entityName,
      final Object payload) throws BehaviorEngineException;

  void notify(final String instanceId, final NotificationType type, final String message,
      final Object action) throws BehaviorEngineException;

  void navigate(final String instanceId, final String path, final Map<String, Object> params)
      throws BehaviorEngineException;
}
