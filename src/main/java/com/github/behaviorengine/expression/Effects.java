package com.github.behaviorengine.expression;

import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException;
import com.github.behaviorengine.NotificationType;
import com.github.behaviorengine.PersistOperation;
import com.github.behaviorengine.expression.Expression.Reference;

/**
 * Receiver of every side effect an expression can request. The runtime implements this per
 * instance; a context without Effects is a pure context in which effect operators fail.
 */
public interface Effects {

  /**
   * Write a value into instance data. The target is an {@code @entity.*} or
   * {@code @<EntityName>.*} reference.
   */
  void assign(final Reference target, final Object value) throws BehaviorEngineException;

  /**
   * Queue a follow-up event on the same instance. It is dispatched after the current effect list
   * completes.
   */
  void emit(final String event, final Object payload) throws BehaviorEngineException;

  /**
   * Render a component into a slot. A null componentType clears the slot.
   */
  void render(final String slot, final String componentType, final Map<String, Object> props)
      throws BehaviorEngineException;

  void persist(final PersistOperation operation, final String entityName, final Object payload)
      throws BehaviorEngineException;

  void notify(final NotificationType type, final String message, final Object action)
      throws BehaviorEngineException;

  void navigate(final String path, final Map<String, Object> params)
      throws BehaviorEngineException;

  /**
   * Run effects later, once after delayMillis, or every periodMillis when periodMillis > 0. The
   * effects keep the payload and local bindings of the scope that scheduled them; instance data,
   * state and time are read when they run.
   */
  void schedule(final long delayMillis, final long periodMillis, final List<Expression> effects,
      final EvaluationContext scope) throws BehaviorEngineException;
}
