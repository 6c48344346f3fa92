package com.github.behaviorengine;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sink used when the host supplies none. Drops every effect, logging it at debug.
 */
public final class NullEffectSink implements EffectSink {
  private static final Logger logger = LogManager.getLogger(NullEffectSink.class.getSimpleName());

  public static final NullEffectSink INSTANCE = new NullEffectSink();

  @Override
  public void render(final String instanceId, final String slot, final String componentType,
      final Map<String, Object> props) {
    logDropped(instanceId, "render " + slot + " <- " + componentType);
  }

  @Override
  public void persist(final String instanceId, final PersistOperation operation,
      final String entityName, final Object payload) {
    logDropped(instanceId, "persist " + operation + " " + entityName);
  }

  @Override
  public void notify(final String instanceId, final NotificationType type, final String message,
      final Object action) {
    logDropped(instanceId, "notify " + type + " " + message);
  }

  @Override
  public void navigate(final String instanceId, final String path,
      final Map<String, Object> params) {
    logDropped(instanceId, "navigate " + path);
  }

  private static void logDropped(final String instanceId, final String effect) {
    if (logger.isDebugEnabled()) {
      logger.debug("[i:" + instanceId + "] Dropped " + effect);
    }
  }

  private NullEffectSink() {}
}
