package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Sink that records every effect it receives, in order, as a short line such as
 * {@code render main entity-table} or {@code notify SUCCESS Saved}.
 */
public final class RecordingEffectSink implements EffectSink {
  private final List<String> effects = Collections.synchronizedList(new ArrayList<String>());
  private final List<Map<String, Object>> renderedProps =
      Collections.synchronizedList(new ArrayList<Map<String, Object>>());
  private final List<Object> persistedPayloads =
      Collections.synchronizedList(new ArrayList<Object>());
  private volatile RuntimeException failure;

  @Override
  public void render(final String instanceId, final String slot, final String componentType,
      final Map<String, Object> props) {
    failIfAsked();
    effects.add("render " + slot + " " + componentType);
    renderedProps.add(props);
  }

  @Override
  public void persist(final String instanceId, final PersistOperation operation,
      final String entityName, final Object payload) {
    failIfAsked();
    effects.add("persist " + operation + " " + entityName);
    persistedPayloads.add(payload);
  }

  @Override
  public void notify(final String instanceId, final NotificationType type, final String message,
      final Object action) {
    failIfAsked();
    effects.add("notify " + type + " " + message);
  }

  @Override
  public void navigate(final String instanceId, final String path,
      final Map<String, Object> params) {
    failIfAsked();
    effects.add("navigate " + path);
  }

  /**
   * Makes every following call throw.
   */
  public void failWith(final RuntimeException failure) {
    this.failure = failure;
  }

  private void failIfAsked() {
    if (failure != null) {
      throw failure;
    }
  }

  public List<String> getEffects() {
    return effects;
  }

  public List<Map<String, Object>> getRenderedProps() {
    return renderedProps;
  }

  public List<Object> getPersistedPayloads() {
    return persistedPayloads;
  }
}
