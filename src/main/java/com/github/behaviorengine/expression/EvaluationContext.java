package com.github.behaviorengine.expression;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.expression.Expression.Reference;

/**
 * Bindings visible to an expression. The maps handed in are live views owned by the caller, so
 * effects that mutate instance data are observed by expressions evaluated afterwards.
 *
 * A context built without {@link Effects} is pure: guards are always evaluated in one.
 */
public final class EvaluationContext {
  private final Map<String, Object> entity;
  private final Map<String, Object> config;
  private final Object payload;
  private final String state;
  private final long now;
  private final Map<String, Map<String, Object>> namedEntities;
  private final Map<String, Object> locals;
  private final Effects effects;

  private EvaluationContext(final Map<String, Object> entity, final Map<String, Object> config,
      final Object payload, final String state, final long now,
      final Map<String, Map<String, Object>> namedEntities, final Map<String, Object> locals,
      final Effects effects) {
    this.entity = entity;
    this.config = config;
    this.payload = payload;
    this.state = state;
    this.now = now;
    this.namedEntities = namedEntities;
    this.locals = locals;
    this.effects = effects;
  }

  public static EvaluationContextBuilder newBuilder() {
    return new EvaluationContextBuilder();
  }

  /**
   * Same bindings, with the given locals layered over the current ones.
   */
  public EvaluationContext child(final Map<String, Object> newLocals) {
    final Map<String, Object> merged = new HashMap<>(locals);
    merged.putAll(newLocals);
    return new EvaluationContext(entity, config, payload, state, now, namedEntities,
        Collections.unmodifiableMap(merged), effects);
  }

  /**
   * Same bindings with effects withheld.
   */
  public EvaluationContext pure() {
    if (effects == null) {
      return this;
    }
    return new EvaluationContext(entity, config, payload, state, now, namedEntities, locals,
        null);
  }

  public boolean isPure() {
    return effects == null;
  }

  /**
   * Resolves a binding. Locals shadow everything else. Paths that run into a missing key or a
   * non-container resolve to {@link Undefined#INSTANCE}.
   */
  public Object resolve(final Reference reference) {
    final String root = reference.getRoot();
    Object value;
    if (locals.containsKey(root)) {
      value = locals.get(root);
    } else {
      switch (root) {
        case "entity":
          value = entity;
          break;
        case "config":
          value = config;
          break;
        case "payload":
          value = payload;
          break;
        case "state":
          return reference.getPath().isEmpty() ? state : Undefined.INSTANCE;
        case "now":
          return reference.getPath().isEmpty() ? Long.valueOf(now) : Undefined.INSTANCE;
        default:
          value = namedEntities.get(root);
          if (value == null) {
            return Undefined.INSTANCE;
          }
          break;
      }
    }
    return navigate(value, reference.getPath());
  }

  static Object navigate(Object value, final List<String> path) {
    for (final String segment : path) {
      if (value instanceof Map) {
        final Map<?, ?> container = (Map<?, ?>) value;
        if (!container.containsKey(segment)) {
          return Undefined.INSTANCE;
        }
        value = container.get(segment);
      } else if (value instanceof List) {
        final List<?> container = (List<?>) value;
        final int index;
        try {
          index = Integer.parseInt(segment);
        } catch (NumberFormatException notAnIndex) {
          return Undefined.INSTANCE;
        }
        if (index < 0 || index >= container.size()) {
          return Undefined.INSTANCE;
        }
        value = container.get(index);
      } else {
        return Undefined.INSTANCE;
      }
    }
    return value;
  }

  public Map<String, Object> getEntity() {
    return entity;
  }

  public Map<String, Object> getConfig() {
    return config;
  }

  public Object getPayload() {
    return payload;
  }

  public String getState() {
    return state;
  }

  public long getNow() {
    return now;
  }

  /**
   * Bindings introduced by {@code let} and {@code fn}, innermost winning.
   */
  public Map<String, Object> getLocals() {
    return locals;
  }

  public Map<String, Map<String, Object>> getNamedEntities() {
    return namedEntities;
  }

  public Effects getEffects() {
    return effects;
  }

  public final static class EvaluationContextBuilder {
    private Map<String, Object> entity = new HashMap<>();
    private Map<String, Object> config = Collections.emptyMap();
    private Object payload = Collections.emptyMap();
    private String state;
    private long now = System.currentTimeMillis();
    private final Map<String, Map<String, Object>> namedEntities = new HashMap<>();
    private Effects effects;

    public EvaluationContextBuilder entity(final Map<String, Object> entity) {
      this.entity = entity;
      return this;
    }

    public EvaluationContextBuilder namedEntity(final String name,
        final Map<String, Object> record) {
      this.namedEntities.put(name, record);
      return this;
    }

    public EvaluationContextBuilder config(final Map<String, Object> config) {
      this.config = config;
      return this;
    }

    public EvaluationContextBuilder payload(final Object payload) {
      this.payload = payload;
      return this;
    }

    public EvaluationContextBuilder state(final String state) {
      this.state = state;
      return this;
    }

    public EvaluationContextBuilder now(final long now) {
      this.now = now;
      return this;
    }

    public EvaluationContextBuilder effects(final Effects effects) {
      this.effects = effects;
      return this;
    }

    public EvaluationContext build() {
      return new EvaluationContext(entity, config, payload == null ? Undefined.INSTANCE : payload,
          state, now, namedEntities, Collections.<String, Object>emptyMap(), effects);
    }

    private EvaluationContextBuilder() {}
  }

}
