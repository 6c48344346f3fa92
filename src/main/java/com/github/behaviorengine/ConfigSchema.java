package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException.Code;

/**
 * Required and optional activation parameters of a behavior.
 */
public final class ConfigSchema {
  public static final ConfigSchema EMPTY =
      new ConfigSchema(Collections.<ConfigField>emptyList(), Collections.<ConfigField>emptyList());

  private final List<ConfigField> required;
  private final List<ConfigField> optional;

  public ConfigSchema(final List<ConfigField> required, final List<ConfigField> optional) {
    this.required = required == null ? Collections.<ConfigField>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(required));
    this.optional = optional == null ? Collections.<ConfigField>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(optional));
  }

  public List<ConfigField> getRequired() {
    return required;
  }

  public List<ConfigField> getOptional() {
    return optional;
  }

  /**
   * Validates a host-supplied activation config and returns it with optional defaults applied.
   * Keys the schema does not mention pass through untouched. Every problem is reported at once.
   */
  public Map<String, Object> resolve(final Map<String, Object> supplied)
      throws BehaviorEngineException {
    final Map<String, Object> resolved = new LinkedHashMap<>();
    if (supplied != null) {
      resolved.putAll(supplied);
    }
    final List<String> problems = new ArrayList<>();
    for (final ConfigField field : required) {
      final Object value = resolved.get(field.getName());
      if (value == null) {
        problems.add("Missing required config field: " + field.getName());
      } else {
        check(field, value, problems);
      }
    }
    for (final ConfigField field : optional) {
      final Object value = resolved.get(field.getName());
      if (value == null) {
        if (field.hasDefault()) {
          resolved.put(field.getName(), field.getDefaultValue());
        }
      } else {
        check(field, value, problems);
      }
    }
    if (!problems.isEmpty()) {
      throw new BehaviorEngineException(Code.INVALID_ACTIVATION_CONFIG,
          String.join("; ", problems));
    }
    return Collections.unmodifiableMap(resolved);
  }

  private static void check(final ConfigField field, final Object value,
      final List<String> problems) {
    if (field.getType() != null && !field.getType().accepts(value)) {
      problems.add(String.format("Config field %s must be of type %s (got: %s)", field.getName(),
          field.getType(), value));
      return;
    }
    if (!field.getAllowedValues().isEmpty() && !field.getAllowedValues().contains(value)) {
      problems.add(String.format("Config field %s must be one of %s (got: %s)", field.getName(),
          field.getAllowedValues(), value));
    }
  }

  @Override
  public String toString() {
    return "ConfigSchema [required=" + required + ", optional=" + optional + "]";
  }
}
