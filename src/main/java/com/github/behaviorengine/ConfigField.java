package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One activation-config parameter of a behavior.
 */
public final class ConfigField {
  private final String name;
  private final FieldType type;
  private final String description;
  private final Object defaultValue;
  private final List<String> allowedValues;

  public ConfigField(final String name, final FieldType type, final String description,
      final Object defaultValue, final List<String> allowedValues) {
    this.name = name;
    this.type = type;
    this.description = description == null ? "" : description;
    this.defaultValue = defaultValue;
    this.allowedValues = allowedValues == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(allowedValues));
  }

  public ConfigField(final String name, final FieldType type, final String description) {
    this(name, type, description, null, null);
  }

  public String getName() {
    return name;
  }

  public FieldType getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  /**
   * Empty when the field is not an enum.
   */
  public List<String> getAllowedValues() {
    return allowedValues;
  }

  @Override
  public String toString() {
    return "ConfigField [name=" + name + ", type=" + type + ", default=" + defaultValue
        + ", enum=" + allowedValues + "]";
  }
}
