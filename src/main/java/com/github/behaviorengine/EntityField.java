package com.github.behaviorengine;

/**
 * A field of a data entity. The type is a free-form tag (string, number, array, ...) carried for
 * documentation and renderers.
 */
public final class EntityField {
  private final String name;
  private final String type;
  private final Object defaultValue;
  private final boolean required;
  private final String description;

  public EntityField(final String name, final String type, final Object defaultValue,
      final boolean required, final String description) {
    this.name = name;
    this.type = type;
    this.defaultValue = defaultValue;
    this.required = required;
    this.description = description;
  }

  public EntityField(final String name, final String type, final Object defaultValue) {
    this(name, type, defaultValue, false, null);
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }

  public boolean isRequired() {
    return required;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return "EntityField [name=" + name + ", type=" + type + ", default=" + defaultValue + "]";
  }
}
