package com.github.behaviorengine;

import java.util.List;
import java.util.Map;

/**
 * Type tags for config-schema fields and data-entity fields.
 */
public enum FieldType {
  STRING("string"), NUMBER("number"), BOOLEAN("boolean"), ARRAY("array"), OBJECT("object"),
  ENTITY("entity"), SLOT("slot"), PATTERN("pattern"), EVENT("event"), ACTIONS("action[]");

  private final String id;

  private FieldType(final String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public static FieldType fromId(final String id) {
    for (final FieldType type : values()) {
      if (type.id.equals(id)) {
        return type;
      }
    }
    return null;
  }

  /**
   * Whether a plain value conforms to this tag. Null never conforms; callers decide separately
   * whether a field may be absent. Entity, slot and event references are names.
   */
  public boolean accepts(final Object value) {
    if (value == null) {
      return false;
    }
    switch (this) {
      case STRING:
      case ENTITY:
      case SLOT:
      case EVENT:
        return value instanceof String;
      case NUMBER:
        return value instanceof Number;
      case BOOLEAN:
        return value instanceof Boolean;
      case ARRAY:
      case ACTIONS:
        return value instanceof List;
      case OBJECT:
        return value instanceof Map;
      case PATTERN:
        return value instanceof String || value instanceof Map;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return id;
  }
}
