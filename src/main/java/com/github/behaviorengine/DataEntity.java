package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record shape a behavior keeps at runtime. Singleton entities are shared by every live instance
 * of the behavior within one engine; all others belong to a single instance.
 */
public final class DataEntity {
  private final String name;
  private final boolean singleton;
  private final boolean runtime;
  private final List<EntityField> fields;
  private final String description;

  public DataEntity(final String name, final boolean singleton, final boolean runtime,
      final List<EntityField> fields, final String description) {
    this.name = name;
    this.singleton = singleton;
    this.runtime = runtime;
    this.fields = fields == null ? Collections.<EntityField>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(fields));
    this.description = description;
  }

  public String getName() {
    return name;
  }

  public boolean isSingleton() {
    return singleton;
  }

  /**
   * Runtime entities exist only in memory and are never handed to persistence.
   */
  public boolean isRuntime() {
    return runtime;
  }

  public List<EntityField> getFields() {
    return fields;
  }

  public String getDescription() {
    return description;
  }

  /**
   * A fresh mutable record holding every field's default. Defaults that are lists or maps are
   * copied so records never share them.
   */
  public Map<String, Object> newRecord() {
    final Map<String, Object> record = new LinkedHashMap<>();
    for (final EntityField field : fields) {
      record.put(field.getName(), copyOf(field.getDefaultValue()));
    }
    return record;
  }

  static Object copyOf(final Object value) {
    if (value instanceof Map) {
      return copyOfRecord((Map<?, ?>) value);
    }
    if (value instanceof List) {
      final List<Object> copy = new ArrayList<>();
      for (final Object item : (List<?>) value) {
        copy.add(copyOf(item));
      }
      return copy;
    }
    return value;
  }

  /**
   * Deep copy of a record, keys as text.
   */
  static Map<String, Object> copyOfRecord(final Map<?, ?> record) {
    final Map<String, Object> copy = new LinkedHashMap<>();
    for (final Map.Entry<?, ?> entry : record.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), copyOf(entry.getValue()));
    }
    return copy;
  }

  @Override
  public String toString() {
    return "DataEntity [name=" + name + ", singleton=" + singleton + ", runtime=" + runtime
        + ", fields=" + fields.size() + "]";
  }
}
