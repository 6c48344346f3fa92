package com.github.behaviorengine;

/**
 * A declared event. The key is what transitions and dispatch refer to; name and description are
 * for humans.
 */
public final class Event {
  private final String key;
  private final String name;
  private final String description;

  public Event(final String key, final String name, final String description) {
    this.key = key;
    this.name = name;
    this.description = description;
  }

  public Event(final String key) {
    this(key, null, null);
  }

  public String getKey() {
    return key;
  }

  public String getName() {
    return name == null ? key : name;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return "Event [key=" + key + "]";
  }
}
