package com.github.behaviorengine;

/**
 * Immutable metadata about a declared state. States are identified by name within their machine.
 */
public final class State {
  private final String name;
  private final boolean initial;
  private final boolean terminal;
  private final String description;

  public State(final String name, final boolean initial, final boolean terminal,
      final String description) {
    this.name = name == null ? null : name.trim();
    this.initial = initial;
    this.terminal = terminal;
    this.description = description;
  }

  public State(final String name) {
    this(name, false, false, null);
  }

  public String getName() {
    return name;
  }

  public boolean isInitial() {
    return initial;
  }

  /**
   * Final states are informational; dispatch does not treat them specially.
   */
  public boolean isFinal() {
    return terminal;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (name == null) {
      if (other.name != null) {
        return false;
      }
    } else if (!name.equals(other.name)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", initial=" + initial + ", final=" + terminal + "]";
  }
}
