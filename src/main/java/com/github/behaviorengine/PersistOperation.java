package com.github.behaviorengine;

/**
 * Operations a behavior may hand to the host's persistence sink.
 */
public enum PersistOperation {
  CREATE("create"), UPDATE("update"), DELETE("delete"), SAVE("save");

  private final String id;

  private PersistOperation(final String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public static PersistOperation fromId(final String id) {
    for (final PersistOperation operation : values()) {
      if (operation.id.equalsIgnoreCase(id)) {
        return operation;
      }
    }
    return null;
  }
}
