package com.github.behaviorengine;

public enum NotificationType {
  SUCCESS("success"), ERROR("error"), INFO("info"), WARNING("warning");

  private final String id;

  private NotificationType(final String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public static NotificationType fromId(final String id) {
    for (final NotificationType type : values()) {
      if (type.id.equalsIgnoreCase(id)) {
        return type;
      }
    }
    return null;
  }
}
