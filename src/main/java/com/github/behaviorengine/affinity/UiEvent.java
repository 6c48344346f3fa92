package com.github.behaviorengine.affinity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A conventional UI event: which components emit it and the payload shape renderers send.
 */
public final class UiEvent {
  private final String event;
  private final List<String> emittedBy;
  private final Map<String, String> payload;
  private final String description;

  public UiEvent(final String event, final List<String> emittedBy,
      final Map<String, String> payload, final String description) {
    this.event = event;
    this.emittedBy = Collections.unmodifiableList(new ArrayList<>(emittedBy));
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    this.description = description;
  }

  public String getEvent() {
    return event;
  }

  public List<String> getEmittedBy() {
    return emittedBy;
  }

  /**
   * Payload field name to type tag.
   */
  public Map<String, String> getPayload() {
    return payload;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return "UiEvent [event=" + event + ", emittedBy=" + emittedBy + "]";
  }
}
