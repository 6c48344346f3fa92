package com.github.behaviorengine;

import com.github.behaviorengine.expression.Expression;

/**
 * Reaction to a host-broadcast event: when {@code event} is broadcast and the guard holds, the
 * instance receives {@code triggers}.
 */
public final class Listener {
  private final String event;
  private final String triggers;
  private final Expression guard;

  public Listener(final String event, final String triggers, final Expression guard) {
    this.event = event;
    this.triggers = triggers;
    this.guard = guard;
  }

  public String getEvent() {
    return event;
  }

  public String getTriggers() {
    return triggers;
  }

  public Expression getGuard() {
    return guard;
  }

  @Override
  public String toString() {
    return "Listener [event=" + event + ", triggers=" + triggers + "]";
  }
}
