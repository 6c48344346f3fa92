package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.behaviorengine.expression.Expression;

/**
 * A rule re-evaluated outside event dispatch: every frame, or on a fixed millisecond interval.
 * Higher priority ticks run first within a frame.
 */
public final class Tick {
  public static final long FRAME = 0L;

  private final String name;
  private final String description;
  private final long intervalMillis;
  private final int priority;
  private final List<String> appliesTo;
  private final Expression guard;
  private final List<Expression> effects;

  public Tick(final String name, final String description, final long intervalMillis,
      final int priority, final List<String> appliesTo, final Expression guard,
      final List<Expression> effects) {
    this.name = name;
    this.description = description;
    this.intervalMillis = intervalMillis;
    this.priority = priority;
    this.appliesTo = appliesTo == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(appliesTo));
    this.guard = guard;
    this.effects = effects == null ? Collections.<Expression>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(effects));
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isFrameTick() {
    return intervalMillis == FRAME;
  }

  /**
   * {@link #FRAME} for per-frame ticks.
   */
  public long getIntervalMillis() {
    return intervalMillis;
  }

  public int getPriority() {
    return priority;
  }

  public List<String> getAppliesTo() {
    return appliesTo;
  }

  public Expression getGuard() {
    return guard;
  }

  public List<Expression> getEffects() {
    return effects;
  }

  @Override
  public String toString() {
    return "Tick [name=" + name + ", interval=" + (isFrameTick() ? "frame" : intervalMillis + "ms")
        + ", priority=" + priority + "]";
  }
}
