package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.behaviorengine.expression.Expression;

/**
 * A guarded, effectful edge of a behavior's state machine.
 *
 * Notes:<br>
 * 1. the source is a single state, a list of states, or the wildcard {@code *}; no source at all
 * is the wildcard<br>
 * 2. a transition without a target is a self-loop: the state stays, the effects still run<br>
 * 3. several transitions may share (source, event); the first one, in declaration order, whose
 * guard holds is the one taken<br>
 */
public final class Transition {
  public static final String ANY_STATE = "*";

  private final List<String> from;
  private final String to;
  private final String event;
  private final Expression guard;
  private final List<Expression> effects;

  private Transition(final List<String> from, final String to, final String event,
      final Expression guard, final List<Expression> effects) {
    this.from = Collections.unmodifiableList(from);
    this.to = to;
    this.event = event;
    this.guard = guard;
    this.effects = Collections.unmodifiableList(effects);
  }

  public boolean isWildcard() {
    return from.isEmpty() || from.contains(ANY_STATE);
  }

  public boolean matchesFrom(final String state) {
    return isWildcard() || from.contains(state);
  }

  public boolean isSelfLoop() {
    return to == null;
  }

  /**
   * Declared source states. Empty or containing {@code *} for the wildcard.
   */
  public List<String> getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }

  public String getEvent() {
    return event;
  }

  public Expression getGuard() {
    return guard;
  }

  public List<Expression> getEffects() {
    return effects;
  }

  @Override
  public String toString() {
    return "Transition [from=" + (isWildcard() ? ANY_STATE : from) + ", to=" + to + ", event="
        + event + ", guarded=" + (guard != null) + ", effects=" + effects.size() + "]";
  }

  public final static class TransitionBuilder {
    private final List<String> from = new ArrayList<>();
    private String to;
    private String event;
    private Expression guard;
    private final List<Expression> effects = new ArrayList<>();

    public static TransitionBuilder newBuilder() {
      return new TransitionBuilder();
    }

    public TransitionBuilder from(final String... states) {
      this.from.addAll(Arrays.asList(states));
      return this;
    }

    public TransitionBuilder from(final List<String> states) {
      this.from.addAll(states);
      return this;
    }

    public TransitionBuilder to(final String to) {
      this.to = to;
      return this;
    }

    public TransitionBuilder event(final String event) {
      this.event = event;
      return this;
    }

    public TransitionBuilder guard(final Expression guard) {
      this.guard = guard;
      return this;
    }

    public TransitionBuilder effect(final Expression effect) {
      this.effects.add(effect);
      return this;
    }

    public TransitionBuilder effects(final List<Expression> effects) {
      this.effects.addAll(effects);
      return this;
    }

    public Transition build() {
      return new Transition(new ArrayList<>(from), to, event, guard, new ArrayList<>(effects));
    }

    private TransitionBuilder() {}
  }
}
