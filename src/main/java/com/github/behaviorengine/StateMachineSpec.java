package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declared states, events and transitions of a behavior, plus its initial state. Immutable; the
 * validators, not this class, decide whether it is well-formed.
 */
public final class StateMachineSpec {
  private final String initial;
  private final List<State> states;
  private final List<Event> events;
  private final List<Transition> transitions;

  private StateMachineSpec(final String initial, final List<State> states,
      final List<Event> events, final List<Transition> transitions) {
    this.initial = initial;
    this.states = Collections.unmodifiableList(states);
    this.events = Collections.unmodifiableList(events);
    this.transitions = Collections.unmodifiableList(transitions);
  }

  public String getInitial() {
    return initial;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Event> getEvents() {
    return events;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public Set<String> getStateNames() {
    final Set<String> names = new LinkedHashSet<>();
    for (final State state : states) {
      names.add(state.getName());
    }
    return names;
  }

  public Set<String> getEventKeys() {
    final Set<String> keys = new LinkedHashSet<>();
    for (final Event event : events) {
      keys.add(event.getKey());
    }
    return keys;
  }

  public boolean hasState(final String name) {
    return getStateNames().contains(name);
  }

  public boolean hasEvent(final String key) {
    return getEventKeys().contains(key);
  }

  @Override
  public String toString() {
    return "StateMachineSpec [initial=" + initial + ", states=" + getStateNames() + ", events="
        + getEventKeys() + ", transitions=" + transitions.size() + "]";
  }

  public final static class StateMachineSpecBuilder {
    private String initial;
    private final List<State> states = new ArrayList<>();
    private final List<Event> events = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();

    public static StateMachineSpecBuilder newBuilder() {
      return new StateMachineSpecBuilder();
    }

    public StateMachineSpecBuilder initial(final String initial) {
      this.initial = initial;
      return this;
    }

    public StateMachineSpecBuilder state(final State state) {
      this.states.add(state);
      if (initial == null && state.isInitial()) {
        initial = state.getName();
      }
      return this;
    }

    public StateMachineSpecBuilder states(final String... names) {
      for (final String name : names) {
        state(new State(name));
      }
      return this;
    }

    public StateMachineSpecBuilder event(final Event event) {
      this.events.add(event);
      return this;
    }

    public StateMachineSpecBuilder events(final String... keys) {
      for (final String key : keys) {
        this.events.add(new Event(key));
      }
      return this;
    }

    public StateMachineSpecBuilder transition(final Transition transition) {
      this.transitions.add(transition);
      return this;
    }

    public StateMachineSpec build() {
      return new StateMachineSpec(initial, new ArrayList<>(states), new ArrayList<>(events),
          new ArrayList<>(transitions));
    }

    private StateMachineSpecBuilder() {}
  }
}
