package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattened summary of a behavior for listings, docs and authoring tools.
 */
public final class BehaviorMetadata {
  private final String name;
  private final BehaviorCategory category;
  private final String description;
  private final List<String> suggestedFor;
  private final List<String> states;
  private final List<String> events;
  private final int tickCount;
  private final int transitionCount;
  private final boolean hasDataEntities;

  private BehaviorMetadata(final BehaviorDefinition definition) {
    this.name = definition.getName();
    this.category = definition.getCategory();
    this.description = definition.getDescription();
    this.suggestedFor = definition.getSuggestedFor();
    final StateMachineSpec machine = definition.getStateMachine();
    this.states = machine == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(machine.getStateNames()));
    this.events = machine == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(machine.getEventKeys()));
    this.tickCount = definition.getTicks().size();
    this.transitionCount = machine == null ? 0 : machine.getTransitions().size();
    this.hasDataEntities = !definition.getDataEntities().isEmpty();
  }

  public static BehaviorMetadata of(final BehaviorDefinition definition) {
    return new BehaviorMetadata(definition);
  }

  public String getName() {
    return name;
  }

  public BehaviorCategory getCategory() {
    return category;
  }

  public String getDescription() {
    return description;
  }

  public List<String> getSuggestedFor() {
    return suggestedFor;
  }

  public List<String> getStates() {
    return states;
  }

  public List<String> getEvents() {
    return events;
  }

  public int getTickCount() {
    return tickCount;
  }

  public int getTransitionCount() {
    return transitionCount;
  }

  public boolean hasDataEntities() {
    return hasDataEntities;
  }

  @Override
  public String toString() {
    return "BehaviorMetadata [name=" + name + ", category=" + category + ", states=" + states
        + ", events=" + events + ", tickCount=" + tickCount + ", transitionCount="
        + transitionCount + ", hasDataEntities=" + hasDataEntities + "]";
  }
}
