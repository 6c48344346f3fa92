package com.github.behaviorengine;

/**
 * This object encapsulates the result of handing one event (or one frame) to a behavior instance,
 * including every follow-up event emitted while processing it.
 *
 * Failures report {@link Outcome#FAULT} and carry the {@link #getError() error}; effects applied
 * before the fault stay applied. A miss is not a failure.
 */
public final class DispatchResult {
  private final Outcome outcome;
  private final String instanceId;
  private final String event;
  private final String fromState;
  private final String toState;
  private final int effectsExecuted;
  private final int eventsProcessed;
  private final BehaviorEngineException error;

  public enum Outcome {
    // a transition (possibly a self-loop) was taken
    TRANSITIONED,
    // no transition matched; nothing changed
    MISS,
    // frame ticks ran
    TICKED,
    // re-entrant call, queued behind the dispatch in progress on this instance
    QUEUED,
    FAULT
  }

  DispatchResult(final Outcome outcome, final String instanceId, final String event,
      final String fromState, final String toState, final int effectsExecuted,
      final int eventsProcessed, final BehaviorEngineException error) {
    this.outcome = outcome;
    this.instanceId = instanceId;
    this.event = event;
    this.fromState = fromState;
    this.toState = toState;
    this.effectsExecuted = effectsExecuted;
    this.eventsProcessed = eventsProcessed;
    this.error = error;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isSuccessful() {
    return outcome != Outcome.FAULT;
  }

  public boolean isTransitioned() {
    return outcome == Outcome.TRANSITIONED;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getEvent() {
    return event;
  }

  /**
   * State before the call.
   */
  public String getFromState() {
    return fromState;
  }

  /**
   * State after the call and all of its follow-up events.
   */
  public String getToState() {
    return toState;
  }

  public int getEffectsExecuted() {
    return effectsExecuted;
  }

  /**
   * Events handled for this call: the event itself plus emitted follow-ups.
   */
  public int getEventsProcessed() {
    return eventsProcessed;
  }

  public BehaviorEngineException getError() {
    return error;
  }

  @Override
  public String toString() {
    return "DispatchResult [outcome=" + outcome + ", instanceId=" + instanceId + ", event="
        + event + ", fromState=" + fromState + ", toState=" + toState + ", effectsExecuted="
        + effectsExecuted + ", eventsProcessed=" + eventsProcessed + ", error=" + error + "]";
  }
}
