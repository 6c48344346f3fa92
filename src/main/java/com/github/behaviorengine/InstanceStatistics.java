package com.github.behaviorengine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Simple statistics holder for a behavior instance.
 */
public final class InstanceStatistics {
  static final int maxRouteLength = 100;

  private final long startMillis;
  private final String instanceId;
  private final String behaviorName;
  int transitions;
  int misses;
  int faults;
  int ticks;
  // used to track activity level of an instance
  volatile long lastTouchTimeMillis;
  final Deque<StateTimePair> boundedStateRoute = new ArrayDeque<>();

  InstanceStatistics(final String instanceId, final String behaviorName, final long startMillis) {
    this.instanceId = instanceId;
    this.behaviorName = behaviorName;
    this.startMillis = startMillis;
    this.lastTouchTimeMillis = startMillis;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getBehaviorName() {
    return behaviorName;
  }

  public int getTransitions() {
    return transitions;
  }

  public int getMisses() {
    return misses;
  }

  public int getFaults() {
    return faults;
  }

  public int getTicks() {
    return ticks;
  }

  public long getStartMillis() {
    return startMillis;
  }

  public long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  /**
   * Records entry into a state, closing the previous entry. Oldest entries fall off past the
   * bound.
   */
  void enter(final String state, final long nowMillis) {
    final StateTimePair previous = boundedStateRoute.peekLast();
    if (previous != null) {
      previous.elapsedMillis = nowMillis - previous.startMillis;
    }
    final StateTimePair pair = new StateTimePair();
    pair.state = state;
    pair.startMillis = nowMillis;
    boundedStateRoute.addLast(pair);
    while (boundedStateRoute.size() > maxRouteLength) {
      boundedStateRoute.pollFirst();
    }
  }

  @Override
  public String toString() {
    return "InstanceStatistics [instanceId=" + instanceId + ", behaviorName=" + behaviorName
        + ", transitions=" + transitions + ", misses=" + misses + ", faults=" + faults
        + ", ticks=" + ticks + ", lastTouchTimeMillis=" + lastTouchTimeMillis + "]";
  }

  public final static class StateTimePair {
    public String state;
    public long startMillis;
    public long elapsedMillis;

    @Override
    public String toString() {
      return "StateTimePair [state=" + state + ", elapsedMillis=" + elapsedMillis + "]";
    }
  }

}
