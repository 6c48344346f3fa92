package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.behaviorengine.BehaviorEngineImpl.Instance;

/**
 * Holder of statistics for a behavior engine and all its live instances.
 */
public final class EngineStatistics {
  private final String engineId;
  private final BehaviorEngineImpl engine;
  private final long startTstampMillis;
  int totalActivated;
  int totalDestroyed;
  int totalPurged;

  EngineStatistics(final String engineId, final BehaviorEngineImpl engine,
      final long startTstampMillis) {
    this.engineId = engineId;
    this.engine = engine;
    this.startTstampMillis = startTstampMillis;
  }

  public String getEngineId() {
    return engineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getTotalActivated() {
    return totalActivated;
  }

  public int getTotalDestroyed() {
    return totalDestroyed;
  }

  public int getTotalPurged() {
    return totalPurged;
  }

  /**
   * Report stats for all live instances of the engine.
   */
  public List<InstanceStatistics> getActiveInstanceStats() {
    final List<InstanceStatistics> activeStats = new ArrayList<>();
    for (final Instance instance : engine.allInstancesTable.values()) {
      activeStats.add(instance.stats);
    }
    return Collections.unmodifiableList(activeStats);
  }

  @Override
  public String toString() {
    return "EngineStatistics [engineId=" + engineId + ", startTstampMillis=" + startTstampMillis
        + ", totalActivated=" + totalActivated + ", totalDestroyed=" + totalDestroyed
        + ", totalPurged=" + totalPurged + ", activeInstances="
        + engine.allInstancesTable.size() + "]";
  }

}
