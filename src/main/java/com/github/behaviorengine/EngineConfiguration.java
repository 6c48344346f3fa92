package com.github.behaviorengine;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * This class encapsulates all the configuration parameters for the BehaviorEngine. Use the
 * {@code EngineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. instances not destroyed by their host are purged once idle for longer than
 * instanceExpirationMillis; a value of 0 or less means the default of 10 minutes<br>
 * 2. maxCascadeDepth bounds the number of events processed for one host call, emitted follow-ups
 * included<br>
 * 3. the clock drives {@code @now} and idle tracking<br>
 */
public final class EngineConfiguration {
  private final long lockAcquisitionMillis;
  private final long instanceExpirationMillis;
  private final long purgerSleepMillis;
  private final int maxCascadeDepth;
  private final Clock clock;

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public long getInstanceExpirationMillis() {
    return instanceExpirationMillis;
  }

  public long getPurgerSleepMillis() {
    return purgerSleepMillis;
  }

  public int getMaxCascadeDepth() {
    return maxCascadeDepth;
  }

  public Clock getClock() {
    return clock;
  }

  public final static class EngineConfigurationBuilder {
    private long lockAcquisitionMillis = 100L;
    private long instanceExpirationMillis;
    private long purgerSleepMillis = 180 * 1000L;
    private int maxCascadeDepth = 1000;
    private Clock clock = Clock.systemUTC();

    public static EngineConfigurationBuilder newBuilder() {
      return new EngineConfigurationBuilder();
    }

    public EngineConfigurationBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public EngineConfigurationBuilder instanceExpirationMillis(
        final long instanceExpirationMillis) {
      this.instanceExpirationMillis = instanceExpirationMillis;
      return this;
    }

    public EngineConfigurationBuilder purgerSleepMillis(final long purgerSleepMillis) {
      this.purgerSleepMillis = purgerSleepMillis;
      return this;
    }

    public EngineConfigurationBuilder maxCascadeDepth(final int maxCascadeDepth) {
      this.maxCascadeDepth = maxCascadeDepth;
      return this;
    }

    public EngineConfigurationBuilder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public EngineConfiguration build() throws BehaviorEngineException {
      final EngineConfiguration config = new EngineConfiguration(lockAcquisitionMillis,
          instanceExpirationMillis, purgerSleepMillis, maxCascadeDepth, clock);
      config.validate();
      return config;
    }

    private EngineConfigurationBuilder() {}
  }

  private void validate() throws BehaviorEngineException {
    final StringBuilder messages = new StringBuilder();
    if (lockAcquisitionMillis <= 0L) {
      messages.append("lockAcquisitionMillis must be positive. ");
    }
    if (purgerSleepMillis <= 0L) {
      messages.append("purgerSleepMillis must be positive. ");
    }
    if (maxCascadeDepth <= 0) {
      messages.append("maxCascadeDepth must be positive. ");
    }
    if (clock == null) {
      messages.append("Clock cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new BehaviorEngineException(BehaviorEngineException.Code.INVALID_ENGINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "EngineConfiguration [lockAcquisitionMillis=" + lockAcquisitionMillis
        + ", instanceExpirationMillis=" + instanceExpirationMillis + ", purgerSleepMillis="
        + purgerSleepMillis + ", maxCascadeDepth=" + maxCascadeDepth + ", clock=" + clock + "]";
  }

  private EngineConfiguration(final long lockAcquisitionMillis,
      final long instanceExpirationMillis, final long purgerSleepMillis,
      final int maxCascadeDepth, final Clock clock) {
    this.lockAcquisitionMillis = lockAcquisitionMillis;
    this.purgerSleepMillis = purgerSleepMillis;
    this.maxCascadeDepth = maxCascadeDepth;
    this.clock = clock;
    if (instanceExpirationMillis <= 0L) {
      this.instanceExpirationMillis = TimeUnit.MINUTES.toMillis(10L);
    } else {
      this.instanceExpirationMillis = instanceExpirationMillis;
    }
  }

}
