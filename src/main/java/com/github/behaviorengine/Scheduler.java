package com.github.behaviorengine;

/**
 * Timer facility the engine uses for {@code async/delay}, {@code async/interval} and
 * fixed-interval ticks. The host owns the timer loop; tasks handed in here funnel back into the
 * engine's serialized per-instance path.
 *
 * Implementations must tolerate tasks being cancelled from any thread.
 */
public interface Scheduler {

  /**
   * Run the task once after delayMillis.
   */
  Cancellable schedule(final long delayMillis, final Runnable task);

  /**
   * Run the task every periodMillis, first after initialDelayMillis.
   */
  Cancellable scheduleAtFixedRate(final long initialDelayMillis, final long periodMillis,
      final Runnable task);
}
