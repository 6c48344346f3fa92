package com.github.behaviorengine;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link Scheduler} backed by a {@link ScheduledExecutorService}. The executor's lifecycle stays
 * with whoever created it.
 */
public final class ScheduledExecutorScheduler implements Scheduler {
  private final ScheduledExecutorService executor;

  public ScheduledExecutorScheduler(final ScheduledExecutorService executor) {
    if (executor == null) {
      throw new NullPointerException("executor");
    }
    this.executor = executor;
  }

  @Override
  public Cancellable schedule(final long delayMillis, final Runnable task) {
    return new FutureCancellable(
        executor.schedule(task, Math.max(0L, delayMillis), TimeUnit.MILLISECONDS));
  }

  @Override
  public Cancellable scheduleAtFixedRate(final long initialDelayMillis, final long periodMillis,
      final Runnable task) {
    return new FutureCancellable(executor.scheduleAtFixedRate(task,
        Math.max(0L, initialDelayMillis), periodMillis, TimeUnit.MILLISECONDS));
  }

  private static final class FutureCancellable implements Cancellable {
    private final ScheduledFuture<?> future;

    private FutureCancellable(final ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public boolean cancel() {
      // a task already running is left to finish
      return future.cancel(false);
    }
  }
}
