package com.github.behaviorengine;

/**
 * Handle to a scheduled timer.
 */
public interface Cancellable {

  /**
   * Returns true if this call cancelled the task, false if it already ran (one-shot) or was
   * cancelled before.
   */
  boolean cancel();
}
