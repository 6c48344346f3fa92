package com.github.behaviorengine.expression;

/**
 * Sentinel returned when a context reference does not resolve to anything. Distinct from a field
 * that is present but holds null.
 */
public enum Undefined {
  INSTANCE;

  @Override
  public String toString() {
    return "undefined";
  }
}
