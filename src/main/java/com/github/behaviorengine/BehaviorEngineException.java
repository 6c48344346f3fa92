package com.github.behaviorengine;

/**
 * Unified single exception that's thrown and handled by the behavior engine. The code enum
 * encapsulates the various error conditions, from catalog validation through expression evaluation
 * to runtime dispatch. Stack traces, where available, are not meant to be kept from users.
 */
public final class BehaviorEngineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public BehaviorEngineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public BehaviorEngineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public BehaviorEngineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public BehaviorEngineException(final Code code, final String message,
      final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    ENGINE_NOT_ALIVE("Behavior engine is not running and cannot service requests"),
    // 2.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire lock to perform requested operation. This is retryable."),
    // 3.
    UNKNOWN_BEHAVIOR("Behavior is not registered"),
    // 4.
    ILLEGAL_INSTANCE_ID("Behavior engine failed to lookup instance with provided id"),
    // 5.
    INVALID_ACTIVATION_CONFIG("Activation config does not satisfy the behavior's config schema"),
    // 6.
    INVALID_ENGINE_CONFIG("Behavior engine configuration is invalid"),
    // 7.
    CATALOG_PARSE_FAILURE("Failed to parse behavior catalog document"),
    // 8.
    MALFORMED_EXPRESSION("Expression cannot be parsed"),
    // 9.
    UNKNOWN_OPERATOR("Expression references an operator that is not registered"),
    // 10.
    ARITY_MISMATCH("Operator invoked with an unsupported number of arguments"),
    // 11.
    IMPURE_EXPRESSION("Effect operator used where only pure operators are allowed"),
    // 12.
    INVALID_EFFECT("Effect arguments are invalid"),
    // 13.
    SINK_FAILURE("Host effect sink failed to apply an effect"),
    // 14.
    CASCADE_LIMIT("Emitted event cascade exceeded the configured maximum depth"),
    // 15.
    INTERRUPTED("Behavior engine was interrupted"),
    // 16.
    UNKNOWN_FAILURE(
        "Behavior engine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
