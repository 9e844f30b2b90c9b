package com.github.processfsm;

/**
 * Unified single exception that's thrown by the engine's public API when it is misused. Failures of
 * the processes themselves are never thrown, they are reported as {@link ProcessFault}s in the
 * {@link RunReport}. The code enum encapsulates the various error conditions.
 */
public final class EngineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public EngineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public EngineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public EngineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    ENGINE_NOT_ALIVE("Engine is not running and cannot service requests"),
    // 2.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 3.
    INVALID_ENGINE_CONFIG("Engine configuration is invalid"),
    // 4.
    INVALID_TERM("Process term is null or not well formed"),
    // 5.
    NOTHING_LOADED("No top-level process has been loaded into the engine"),
    // 6.
    ALREADY_LOADED("A top-level process has already been loaded into the engine"),
    // 7.
    ILLEGAL_INSTANCE_ID("Engine failed to lookup instance with provided id"),
    // 8.
    MALFORMED_EVENT("Externally injected event is malformed and was rejected"),
    // 9.
    UNKNOWN_FAILURE("Engine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
