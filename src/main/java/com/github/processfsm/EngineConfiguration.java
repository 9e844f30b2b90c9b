package com.github.processfsm;

/**
 * This class encapsulates all the configuration parameters for the {@link ProcessEngine}. Use the
 * {@code EngineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. maxSteps bounds a single {@link ProcessEngine#run()}; when it is reached every live instance is
 * timed out and the run reports STEP_LIMIT_EXCEEDED.<br>
 * 2. maxRouteLength bounds the state route kept per instance.<br>
 * 3. lockAcquisitionMillis is how long a public call waits for the engine lock before failing with
 * a retryable OPERATION_LOCK_ACQUISITION_FAILURE.<br>
 */
public final class EngineConfiguration {
  static final long DEFAULT_MAX_STEPS = 1_000_000L;
  static final int DEFAULT_MAX_ROUTE_LENGTH = 100;
  static final long DEFAULT_LOCK_ACQUISITION_MILLIS = 100L;

  private final long maxSteps;
  private final int maxRouteLength;
  private final long lockAcquisitionMillis;
  private final boolean recordMatches;

  public long getMaxSteps() {
    return maxSteps;
  }

  public int getMaxRouteLength() {
    return maxRouteLength;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public boolean getRecordMatches() {
    return recordMatches;
  }

  public final static class EngineConfigurationBuilder {
    private long maxSteps = DEFAULT_MAX_STEPS;
    private int maxRouteLength = DEFAULT_MAX_ROUTE_LENGTH;
    private long lockAcquisitionMillis = DEFAULT_LOCK_ACQUISITION_MILLIS;
    private boolean recordMatches = true;

    public static EngineConfigurationBuilder newBuilder() {
      return new EngineConfigurationBuilder();
    }

    public EngineConfigurationBuilder maxSteps(final long maxSteps) {
      this.maxSteps = maxSteps;
      return this;
    }

    public EngineConfigurationBuilder maxRouteLength(final int maxRouteLength) {
      this.maxRouteLength = maxRouteLength;
      return this;
    }

    public EngineConfigurationBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public EngineConfigurationBuilder recordMatches(final boolean recordMatches) {
      this.recordMatches = recordMatches;
      return this;
    }

    public EngineConfiguration build() throws EngineException {
      final EngineConfiguration config = new EngineConfiguration(maxSteps, maxRouteLength,
          lockAcquisitionMillis, recordMatches);
      config.validate();
      return config;
    }

    private EngineConfigurationBuilder() {}
  }

  private void validate() throws EngineException {
    StringBuilder messages = new StringBuilder();
    if (maxSteps <= 0L) {
      messages.append("maxSteps must be positive. ");
    }
    if (maxRouteLength <= 0) {
      messages.append("maxRouteLength must be positive. ");
    }
    if (lockAcquisitionMillis < 0L) {
      messages.append("lockAcquisitionMillis cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new EngineException(EngineException.Code.INVALID_ENGINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "EngineConfiguration [maxSteps=" + maxSteps + ", maxRouteLength=" + maxRouteLength
        + ", lockAcquisitionMillis=" + lockAcquisitionMillis + ", recordMatches=" + recordMatches
        + "]";
  }

  private EngineConfiguration(final long maxSteps, final int maxRouteLength,
      final long lockAcquisitionMillis, final boolean recordMatches) {
    this.maxSteps = maxSteps;
    this.maxRouteLength = maxRouteLength;
    this.lockAcquisitionMillis = lockAcquisitionMillis;
    this.recordMatches = recordMatches;
  }

}
