package ca.gc.cra.rpx.api;

/**
 * Process exit codes returned by the RPX command-line entry points.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The listener could not bind or the config file could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** The streaming worker or another component failed at runtime. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
