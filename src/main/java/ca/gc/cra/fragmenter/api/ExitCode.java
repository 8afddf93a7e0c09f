package ca.gc.cra.fragmenter.api;

/**
 * <strong>What:</strong> Canonical exit codes returned by the fragmenter command line.
 * <p><strong>Why:</strong> Lets scripts tell bad arguments apart from I/O failures and interruptions.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** Reading input or writing output failed. */
  IO_ERROR(3),
  /** Configuration was rejected while the pipeline was being assembled. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
