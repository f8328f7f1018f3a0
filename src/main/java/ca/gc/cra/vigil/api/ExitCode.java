package ca.gc.cra.vigil.api;

/**
 * <strong>What:</strong> Exit codes returned by the {@code vigil} command-line tool.
 * <p><strong>Why:</strong> Lets build scripts fail a deployment when assertion configuration is invalid.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A configuration file could not be read. */
  IO_ERROR(3),
  /** Assertion configuration was malformed. */
  CONFIG_ERROR(4);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
