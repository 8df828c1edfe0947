package ca.gc.cra.meshgate.api;

/**
 * <strong>What:</strong> Process exit codes returned by the gateway CLI.
 * <p><strong>Why:</strong> Service managers and scripts branch on the numeric status.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed normally. */
  SUCCESS(0),
  /** Arguments or configuration values were rejected. */
  INVALID_ARGS(2),
  /** A file or socket could not be used (for example the HTTP port is taken). */
  IO_ERROR(3),
  /** Configuration was readable but inconsistent. */
  CONFIG_ERROR(4),
  /** An unexpected failure stopped the command. */
  RUNTIME_FAILURE(5),
  /** The command was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status passed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
