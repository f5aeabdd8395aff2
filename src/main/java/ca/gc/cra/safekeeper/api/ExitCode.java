package ca.gc.cra.safekeeper.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the SafeKeeper command-line tools.
 * <p><strong>Why:</strong> Scripts driving the ledger need to tell a rejected operation apart from bad input or a
 * broken state file.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The state or configuration file could not be read or written. */
  IO_ERROR(3),
  /** Configuration or saved state was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The ledger rejected the operation; nothing was saved. */
  LEDGER_REJECTED(6),
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
