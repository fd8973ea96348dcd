package io.pandaproxy.api;

/**
 * <strong>What:</strong> Process exit codes returned by the proxy CLI.
 * <p><strong>Why:</strong> Container supervisors and scripts can tell a bad configuration from an
 * unreachable printer without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure, such as a listener port already in use. */
  IO_ERROR(3),
  /** Configuration was missing or malformed, including an unusable keystore. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, or a camera protocol this build cannot serve. */
  RUNTIME_FAILURE(5),
  /** Neither camera port answered during detection. */
  DETECTION_FAILED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric exit code */
  public int code() {
    return code;
  }
}
