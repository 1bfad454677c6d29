package ca.gc.cra.hostbridge.application.wiring;

import java.util.Locale;

/**
 * How a batch of wiring requests reacts to individual failures.
 */
public enum BatchMode {
  /** Every pair is attempted; failures are reported next to successes. */
  BEST_EFFORT,
  /** Nothing is applied unless every pair can be wired. */
  ATOMIC;

  /**
   * Parses a mode name, case-insensitively, accepting {@code best-effort} as well as {@code BEST_EFFORT}.
   *
   * @param raw textual mode
   * @return parsed mode
   * @throws IllegalArgumentException for unknown names
   */
  public static BatchMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("batchMode must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return BatchMode.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("batchMode must be BEST_EFFORT or ATOMIC (was " + raw + ")", ex);
    }
  }
}
