package ca.gc.cra.hostbridge.application.wiring;

import java.util.List;

/**
 * Per-pair partition of a wiring batch.
 *
 * @param success {@code true} when no pair failed
 * @param mode batch mode used
 * @param wired pairs connected (or deferred to runtime event subscription)
 * @param failed pairs that could not be connected, with reasons
 * @param skipped pairs not applied because an atomic batch was aborted
 * @param message summary such as {@code "Wired 2 connections, 1 failed"}
 */
public record WiringReport(
    boolean success,
    BatchMode mode,
    List<Wired> wired,
    List<Failed> failed,
    List<String> skipped,
    String message) {

  public WiringReport {
    wired = List.copyOf(wired);
    failed = List.copyOf(failed);
    skipped = List.copyOf(skipped);
  }

  /**
   * A connected pair.
   *
   * @param pair {@code "Source -> Target"}
   * @param field target field assigned, or the source event for deferred pairs
   * @param via matcher name, or {@code event}
   */
  public record Wired(String pair, String field, String via) {}

  /**
   * A pair that could not be connected.
   *
   * @param pair {@code "Source -> Target"}
   * @param reason why it failed
   */
  public record Failed(String pair, String reason) {}

  /** Returns just the {@code "Source -> Target"} labels of wired pairs. */
  public List<String> wiredPairs() {
    return wired.stream().map(Wired::pair).toList();
  }

  /** Returns just the {@code "Source -> Target"} labels of failed pairs. */
  public List<String> failedPairs() {
    return failed.stream().map(Failed::pair).toList();
  }
}
