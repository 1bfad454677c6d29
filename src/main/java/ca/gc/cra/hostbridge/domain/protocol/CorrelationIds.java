package ca.gc.cra.hostbridge.domain.protocol;

/** Checks on the optional request correlation id. */
final class CorrelationIds {
  private CorrelationIds() {}

  /**
   * Accepts {@code null}, a string or a number.
   *
   * @param id candidate id
   * @throws IllegalArgumentException for any other type
   */
  static void requireScalar(Object id) {
    if (id != null && !(id instanceof String) && !(id instanceof Number)) {
      throw new IllegalArgumentException("id must be a string or number (was " + id.getClass().getSimpleName() + ")");
    }
  }
}
