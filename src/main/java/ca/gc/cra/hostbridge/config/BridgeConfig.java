package ca.gc.cra.hostbridge.config;

import ca.gc.cra.hostbridge.application.wiring.BatchMode;
import ca.gc.cra.hostbridge.validation.Net;
import ca.gc.cra.hostbridge.validation.Numbers;
import ca.gc.cra.hostbridge.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated runtime settings for the bridge listener, client and host loop.
 * <p><strong>Why:</strong> Centralizes range checks so CLI, YAML and defaults converge on one immutable value.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param host loopback host to bind or dial
 * @param port TCP port; {@code 0} binds an ephemeral port
 * @param invocationTimeoutMillis bounded wait for a marshaled invocation
 * @param connectTimeoutMillis client connect and probe timeout
 * @param readTimeoutMillis client read timeout; {@code 0} waits forever
 * @param batchMode default failure semantics for wiring batches
 * @param sceneName name of the initial active scene
 * @since 0.1.0
 */
public record BridgeConfig(
    String host,
    int port,
    long invocationTimeoutMillis,
    long connectTimeoutMillis,
    long readTimeoutMillis,
    BatchMode batchMode,
    String sceneName) {

  public static final String DEFAULT_HOST = "127.0.0.1";
  public static final int DEFAULT_PORT = 7777;
  public static final long DEFAULT_INVOCATION_TIMEOUT_MILLIS = 10_000L;
  public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 1_000L;
  public static final long DEFAULT_READ_TIMEOUT_MILLIS = 30_000L;
  public static final String DEFAULT_SCENE_NAME = "Main";

  public BridgeConfig {
    host = Net.requireLoopbackHost(host);
    port = Net.requirePort(port, true);
    Numbers.requireRange("invocationTimeoutMillis", invocationTimeoutMillis, 50, 600_000);
    Numbers.requireRange("connectTimeoutMillis", connectTimeoutMillis, 1, 60_000);
    Numbers.requireRange("readTimeoutMillis", readTimeoutMillis, 0, 600_000);
    Objects.requireNonNull(batchMode, "batchMode");
    sceneName = Strings.requireNonBlank("sceneName", sceneName);
  }

  /**
   * Returns the embedded defaults.
   *
   * @return default configuration bound to {@code 127.0.0.1:7777}
   */
  public static BridgeConfig defaults() {
    return new BridgeConfig(
        DEFAULT_HOST,
        DEFAULT_PORT,
        DEFAULT_INVOCATION_TIMEOUT_MILLIS,
        DEFAULT_CONNECT_TIMEOUT_MILLIS,
        DEFAULT_READ_TIMEOUT_MILLIS,
        BatchMode.BEST_EFFORT,
        DEFAULT_SCENE_NAME);
  }

  /**
   * Builds a configuration from a flat key/value map, falling back to {@link #defaults()} for absent keys.
   *
   * <p>{@code timeoutMillis} is accepted as an alias for {@code invocationTimeoutMillis}.</p>
   *
   * @param args merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static BridgeConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    BridgeConfig defaults = defaults();
    String host = valueOr(args.get("host"), defaults.host());
    int port = Numbers.parseIntInRange("port", valueOr(args.get("port"), Integer.toString(defaults.port())), 0, 65535);
    String timeoutRaw = args.get("timeoutMillis");
    if (Strings.isBlank(timeoutRaw)) {
      timeoutRaw = args.get("invocationTimeoutMillis");
    }
    long invocationTimeout = parseMillis(
        "invocationTimeoutMillis", timeoutRaw, defaults.invocationTimeoutMillis());
    long connectTimeout = parseMillis(
        "connectTimeoutMillis", args.get("connectTimeoutMillis"), defaults.connectTimeoutMillis());
    long readTimeout = parseMillis(
        "readTimeoutMillis", args.get("readTimeoutMillis"), defaults.readTimeoutMillis());
    String batchRaw = args.get("batchMode");
    BatchMode batchMode = Strings.isBlank(batchRaw) ? defaults.batchMode() : BatchMode.parse(batchRaw);
    String sceneName = valueOr(args.get("sceneName"), defaults.sceneName());
    return new BridgeConfig(host, port, invocationTimeout, connectTimeout, readTimeout, batchMode, sceneName);
  }

  public Duration invocationTimeout() {
    return Duration.ofMillis(invocationTimeoutMillis);
  }

  public Duration connectTimeout() {
    return Duration.ofMillis(connectTimeoutMillis);
  }

  public Duration readTimeout() {
    return Duration.ofMillis(readTimeoutMillis);
  }

  private static String valueOr(String raw, String fallback) {
    return Strings.isBlank(raw) ? fallback : raw.trim();
  }

  private static long parseMillis(String name, String raw, long fallback) {
    if (Strings.isBlank(raw)) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + raw.trim() + ")", ex);
    }
  }
}
