package ca.gc.cra.hostbridge.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each bridge CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (serve, probe, send)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "serve" -> buildServeDefaults();
      case "probe" -> buildProbeDefaults();
      case "send" -> buildSendDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    BridgeConfig defaults = BridgeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", defaults.host());
    map.put("port", Integer.toString(defaults.port()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    BridgeConfig defaults = BridgeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("invocationTimeoutMillis", Long.toString(defaults.invocationTimeoutMillis()));
    map.put("batchMode", defaults.batchMode().name());
    map.put("sceneName", defaults.sceneName());
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildProbeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("connectTimeoutMillis", Long.toString(BridgeConfig.DEFAULT_CONNECT_TIMEOUT_MILLIS));
    return map;
  }

  private static Map<String, String> buildSendDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("connectTimeoutMillis", Long.toString(BridgeConfig.DEFAULT_CONNECT_TIMEOUT_MILLIS));
    map.put("readTimeoutMillis", Long.toString(BridgeConfig.DEFAULT_READ_TIMEOUT_MILLIS));
    map.put("params", "{}");
    return map;
  }
}
