package ca.gc.cra.hostbridge.config;

import ca.gc.cra.hostbridge.application.wiring.BatchMode;
import ca.gc.cra.hostbridge.validation.Net;
import ca.gc.cra.hostbridge.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final Set<String> EXPORTERS = Set.of("otlp", "none");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // timeoutMillis on the command line replaces whatever invocationTimeoutMillis YAML supplied
    if (cliCopy.containsKey("timeoutMillis") && !cliCopy.containsKey("invocationTimeoutMillis")) {
      merged.remove("invocationTimeoutMillis");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String host = trim(effective.get("host"));
    if (!host.isEmpty()) {
      Net.requireLoopbackHost(host);
    }
    String port = trim(effective.get("port"));
    if (!port.isEmpty()) {
      // probe and send dial a listener, so the ephemeral port is meaningless there
      int min = "serve".equalsIgnoreCase(mode) ? 0 : 1;
      Numbers.parseIntInRange("port", port, min, 65535);
    }
    String batchMode = trim(effective.get("batchMode"));
    if (!batchMode.isEmpty()) {
      BatchMode.parse(batchMode);
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !EXPORTERS.contains(exporter)) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
    }
    if ("send".equalsIgnoreCase(mode) && trim(effective.get("command")).isEmpty()) {
      throw new IllegalArgumentException("command is required for send");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
