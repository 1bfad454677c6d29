package ca.gc.cra.hostbridge.api;

import ca.gc.cra.hostbridge.config.ConfigMerger;
import ca.gc.cra.hostbridge.config.DefaultsForMode;
import ca.gc.cra.hostbridge.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers that turn CLI arguments plus an optional YAML file into the effective configuration map.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Parses {@code key=value} arguments and merges them over YAML and defaults for {@code mode}.
   *
   * @param mode CLI mode (serve, probe, send)
   * @param input parsed CLI input
   * @param log logger receiving override warnings
   * @return mutable effective configuration map
   * @throws IllegalArgumentException for malformed arguments, a missing config file or invalid YAML
   * @throws IOException when the config file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, CliInput input, Logger log) throws IOException {
    if (input.subcommand() != null) {
      throw new IllegalArgumentException("unexpected argument: " + input.subcommand());
    }
    Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    String configPath = extractConfigPath(kv);

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
    return new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(mode, yaml, kv, defaults, log::warn));
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
