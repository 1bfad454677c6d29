package ca.gc.cra.hostbridge.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the bridge YAML file: a {@code common} section shared by every CLI mode plus one section per mode.
 *
 * <p>Section names match case-insensitively and must be one of {@link #SECTIONS}; anything else is reported so a
 * misspelt {@code serv:} does not silently fall back to defaults. Within the selected sections nested mappings
 * flatten to dotted keys ({@code otel.endpoint}); sequences are rejected. The mode section wins on overlapping
 * keys.</p>
 */
public final class YamlConfigLoader {
  /** Top-level sections a configuration file may contain. */
  public static final Set<String> SECTIONS = Set.of("common", "serve", "probe", "send");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges {@code common} with the section for {@code mode}.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode (serve, probe, send)
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or names an unknown section
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = sectionName(Objects.requireNonNull(mode, "mode"));
    if ("common".equals(section) || !SECTIONS.contains(section)) {
      throw new IllegalArgumentException("Unknown mode: " + mode);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Map<String, Object>> sections = sections(mapping(document, "root"));
    Map<String, String> settings = new LinkedHashMap<>();
    flatten(sections.getOrDefault("common", Map.of()), "", settings);
    flatten(sections.getOrDefault(section, Map.of()), "", settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<String, Object>> sections(Map<String, Object> root) {
    Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
    root.forEach((key, value) -> {
      String name = sectionName(key);
      if (!SECTIONS.contains(name)) {
        throw new IllegalArgumentException("Unknown configuration section: " + key);
      }
      Map<String, Object> body = value == null ? Map.of() : mapping(value, name);
      if (sections.putIfAbsent(name, body) != null) {
        throw new IllegalArgumentException("Duplicate configuration section: " + key);
      }
    });
    return sections;
  }

  private static String sectionName(String key) {
    return key.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    });
  }
}
