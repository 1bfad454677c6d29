package ca.gc.cra.hostbridge.application.command;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.scene.Vector3;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed, read-only view over a request's {@code params} object.
 *
 * <p>Every accessor fails with an {@code INVALID_PARAMS} {@link BridgeException} naming the offending key.
 * Scalar values are accepted from either JSON strings or JSON scalars, so {@code "5"} and {@code 5} both read
 * as the integer 5.</p>
 */
public final class CommandParams {
  private final Map<String, Object> values;

  public CommandParams(Map<String, Object> values) {
    this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static CommandParams empty() {
    return new CommandParams(Map.of());
  }

  public boolean has(String key) {
    return values.get(key) != null;
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public Optional<Object> raw(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Reads a required, non-blank scalar as text.
   *
   * @param key parameter name
   * @return text value
   */
  public String requireString(String key) {
    return optString(key)
        .filter(value -> !value.isBlank())
        .orElseThrow(() -> BridgeException.invalidParams("Missing required parameter: " + key));
  }

  public Optional<String> optString(String key) {
    Object value = values.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw BridgeException.invalidParams("Parameter '" + key + "' must be a scalar");
    }
    return Optional.of(value.toString());
  }

  public String string(String key, String defaultValue) {
    return optString(key).orElse(defaultValue);
  }

  /**
   * Reads a boolean from JSON {@code true/false} or the strings {@code "true"/"false"}.
   *
   * @param key parameter name
   * @param defaultValue value when absent
   * @return parsed boolean
   */
  public boolean bool(String key, boolean defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    String text = value.toString().trim();
    if (text.equalsIgnoreCase("true")) {
      return true;
    }
    if (text.equalsIgnoreCase("false")) {
      return false;
    }
    throw BridgeException.invalidParams("Parameter '" + key + "' must be true or false (was " + text + ")");
  }

  public Optional<Boolean> optBool(String key) {
    return has(key) ? Optional.of(bool(key, false)) : Optional.empty();
  }

  public int integer(String key, int defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw BridgeException.invalidParams("Parameter '" + key + "' must be an integer (was " + value + ")");
    }
  }

  /**
   * Reads a nested object.
   *
   * @param key parameter name
   * @return nested parameters, or empty
   */
  public Optional<CommandParams> object(String key) {
    Object value = values.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw BridgeException.invalidParams("Parameter '" + key + "' must be an object");
    }
    return Optional.of(new CommandParams(stringKeys(map, key)));
  }

  /**
   * Reads a list of objects; absent means empty.
   *
   * @param key parameter name
   * @return nested parameter objects in order
   */
  public List<CommandParams> objectList(String key) {
    List<CommandParams> result = new ArrayList<>();
    for (Object item : list(key)) {
      if (!(item instanceof Map<?, ?> map)) {
        throw BridgeException.invalidParams("Parameter '" + key + "' must be a list of objects");
      }
      result.add(new CommandParams(stringKeys(map, key)));
    }
    return result;
  }

  /**
   * Reads a list of scalars as text; absent means empty.
   *
   * @param key parameter name
   * @return values in order
   */
  public List<String> stringList(String key) {
    List<String> result = new ArrayList<>();
    for (Object item : list(key)) {
      if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
        throw BridgeException.invalidParams("Parameter '" + key + "' must be a list of strings");
      }
      result.add(item.toString());
    }
    return result;
  }

  /**
   * Reads a vector from {@code {"x":1,"y":2,"z":3}} or {@code "1,2,3"}.
   *
   * @param key parameter name
   * @param fallback supplies components missing from an object form
   * @return parsed vector, or empty when absent
   */
  public Optional<Vector3> vector(String key, Vector3 fallback) {
    Object value = values.get(key);
    if (value == null) {
      return Optional.empty();
    }
    try {
      if (value instanceof Map<?, ?> map) {
        return Optional.of(Vector3.fromMap(map, fallback));
      }
      return Optional.of(Vector3.parse(value.toString()));
    } catch (IllegalArgumentException ex) {
      throw BridgeException.invalidParams("Parameter '" + key + "': " + ex.getMessage());
    }
  }

  private List<?> list(String key) {
    Object value = values.get(key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw BridgeException.invalidParams("Parameter '" + key + "' must be a list");
    }
    return list;
  }

  private static Map<String, Object> stringKeys(Map<?, ?> map, String key) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String name)) {
        throw BridgeException.invalidParams("Parameter '" + key + "' contains a non-string key");
      }
      copy.put(name, entry.getValue());
    }
    return copy;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
