package ca.gc.cra.hostbridge.application.commands;

import java.util.LinkedHashMap;
import java.util.Map;

/** Ordered result maps for command handlers. */
final class Results {
  private Results() {
    // Utility
  }

  static Map<String, Object> success() {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", true);
    return result;
  }

  static Map<String, Object> success(String key, Object value) {
    Map<String, Object> result = success();
    result.put(key, value);
    return result;
  }
}
