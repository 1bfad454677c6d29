package ca.gc.cra.hostbridge.domain.protocol;

import ca.gc.cra.hostbridge.validation.Strings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded request line: an optional correlation id, a case-sensitive command name and its parameters.
 *
 * @param id correlation token echoed in the response with its JSON type; a string, a number or {@code null}
 * @param command registered command name; never blank
 * @param params command-specific payload; empty when the request omitted it
 */
public record CommandEnvelope(Object id, String command, Map<String, Object> params) {

  public CommandEnvelope {
    CorrelationIds.requireScalar(id);
    command = Strings.requireNonBlank("command", command);
    params = params == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(params, "params")));
  }

  /**
   * Convenience factory for envelopes without a correlation id.
   *
   * @param command command name
   * @param params parameters
   * @return new envelope
   */
  public static CommandEnvelope of(String command, Map<String, Object> params) {
    return new CommandEnvelope(null, command, params);
  }
}
