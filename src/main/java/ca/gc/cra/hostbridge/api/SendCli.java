package ca.gc.cra.hostbridge.api;

import ca.gc.cra.hostbridge.config.BridgeConfig;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.hostbridge.infrastructure.net.BridgeClient;
import ca.gc.cra.hostbridge.logging.LoggingConfigurator;
import ca.gc.cra.hostbridge.logging.Logs;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one command to a running bridge and prints the raw response line.
 */
public final class SendCli {
  private static final Logger log = LoggerFactory.getLogger(SendCli.class);
  private static final String SUMMARY_USAGE =
      "usage: send command=NAME [params=JSON] [id=ID] [host=HOST] [port=PORT] "
          + "[connectTimeoutMillis=MS] [readTimeoutMillis=MS]";
  private static final String HELP_TEXT = """
      Host bridge one-shot client

      Usage:
        send command=CreateEntity params='{"name":"Player"}' [id=1]

      Required:
        command=NAME             Registered command name (case-sensitive)

      Optional:
        params=JSON              JSON object of parameters (default {})
        id=ID                    Correlation id echoed in the response
        host=HOST port=PORT      Bridge endpoint (default 127.0.0.1:7777)
        readTimeoutMillis=MS     Wait bound for the response (default 30000)

      The response line is printed verbatim. Exit status is 0 whenever the bridge answered.
      """;

  private SendCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    JsonEnvelopeCodec codec = new JsonEnvelopeCodec();
    BridgeConfig config;
    CommandEnvelope envelope;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("send", input, log);
      config = BridgeConfig.fromMap(effective);
      envelope = new CommandEnvelope(
          blankToNull(effective.get("id")), effective.get("command"), parseParams(codec, effective.get("params")));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid send arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try (BridgeClient client =
        BridgeClient.connect(config.host(), config.port(), config.connectTimeout(), config.readTimeout())) {
      String request = codec.encodeRequest(envelope);
      log.debug("Sending {}", Logs.truncate(request, Logs.DEFAULT_ECHO_BYTES));
      CliPrinter.println(client.sendRaw(request));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Bridge at {}:{} did not answer: {}", config.host(), config.port(), ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (BridgeException ex) {
      log.error("Unable to encode request: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
  }

  private static Map<String, Object> parseParams(JsonEnvelopeCodec codec, String raw) {
    if (raw == null || raw.isBlank()) {
      return Map.of();
    }
    Object parsed;
    try {
      parsed = codec.parse(raw);
    } catch (BridgeException ex) {
      throw new IllegalArgumentException("params must be valid JSON: " + ex.getMessage(), ex);
    }
    if (!(parsed instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("params must be a JSON object");
    }
    Map<String, Object> params = new LinkedHashMap<>();
    map.forEach((key, value) -> params.put(String.valueOf(key), value));
    return params;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
