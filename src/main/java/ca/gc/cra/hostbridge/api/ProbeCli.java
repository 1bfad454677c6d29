package ca.gc.cra.hostbridge.api;

import ca.gc.cra.hostbridge.config.BridgeConfig;
import ca.gc.cra.hostbridge.infrastructure.net.BridgeClient;
import ca.gc.cra.hostbridge.logging.LoggingConfigurator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether a bridge is listening; exit code {@code 0} when reachable, {@code 3} otherwise.
 */
public final class ProbeCli {
  private static final Logger log = LoggerFactory.getLogger(ProbeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: probe [config=FILE] [host=HOST] [port=PORT] [connectTimeoutMillis=MS]";
  private static final String HELP_TEXT = """
      Host bridge reachability probe

      Usage:
        probe [host=127.0.0.1] [port=7777] [connectTimeoutMillis=1000]

      Exit status is 0 when a listener accepts the connection and 3 when it does not.
      """;

  private ProbeCli() {}

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

    BridgeConfig config;
    try {
      config = BridgeConfig.fromMap(ConfigCliUtils.effectiveConfig("probe", input, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid probe arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    String endpoint = config.host() + ":" + config.port();
    if (BridgeClient.isReachable(config.host(), config.port(), config.connectTimeout())) {
      CliPrinter.println("reachable " + endpoint);
      return ExitCode.SUCCESS;
    }
    CliPrinter.println("unreachable " + endpoint);
    return ExitCode.IO_ERROR;
  }
}
