package ca.gc.cra.hostbridge.api;

import ca.gc.cra.hostbridge.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host bridge CLI dispatcher that routes to subcommands.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: hostbridge <serve|probe|send> [options]";
  private static final String HELP_TEXT = """
      Host bridge command dispatcher

      Usage:
        hostbridge <command> [options]

      Commands:
        serve       Run the host loop and loopback listener (serve --help for details)
        probe       Check whether a bridge is listening
        send        Send one command and print the response line

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    if (exit != ExitCode.SUCCESS || !isServe(args)) {
      System.exit(exit.code());
    }
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare token is the subcommand
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String command = input.subcommand();
    if (command == null) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String[] delegateArgs = withoutSubcommand(args, command);
    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      case "probe" -> ProbeCli.run(delegateArgs);
      case "send" -> SendCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutSubcommand(String[] args, String command) {
    List<String> rest = new ArrayList<>();
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equalsIgnoreCase(command)) {
        removed = true;
        continue;
      }
      rest.add(arg);
    }
    return rest.toArray(String[]::new);
  }

  private static boolean isServe(String[] args) {
    CliInput input = CliInput.parse(args);
    return "serve".equals(input.subcommand()) && !input.help() && !input.hasFlag("--dry-run");
  }
}
