package ca.gc.cra.hostbridge.api;

import ca.gc.cra.hostbridge.config.BridgeConfig;
import ca.gc.cra.hostbridge.config.BridgeRuntime;
import ca.gc.cra.hostbridge.config.CompositionRoot;
import ca.gc.cra.hostbridge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.hostbridge.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the host loop and the loopback listener, then blocks until the JVM shuts down.
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: serve [config=FILE] [host=HOST] [port=PORT] [timeoutMillis=MS] "
          + "[batchMode=BEST_EFFORT|ATOMIC] [sceneName=NAME] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Host bridge listener

      Usage:
        serve [options]

      Optional (validated):
        config=FILE              YAML file with 'common' and 'serve' sections
        host=HOST                Loopback host to bind (default 127.0.0.1)
        port=PORT                TCP port, 0 for ephemeral (default 7777)
        timeoutMillis=MS         Bound on each marshaled invocation (default 10000)
        batchMode=MODE           BEST_EFFORT or ATOMIC for wiring batches (default BEST_EFFORT)
        sceneName=NAME           Initial active scene (default Main)
        --dry-run                Validate configuration and print it without binding
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ServeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the listener until a JVM shutdown hook fires.
   *
   * @param args CLI arguments after the {@code serve} token
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CountDownLatch shutdown = new CountDownLatch(1);
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      shutdown.countDown();
      try {
        stopped.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "hostbridge-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      return run(args, shutdown, runtime -> { });
    } finally {
      stopped.countDown();
    }
  }

  /**
   * Runs the listener until {@code shutdown} is released.
   *
   * @param args CLI arguments after the {@code serve} token
   * @param shutdown released to stop the bridge
   * @param onStarted receives the running bridge once it listens
   * @return exit code
   */
  static ExitCode run(String[] args, CountDownLatch shutdown, Consumer<BridgeRuntime> onStarted) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve CLI");
    }

    Map<String, String> effective;
    BridgeConfig config;
    String metricsExporter;
    try {
      effective = ConfigCliUtils.effectiveConfig("serve", input, log);
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = BridgeConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun")) {
      printDryRunPlan(config, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        BridgeRuntime runtime = new CompositionRoot(config, metrics).start()) {
      onStarted.accept(runtime);
      shutdown.await();
      log.info("Shutting down bridge on port {}", runtime.port());
      return ExitCode.SUCCESS;
    } catch (UncheckedIOException ex) {
      log.error("Unable to bind {}:{}", config.host(), config.port(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Bridge interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in bridge", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(BridgeConfig config, String metricsExporter) {
    CliPrinter.println("Host bridge dry run");
    CliPrinter.println("  listen           : " + config.host() + ":" + config.port());
    CliPrinter.println("  invocationTimeout: " + config.invocationTimeoutMillis() + "ms");
    CliPrinter.println("  batchMode        : " + config.batchMode());
    CliPrinter.println("  sceneName        : " + config.sceneName());
    CliPrinter.println("  metricsExporter  : " + metricsExporter);
  }
}
