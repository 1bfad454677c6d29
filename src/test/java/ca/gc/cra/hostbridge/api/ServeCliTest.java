package ca.gc.cra.hostbridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.config.BridgeRuntime;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ServeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ServeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsPlanWithoutBinding() {
    ExitCode code = ServeCli.run(new String[] {"port=7801", "timeoutMillis=750", "batchMode=atomic", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("127.0.0.1:7801"));
    assertTrue(output.contains("750ms"));
    assertTrue(output.contains("ATOMIC"));
  }

  @Test
  void dryRunReadsYamlSection() throws Exception {
    Path yaml = tempDir.resolve("bridge.yaml");
    Files.writeString(yaml, """
        serve:
          sceneName: Arena
          port: 7802
        """);

    ExitCode code = ServeCli.run(new String[] {"config=" + yaml, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Arena"));
    assertTrue(buffer.toString().contains("127.0.0.1:7802"));
  }

  @Test
  void nonLoopbackHostReturnsUsageAndInvalidArgs() {
    ExitCode code = ServeCli.run(new String[] {"host=10.0.0.5", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: serve"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid serve arguments"));
    assertTrue(logged);
  }

  @Test
  void runsUntilShutdownReleased() throws Exception {
    CountDownLatch shutdown = new CountDownLatch(1);
    AtomicReference<BridgeRuntime> started = new AtomicReference<>();
    CountDownLatch ready = new CountDownLatch(1);

    CompletableFuture<ExitCode> result = CompletableFuture.supplyAsync(() -> ServeCli.run(
        new String[] {"port=0"},
        shutdown,
        runtime -> {
          started.set(runtime);
          ready.countDown();
        }));

    assertTrue(ready.await(5, TimeUnit.SECONDS));
    assertTrue(started.get().isRunning());
    shutdown.countDown();

    assertEquals(ExitCode.SUCCESS, result.get(5, TimeUnit.SECONDS));
    assertFalse(started.get().isRunning());
  }
}
