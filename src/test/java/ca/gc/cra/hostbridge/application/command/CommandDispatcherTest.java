package ca.gc.cra.hostbridge.application.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.application.exec.MainThreadExecutor;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.infrastructure.host.SingleThreadHostLoop;
import ca.gc.cra.hostbridge.support.RecordingMetrics;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandDispatcherTest {
  private SingleThreadHostLoop loop;
  private RecordingMetrics metrics;
  private AtomicInteger hostCalls;
  private CommandDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    loop = new SingleThreadHostLoop("dispatcher-test").start();
    metrics = new RecordingMetrics();
    hostCalls = new AtomicInteger();
    CommandRegistry registry = CommandRegistry.builder()
        .register("Ping", ctx -> {
          hostCalls.incrementAndGet();
          return Map.of("pong", loop.isHostThread());
        })
        .register("Echo", ctx -> ctx.params().requireString("text"))
        .register("Explode", ctx -> {
          throw new IllegalStateException("Renderer missing material");
        })
        .register("Missing", ctx -> {
          throw BridgeException.entityNotFound("Ghost");
        })
        .build();
    dispatcher = new CommandDispatcher(registry,
        new MainThreadExecutor(loop, Duration.ofSeconds(2), metrics), metrics);
  }

  @AfterEach
  void tearDown() {
    loop.close();
  }

  @Test
  void successRunsOnHostThreadAndEchoesId() {
    CommandResponse response = dispatcher.dispatch(new CommandEnvelope("req-1", "Ping", Map.of()));

    assertTrue(response.success());
    assertEquals("req-1", response.id());
    assertEquals(Map.of("pong", true), response.result());
    assertEquals(1, metrics.count("bridge.command.succeeded"));
  }

  @Test
  void unknownCommandNeverReachesHostLoop() {
    CommandResponse response = dispatcher.dispatch(new CommandEnvelope("7", "Frobnicate", Map.of()));

    assertFalse(response.success());
    assertEquals("7", response.id());
    assertEquals(ErrorKind.UNKNOWN_COMMAND, response.errorKind());
    assertEquals("Unknown command: Frobnicate", response.error());
    assertEquals(0, hostCalls.get());
    assertEquals(1, metrics.count("bridge.command.failed.unknown_command"));
  }

  @Test
  void missingParameterIsInvalidParams() {
    CommandResponse response = dispatcher.dispatch(CommandEnvelope.of("Echo", Map.of()));

    assertEquals(ErrorKind.INVALID_PARAMS, response.errorKind());
    assertEquals("Missing required parameter: text", response.error());
    assertNull(response.id());
  }

  @Test
  void handlerExceptionIsForwardedVerbatim() {
    CommandResponse response = dispatcher.dispatch(CommandEnvelope.of("Explode", Map.of()));

    assertEquals(ErrorKind.HOST_EXCEPTION, response.errorKind());
    assertEquals("Renderer missing material", response.error());
  }

  @Test
  void bridgeExceptionKeepsItsKind() {
    CommandResponse response = dispatcher.dispatch(CommandEnvelope.of("Missing", Map.of()));

    assertEquals(ErrorKind.ENTITY_NOT_FOUND, response.errorKind());
    assertTrue(response.error().contains("Ghost"));
  }
}
