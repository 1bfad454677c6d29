package ca.gc.cra.hostbridge.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.application.command.CommandDispatcher;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import ca.gc.cra.hostbridge.application.exec.MainThreadExecutor;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.hostbridge.infrastructure.host.SingleThreadHostLoop;
import ca.gc.cra.hostbridge.support.RecordingMetrics;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BridgeServerTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private SingleThreadHostLoop loop;
  private RecordingMetrics metrics;
  private BridgeServer server;
  private final AtomicInteger counter = new AtomicInteger();

  @BeforeEach
  void setUp() {
    loop = new SingleThreadHostLoop("server-test").start();
    metrics = new RecordingMetrics();
    CommandRegistry registry = CommandRegistry.builder()
        .register("ping", ctx -> "pong")
        .register("Increment", ctx -> counter.incrementAndGet())
        .build();
    CommandDispatcher dispatcher = new CommandDispatcher(
        registry, new MainThreadExecutor(loop, TIMEOUT, metrics), metrics);
    server = new BridgeServer("127.0.0.1", 0, dispatcher, new JsonEnvelopeCodec(), metrics).start();
  }

  @AfterEach
  void tearDown() {
    server.close();
    loop.close();
  }

  @Test
  void answersEachLineInOrder() throws IOException {
    try (BridgeClient client = BridgeClient.connect("127.0.0.1", server.boundPort(), TIMEOUT, TIMEOUT)) {
      CommandResponse first = client.send(new CommandEnvelope("a", "ping", Map.of()));
      CommandResponse second = client.send(new CommandEnvelope("b", "Frobnicate", Map.of()));

      assertEquals("a", first.id());
      assertEquals("pong", first.result());
      assertEquals("b", second.id());
      assertEquals(ErrorKind.UNKNOWN_COMMAND, second.errorKind());
      assertEquals("Unknown command: Frobnicate", second.error());
    }
  }

  @Test
  void malformedLineGetsDecodeErrorAndSessionSurvives() throws IOException {
    try (BridgeClient client = BridgeClient.connect("127.0.0.1", server.boundPort(), TIMEOUT, TIMEOUT)) {
      String raw = client.sendRaw("{\"command\": ");

      assertTrue(raw.contains("\"errorCode\":\"DECODE\""), raw);
      assertEquals("pong", client.send("ping", Map.of()).result());
      assertEquals(1, metrics.count("bridge.decode.failed"));
    }
  }

  @Test
  void concurrentSessionsAreSerializedOnHostLoop() throws Exception {
    int sessions = 4;
    int perSession = 25;
    ExecutorService clients = Executors.newFixedThreadPool(sessions);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int s = 0; s < sessions; s++) {
        Callable<Integer> task = () -> {
          int ok = 0;
          try (BridgeClient client = BridgeClient.connect("127.0.0.1", server.boundPort(), TIMEOUT, TIMEOUT)) {
            for (int i = 0; i < perSession; i++) {
              if (client.send("Increment", Map.of()).success()) {
                ok++;
              }
            }
          }
          return ok;
        };
        results.add(clients.submit(task));
      }
      int total = 0;
      for (Future<Integer> result : results) {
        total += result.get(30, TimeUnit.SECONDS);
      }
      assertEquals(sessions * perSession, total);
      assertEquals(sessions * perSession, counter.get());
    } finally {
      clients.shutdownNow();
    }
  }

  @Test
  void closeStopsAcceptingButOpenSessionFinishes() throws Exception {
    BridgeClient client = BridgeClient.connect("127.0.0.1", server.boundPort(), TIMEOUT, TIMEOUT);
    try {
      assertEquals("pong", client.send("ping", Map.of()).result());
      server.close();

      assertFalse(server.isRunning());
      assertFalse(BridgeClient.isReachable("127.0.0.1", server.boundPort(), Duration.ofMillis(200)));
      assertEquals("pong", client.send("ping", Map.of()).result());
    } finally {
      client.close();
    }
  }

  @Test
  void disconnectAllDropsOpenSessions() throws Exception {
    BridgeClient client = BridgeClient.connect("127.0.0.1", server.boundPort(), TIMEOUT, TIMEOUT);
    try {
      assertEquals("pong", client.send("ping", Map.of()).result());
      server.close();

      assertEquals(1, server.disconnectAll());
      assertThrows(IOException.class, () -> client.send("ping", Map.of()));
    } finally {
      client.close();
    }
  }

  @Test
  void rejectsNonLoopbackHost() {
    CommandDispatcher dispatcher = new CommandDispatcher(CommandRegistry.builder().build(),
        new MainThreadExecutor(loop, TIMEOUT, metrics), metrics);

    assertThrows(IllegalArgumentException.class,
        () -> new BridgeServer("0.0.0.0", 0, dispatcher, new JsonEnvelopeCodec(), metrics));
  }
}
