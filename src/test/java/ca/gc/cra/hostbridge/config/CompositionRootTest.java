package ca.gc.cra.hostbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.wiring.BatchMode;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.infrastructure.net.BridgeClient;
import ca.gc.cra.hostbridge.support.RecordingMetrics;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  private static BridgeConfig ephemeral() {
    return new BridgeConfig("127.0.0.1", 0, 2_000, 1_000, 5_000, BatchMode.BEST_EFFORT, "Main");
  }

  @Test
  void startServesBuiltinAndExtraCommands() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    CommandModule extra = registry -> registry.register("Version", ctx -> "1.2.3");
    CompositionRoot root = new CompositionRoot(ephemeral(), metrics).addModule(extra);

    try (BridgeRuntime runtime = root.start();
        BridgeClient client = BridgeClient.connect(
            "127.0.0.1", runtime.port(), Duration.ofSeconds(1), Duration.ofSeconds(5))) {
      assertTrue(runtime.isRunning());
      assertEquals("pong", client.send("ping", Map.of()).result());
      assertEquals("1.2.3", client.send("Version", Map.of()).result());

      CommandResponse created = client.send("CreateEntity", Map.<String, Object>of("name", "Player"));
      assertTrue(created.success());
      assertEquals(1, root.world().activeScene().entityCount());
    }
    assertTrue(metrics.count("bridge.command.succeeded") >= 3);
  }

  @Test
  void closeStopsServerAndLoop() {
    BridgeRuntime runtime = new CompositionRoot(ephemeral(), new RecordingMetrics()).start();
    int port = runtime.port();

    runtime.close();

    assertFalse(runtime.isRunning());
    assertFalse(runtime.hostLoop().isRunning());
    assertFalse(BridgeClient.isReachable("127.0.0.1", port, Duration.ofMillis(200)));
  }
}
