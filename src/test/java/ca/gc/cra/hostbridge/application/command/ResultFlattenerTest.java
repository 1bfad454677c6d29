package ca.gc.cra.hostbridge.application.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Renderer;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import ca.gc.cra.hostbridge.domain.scene.Vector3;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultFlattenerTest {
  private final ResultFlattener flattener = new ResultFlattener();

  record Summary(String name, Vector3 position, List<String> tags) {}

  enum Phase { READY }

  @Test
  void recordsBecomeMaps() {
    Object flat = flattener.flatten(new Summary("Player", new Vector3(1f, 0f, 2f), List.of("a")));

    assertEquals(Map.of(
        "name", "Player",
        "position", Map.of("x", 1f, "y", 0f, "z", 2f),
        "tags", List.of("a")), flat);
  }

  @Test
  void entitiesBecomeReferenceSummaries() {
    Scene scene = new Scene("Main");
    Entity parent = scene.createEntity("Parent");
    Entity child = scene.createEntity("Child", parent);

    Object flat = flattener.flatten(child);

    assertEquals(Map.of("name", "Child", "path", "Parent/Child", "instanceId", child.instanceId()), flat);
  }

  @Test
  void componentsExposeTypeAndPublicFields() {
    Renderer renderer = new Renderer();
    renderer.mesh = "Sphere";

    @SuppressWarnings("unchecked")
    Map<String, Object> flat = (Map<String, Object>) flattener.flatten(renderer);

    assertEquals("Renderer", flat.get("type"));
    assertEquals("Sphere", flat.get("mesh"));
  }

  @Test
  void enumsBecomeNames() {
    assertEquals("READY", flattener.flatten(Phase.READY));
  }

  @Test
  void cyclicListsFailWithEncode() {
    List<Object> list = new ArrayList<>();
    list.add(list);

    BridgeException ex = assertThrows(BridgeException.class, () -> flattener.flatten(list));
    assertEquals(ErrorKind.ENCODE, ex.kind());
  }
}
