package ca.gc.cra.hostbridge.infrastructure.asset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.domain.scene.Renderer;
import ca.gc.cra.hostbridge.domain.scene.RigidBody;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryAssetCatalogTest {
  private final InMemoryAssetCatalog catalog = new InMemoryAssetCatalog();

  @Test
  void loadIsTypeChecked() {
    Renderer renderer = new Renderer("Sphere");
    catalog.save("Assets/Materials/Ball.asset", renderer);

    assertSame(renderer, catalog.load("Assets/Materials/Ball.asset", Renderer.class).orElseThrow());
    assertTrue(catalog.load("Assets/Materials/Ball.asset", RigidBody.class).isEmpty());
    assertTrue(catalog.load(null, Object.class).isEmpty());
  }

  @Test
  void searchMatchesFileNameCaseInsensitivelyInPathOrder() {
    catalog.save("Assets/B/FastBody.asset", new RigidBody());
    catalog.save("Assets/A/SlowBody.asset", new RigidBody());
    catalog.save("Assets/Body/Other.asset", new RigidBody());
    catalog.save("Assets/A/BodyPaint.asset", new Renderer());

    assertEquals(List.of("Assets/A/SlowBody.asset", "Assets/B/FastBody.asset"),
        catalog.search("body", RigidBody.class));
    assertEquals(4, catalog.list().size());
  }

  @Test
  void removeReportsPresence() {
    catalog.save("Assets/X.asset", new Renderer());

    assertTrue(catalog.remove("Assets/X.asset"));
    assertFalse(catalog.remove("Assets/X.asset"));
  }
}
