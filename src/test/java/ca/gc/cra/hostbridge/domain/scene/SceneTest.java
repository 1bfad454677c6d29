package ca.gc.cra.hostbridge.domain.scene;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SceneTest {

  @Test
  void findReturnsFirstDepthFirstMatch() {
    Scene scene = new Scene("Main");
    Entity first = scene.createEntity("Root");
    Entity nested = scene.createEntity("Enemy", first);
    scene.createEntity("Enemy");

    assertSame(nested, scene.find("Enemy").orElseThrow());
  }

  @Test
  void findResolvesSlashPathsFromRoots() {
    Scene scene = new Scene("Main");
    Entity a = scene.createEntity("A");
    scene.createEntity("Weapon", a);
    Entity b = scene.createEntity("B");
    Entity weaponB = scene.createEntity("Weapon", b);

    assertSame(weaponB, scene.find("B/Weapon").orElseThrow());
    assertEquals("B/Weapon", weaponB.path());
    assertTrue(scene.find("C/Weapon").isEmpty());
  }

  @Test
  void findIncludesInactiveEntities() {
    Scene scene = new Scene("Main");
    Entity hidden = scene.createEntity("Hidden");
    hidden.setActive(false);

    assertSame(hidden, scene.find("Hidden").orElseThrow());
  }

  @Test
  void destroyRemovesSubtree() {
    Scene scene = new Scene("Main");
    Entity parent = scene.createEntity("Parent");
    Entity child = scene.createEntity("Child", parent);

    scene.destroy(parent);

    assertEquals(0, scene.entityCount());
    assertTrue(child.isDestroyed());
    assertTrue(scene.find("Child").isEmpty());
  }

  @Test
  void walkIsPreOrder() {
    Scene scene = new Scene("Main");
    Entity a = scene.createEntity("A");
    scene.createEntity("A1", a);
    scene.createEntity("B");

    List<String> names = scene.walk().stream().map(Entity::name).toList();
    assertEquals(List.of("A", "A1", "B"), names);
  }

  @Test
  void reparentingUnderDescendantIsRejected() {
    Scene scene = new Scene("Main");
    Entity parent = scene.createEntity("Parent");
    Entity child = scene.createEntity("Child", parent);

    assertThrows(IllegalArgumentException.class, () -> parent.setParent(child));
    assertFalse(child.children().contains(parent));
  }

  @Test
  void inactiveParentMakesChildInactiveInHierarchy() {
    Scene scene = new Scene("Main");
    Entity parent = scene.createEntity("Parent");
    Entity child = scene.createEntity("Child", parent);
    parent.setActive(false);

    assertTrue(child.isActive());
    assertFalse(child.isActiveInHierarchy());
  }
}
