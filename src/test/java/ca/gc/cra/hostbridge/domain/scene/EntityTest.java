package ca.gc.cra.hostbridge.domain.scene;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EntityTest {

  private final Scene scene = new Scene("Main");

  @Test
  void newEntityCarriesTransformAndDefaults() {
    Entity entity = scene.createEntity("Player");

    assertEquals(Entity.UNTAGGED, entity.tag());
    assertEquals(0, entity.layer());
    assertSame(entity.transform(), entity.components().get(0));
  }

  @Test
  void transformCannotBeAddedOrRemoved() {
    Entity entity = scene.createEntity("Player");

    assertThrows(IllegalArgumentException.class, () -> entity.addComponent(new Transform()));
    assertThrows(IllegalArgumentException.class, () -> entity.removeComponent(entity.transform()));
  }

  @Test
  void findComponentByTypeNameAcceptsSimpleAndQualifiedNames() {
    Entity entity = scene.createEntity("Player");
    RigidBody body = entity.addComponent(new RigidBody());

    assertSame(body, entity.findComponentByTypeName("RigidBody").orElseThrow());
    assertSame(body, entity.findComponentByTypeName(RigidBody.class.getName()).orElseThrow());
    assertTrue(entity.findComponentByTypeName("rigidbody").isEmpty());
  }

  @Test
  void layerIsBounded() {
    Entity entity = scene.createEntity("Player");

    entity.setLayer(31);
    assertEquals(31, entity.layer());
    assertThrows(IllegalArgumentException.class, () -> entity.setLayer(32));
  }
}
