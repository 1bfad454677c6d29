package ca.gc.cra.hostbridge.application.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.support.BridgeHarness;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PropertyCommandsTest {
  private final BridgeHarness bridge = BridgeHarness.start();

  @BeforeEach
  void setUp() {
    bridge.ok("CreateEntity", "name", "Player");
    bridge.ok("AddComponent", "entityName", "Player", "componentType", "PlayerController");
  }

  @AfterEach
  void tearDown() {
    bridge.close();
  }

  @Test
  void setReturnsTrimmedValueAndGetAgrees() {
    Map<String, Object> written = bridge.ok("SetComponentProperty",
        "entityName", "Player", "componentType", "PlayerController",
        "memberName", "speed", "value", "5", "valueType", "float");

    assertEquals("5", written.get("value"));
    assertEquals("float", written.get("valueType"));
    assertEquals("FIELD", written.get("kind"));

    Map<String, Object> read = bridge.ok("GetComponentProperty",
        "entityName", "Player", "componentType", "PlayerController", "propertyName", "speed");
    assertEquals("5", read.get("value"));
  }

  @Test
  void readOnlyPropertyIsRejected() {
    CommandResponse response = bridge.call("SetComponentProperty",
        "entityName", "Player", "componentType", "PlayerController", "memberName", "kind", "value", "npc");

    assertEquals(ErrorKind.MEMBER_NOT_WRITABLE, response.errorKind());
  }

  @Test
  void requiredReferenceMustResolve() {
    CommandResponse response = bridge.call("SetComponentProperty",
        "entityName", "Player", "componentType", "PlayerController",
        "memberName", "inventory", "value", "Backpack", "required", true);

    assertEquals(ErrorKind.REFERENCE_NOT_RESOLVED, response.errorKind());
  }

  @Test
  void membersAreListed() {
    Map<String, Object> result = bridge.ok("GetComponentMembers",
        "entityName", "Player", "componentType", "PlayerController");

    @SuppressWarnings("unchecked")
    List<Map<String, Object>> members = (List<Map<String, Object>>) result.get("members");
    assertTrue(members.stream().anyMatch(m -> "level".equals(m.get("name")) && "PROPERTY".equals(m.get("kind"))));
  }

  @Test
  void missingMemberNameIsInvalidParams() {
    CommandResponse response = bridge.call("GetComponentProperty",
        "entityName", "Player", "componentType", "PlayerController");

    assertEquals(ErrorKind.INVALID_PARAMS, response.errorKind());
    assertEquals("Missing required parameter: propertyName", response.error());
  }
}
