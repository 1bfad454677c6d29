package ca.gc.cra.hostbridge.application.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class SystemRolesTest {

  @Test
  void splitsByMarker() {
    List<String> systems = List.of("AudioManager", "SaveSystem", "HealthSystem", "PlayerController", "Weather");

    assertEquals(List.of("AudioManager", "SaveSystem", "Weather"), SystemRoles.managerSystems(systems));
    assertEquals(List.of("HealthSystem", "PlayerController"), SystemRoles.playerSystems(systems));
  }
}
