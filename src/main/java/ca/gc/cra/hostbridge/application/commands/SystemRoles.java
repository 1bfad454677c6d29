package ca.gc.cra.hostbridge.application.commands;

import java.util.List;

/**
 * Classifies gameplay system type names by the role they play in a generated game. Matching is by substring
 * and case-sensitive, so {@code SaveSystem} is a manager system and {@code PlayerController} a player system.
 * Names that match neither role go to the managers, so unknown names still surface as missing systems.
 */
public final class SystemRoles {
  private static final List<String> MANAGER_MARKERS = List.of("Manager", "Save", "Audio", "Event");
  private static final List<String> PLAYER_MARKERS =
      List.of("Health", "Mana", "Inventory", "Combat", "Controller", "Stat");

  private SystemRoles() {
    // Utility
  }

  public static boolean isManagerSystem(String typeName) {
    return containsAny(typeName, MANAGER_MARKERS);
  }

  public static boolean isPlayerSystem(String typeName) {
    return containsAny(typeName, PLAYER_MARKERS);
  }

  public static List<String> managerSystems(List<String> systems) {
    return systems.stream().filter(name -> isManagerSystem(name) || !isPlayerSystem(name)).toList();
  }

  public static List<String> playerSystems(List<String> systems) {
    return systems.stream().filter(SystemRoles::isPlayerSystem).toList();
  }

  private static boolean containsAny(String typeName, List<String> markers) {
    for (String marker : markers) {
      if (typeName.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
