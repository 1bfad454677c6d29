package ca.gc.cra.hostbridge.domain.scene;

import java.util.Objects;

/**
 * Holds the active {@link Scene}. Confined to the host loop thread.
 */
public final class World {
  private Scene activeScene;

  public World(String initialSceneName) {
    this.activeScene = new Scene(initialSceneName);
  }

  public Scene activeScene() {
    return activeScene;
  }

  /**
   * Replaces the active scene with a new, empty one.
   *
   * @param name scene name
   * @return the new active scene
   */
  public Scene createScene(String name) {
    activeScene = new Scene(Objects.requireNonNull(name, "name"));
    return activeScene;
  }
}
