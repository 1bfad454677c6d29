package ca.gc.cra.hostbridge.domain.scene;

/**
 * Visual representation of an entity: a primitive mesh (or sprite) and a colour name.
 */
public final class Renderer {
  public String mesh = "Cube";
  public String color = "white";
  public boolean enabled = true;

  public Renderer() {}

  public Renderer(String mesh) {
    this.mesh = mesh;
  }
}
