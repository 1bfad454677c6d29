package ca.gc.cra.hostbridge.domain.scene;

/**
 * Physics body settings. {@code planar} bodies move in the XY plane only.
 */
public final class RigidBody {
  public float mass = 1f;
  public boolean useGravity = true;
  public boolean kinematic;
  public boolean planar;
  public float drag;
}
