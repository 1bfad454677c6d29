package ca.gc.cra.hostbridge.domain.scene;

import java.util.Objects;

/**
 * Position, Euler rotation and scale of an entity. Every entity carries exactly one.
 */
public final class Transform {
  private Vector3 position = Vector3.ZERO;
  private Vector3 rotation = Vector3.ZERO;
  private Vector3 scale = Vector3.ONE;

  public Vector3 getPosition() {
    return position;
  }

  public void setPosition(Vector3 position) {
    this.position = Objects.requireNonNull(position, "position");
  }

  public Vector3 getRotation() {
    return rotation;
  }

  public void setRotation(Vector3 rotation) {
    this.rotation = Objects.requireNonNull(rotation, "rotation");
  }

  public Vector3 getScale() {
    return scale;
  }

  public void setScale(Vector3 scale) {
    this.scale = Objects.requireNonNull(scale, "scale");
  }

  @Override
  public String toString() {
    return "Transform[position=" + position + ", rotation=" + rotation + ", scale=" + scale + "]";
  }
}
