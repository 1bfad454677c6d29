package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Named, typed get/set handle on one member of a component type.
 *
 * <p>Accessors are built either from explicit typed closures (see {@link ComponentAdapter.Builder}) or derived
 * once per class by {@link ReflectiveMembers}; callers never touch {@code java.lang.reflect} directly.</p>
 */
public final class MemberAccessor {
  private final String name;
  private final Class<?> valueType;
  private final MemberKind kind;
  private final boolean publicMember;
  private final boolean exposed;
  private final Function<Object, Object> getter;
  private final BiConsumer<Object, Object> setter;

  MemberAccessor(
      String name,
      Class<?> valueType,
      MemberKind kind,
      boolean publicMember,
      boolean exposed,
      Function<Object, Object> getter,
      BiConsumer<Object, Object> setter) {
    this.name = Objects.requireNonNull(name, "name");
    this.valueType = Objects.requireNonNull(valueType, "valueType");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.publicMember = publicMember;
    this.exposed = exposed;
    this.getter = Objects.requireNonNull(getter, "getter");
    this.setter = setter;
  }

  public String name() {
    return name;
  }

  /** Declared type of the member; primitives are reported as primitive classes. */
  public Class<?> valueType() {
    return valueType;
  }

  public MemberKind kind() {
    return kind;
  }

  public boolean isPublic() {
    return publicMember;
  }

  public boolean isExposed() {
    return exposed;
  }

  public boolean isWritable() {
    return setter != null;
  }

  /**
   * Returns whether autowiring may assign this member: a writable field that is public or {@code @Exposed}.
   *
   * @return eligibility for autowiring
   */
  public boolean isExternallySettable() {
    return kind == MemberKind.FIELD && setter != null && (publicMember || exposed);
  }

  /**
   * Reads the member.
   *
   * @param target component instance
   * @return current value
   */
  public Object get(Object target) {
    return getter.apply(target);
  }

  /**
   * Writes the member.
   *
   * @param target component instance
   * @param value value already coerced to {@link #valueType()}
   * @throws BridgeException of kind {@link ErrorKind#MEMBER_NOT_WRITABLE} for read-only members
   */
  public void set(Object target, Object value) {
    if (setter == null) {
      throw new BridgeException(ErrorKind.MEMBER_NOT_WRITABLE,
          "Member '" + name + "' on component '" + target.getClass().getSimpleName() + "' is read-only");
    }
    setter.accept(target, value);
  }

  @Override
  public String toString() {
    return kind + " " + valueType.getSimpleName() + " " + name;
  }
}
