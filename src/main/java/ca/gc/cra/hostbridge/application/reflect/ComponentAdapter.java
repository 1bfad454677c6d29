package ca.gc.cra.hostbridge.application.reflect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Capability view of one component type: its members, fields first and then properties.
 *
 * <p>Lookup by name returns the first field with that name, falling back to the first property, which mirrors
 * how members are addressed at the protocol boundary.</p>
 */
public final class ComponentAdapter {
  private final Class<?> componentType;
  private final List<MemberAccessor> members;

  ComponentAdapter(Class<?> componentType, List<MemberAccessor> members) {
    this.componentType = Objects.requireNonNull(componentType, "componentType");
    List<MemberAccessor> ordered = new ArrayList<>();
    members.stream().filter(m -> m.kind() == MemberKind.FIELD).forEach(ordered::add);
    members.stream().filter(m -> m.kind() == MemberKind.PROPERTY).forEach(ordered::add);
    this.members = Collections.unmodifiableList(ordered);
  }

  /**
   * Starts a typed adapter for {@code type}.
   *
   * @param type component class
   * @param <C> component type
   * @return builder
   */
  public static <C> Builder<C> builder(Class<C> type) {
    return new Builder<>(type);
  }

  public Class<?> componentType() {
    return componentType;
  }

  public List<MemberAccessor> members() {
    return members;
  }

  /**
   * Finds a member by exact, case-sensitive name; fields take precedence over properties.
   *
   * @param name member name
   * @return accessor, or empty
   */
  public Optional<MemberAccessor> member(String name) {
    for (MemberAccessor member : members) {
      if (member.name().equals(name)) {
        return Optional.of(member);
      }
    }
    return Optional.empty();
  }

  /**
   * Lists fields autowiring may assign: public ones first, then {@code @Exposed} non-public ones, each group in
   * declaration order (subclass before superclass).
   *
   * @return candidate fields
   */
  public List<MemberAccessor> wireableFields() {
    List<MemberAccessor> candidates = new ArrayList<>();
    for (MemberAccessor member : members) {
      if (member.isExternallySettable() && member.isPublic()) {
        candidates.add(member);
      }
    }
    for (MemberAccessor member : members) {
      if (member.isExternallySettable() && !member.isPublic()) {
        candidates.add(member);
      }
    }
    return candidates;
  }

  /**
   * Builds adapters from typed closures.
   *
   * @param <C> component type
   */
  public static final class Builder<C> {
    private final Class<C> type;
    private final List<MemberAccessor> members = new ArrayList<>();

    private Builder(Class<C> type) {
      this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Adds a public read/write property.
     *
     * @param name member name
     * @param valueType value class
     * @param getter reads the value
     * @param setter writes the value; {@code null} makes the property read-only
     * @param <V> value type
     * @return this builder
     */
    public <V> Builder<C> property(
        String name, Class<V> valueType, Function<? super C, ? extends V> getter, BiConsumer<? super C, V> setter) {
      members.add(accessor(name, valueType, MemberKind.PROPERTY, getter, setter));
      return this;
    }

    /**
     * Adds a public field-like member backed by closures.
     *
     * @param name member name
     * @param valueType value class
     * @param getter reads the value
     * @param setter writes the value; {@code null} makes it read-only
     * @param <V> value type
     * @return this builder
     */
    public <V> Builder<C> field(
        String name, Class<V> valueType, Function<? super C, ? extends V> getter, BiConsumer<? super C, V> setter) {
      members.add(accessor(name, valueType, MemberKind.FIELD, getter, setter));
      return this;
    }

    public ComponentAdapter build() {
      return new ComponentAdapter(type, members);
    }

    private <V> MemberAccessor accessor(
        String name,
        Class<V> valueType,
        MemberKind kind,
        Function<? super C, ? extends V> getter,
        BiConsumer<? super C, V> setter) {
      Objects.requireNonNull(getter, "getter");
      if (valueType.isPrimitive()) {
        throw new IllegalArgumentException("Member " + name + " must declare a wrapper type, not " + valueType);
      }
      Function<Object, Object> get = target -> getter.apply(type.cast(target));
      BiConsumer<Object, Object> set = setter == null
          ? null
          : (target, value) -> setter.accept(type.cast(target), valueType.cast(value));
      return new MemberAccessor(name, valueType, kind, true, false, get, set);
    }
  }
}
