package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Gets and sets named members on live components.
 * <p><strong>Resolution:</strong> entity by name in the active scene (first depth-first match), then the first
 * attached component whose runtime type name equals the requested name, then the member by exact name with
 * fields ahead of properties. Each stage fails with its own error kind.</p>
 * <p><strong>Atomicity:</strong> A write resolves the member, checks it is writable and coerces the value before
 * touching the component, so a failed write leaves the graph unchanged.</p>
 * <p><strong>Thread-safety:</strong> Must be called on the host loop thread.</p>
 *
 * @since 0.1.0
 */
public final class PropertyBridge {
  private static final Logger log = LoggerFactory.getLogger(PropertyBridge.class);

  private final Supplier<Scene> activeScene;
  private final ComponentTypeRegistry types;
  private final ValueCoercer coercer;

  public PropertyBridge(Supplier<Scene> activeScene, ComponentTypeRegistry types, ValueCoercer coercer) {
    this.activeScene = Objects.requireNonNull(activeScene, "activeScene");
    this.types = Objects.requireNonNull(types, "types");
    this.coercer = Objects.requireNonNull(coercer, "coercer");
  }

  /**
   * Reads a member.
   *
   * @param entityName entity name or path
   * @param componentType component runtime type name
   * @param memberName field or property name
   * @return stringified value and type tag
   */
  public PropertyValue get(String entityName, String componentType, String memberName) {
    Entity entity = requireEntity(entityName);
    Object component = requireComponent(entity, componentType);
    MemberAccessor member = requireMember(component, componentType, memberName);
    return describe(entityName, componentType, member, member.get(component));
  }

  /**
   * Writes a member from its wire representation.
   *
   * @param entityName entity name or path
   * @param componentType component runtime type name
   * @param memberName field or property name
   * @param value wire string
   * @param typeTag client-supplied type hint, may be {@code null}
   * @param requireReference whether unresolved references fail instead of assigning {@code null}
   * @return the member's value after the write
   */
  public PropertyValue set(
      String entityName,
      String componentType,
      String memberName,
      String value,
      String typeTag,
      boolean requireReference) {
    Entity entity = requireEntity(entityName);
    Object component = requireComponent(entity, componentType);
    MemberAccessor member = requireMember(component, componentType, memberName);
    if (!member.isWritable()) {
      throw new BridgeException(ErrorKind.MEMBER_NOT_WRITABLE,
          "Member '" + memberName + "' on component '" + componentType + "' is read-only");
    }
    Object coerced = coercer.coerce(value, typeTag, member.valueType(), requireReference);
    member.set(component, coerced);
    log.debug("Set {}.{}.{} = {}", entityName, componentType, memberName, ValueFormats.format(coerced));
    return describe(entityName, componentType, member, member.get(component));
  }

  /**
   * Assigns an already resolved value. Used by autowiring.
   *
   * @param component target component
   * @param member member of the component's adapter
   * @param value value to assign
   * @throws BridgeException {@link ErrorKind#CONVERSION} when the value does not fit the member type
   */
  public void assign(Object component, MemberAccessor member, Object value) {
    Class<?> type = box(member.valueType());
    if (value == null ? member.valueType().isPrimitive() : !type.isInstance(value)) {
      throw new BridgeException(ErrorKind.CONVERSION,
          "Cannot assign " + ValueFormats.typeTag(value) + " to " + ValueFormats.typeTag(member.valueType())
              + " member '" + member.name() + "'");
    }
    member.set(component, value);
  }

  /**
   * Lists a component's members with their current values.
   *
   * @param entityName entity name or path
   * @param componentType component runtime type name
   * @return one map per member: name, kind, type, writable, value
   */
  public List<Map<String, Object>> members(String entityName, String componentType) {
    Entity entity = requireEntity(entityName);
    Object component = requireComponent(entity, componentType);
    List<Map<String, Object>> result = new ArrayList<>();
    for (MemberAccessor member : types.adapterFor(component.getClass()).members()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("name", member.name());
      row.put("kind", member.kind());
      row.put("type", ValueFormats.typeTag(member.valueType()));
      row.put("public", member.isPublic());
      row.put("writable", member.isWritable());
      row.put("value", ValueFormats.format(member.get(component)));
      result.add(row);
    }
    return result;
  }

  /**
   * Resolves an entity in the active scene.
   *
   * @param entityName name or path
   * @return entity
   * @throws BridgeException {@link ErrorKind#ENTITY_NOT_FOUND}
   */
  public Entity requireEntity(String entityName) {
    return activeScene.get().find(entityName).orElseThrow(() -> BridgeException.entityNotFound(entityName));
  }

  /**
   * Resolves a component on an entity by runtime type name.
   *
   * @param entity owning entity
   * @param componentType simple or fully qualified type name
   * @return first matching component in attach order
   * @throws BridgeException {@link ErrorKind#COMPONENT_NOT_FOUND}
   */
  public Object requireComponent(Entity entity, String componentType) {
    return entity.findComponentByTypeName(componentType)
        .orElseThrow(() -> BridgeException.componentNotFound(componentType, entity.name()));
  }

  private MemberAccessor requireMember(Object component, String componentType, String memberName) {
    return types.adapterFor(component.getClass()).member(memberName)
        .orElseThrow(() -> BridgeException.memberNotFound(memberName, componentType));
  }

  private static PropertyValue describe(
      String entityName, String componentType, MemberAccessor member, Object current) {
    String tag = current == null ? ValueFormats.typeTag(member.valueType()) : ValueFormats.typeTag(current);
    return new PropertyValue(
        entityName, componentType, member.name(), member.kind(), ValueFormats.format(current), tag);
  }

  private static Class<?> box(Class<?> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    if (type == int.class) {
      return Integer.class;
    }
    if (type == long.class) {
      return Long.class;
    }
    if (type == float.class) {
      return Float.class;
    }
    if (type == double.class) {
      return Double.class;
    }
    if (type == boolean.class) {
      return Boolean.class;
    }
    if (type == short.class) {
      return Short.class;
    }
    if (type == byte.class) {
      return Byte.class;
    }
    return Character.class;
  }
}
