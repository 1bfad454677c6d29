package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Exposed;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link ComponentAdapter} for an arbitrary class by reflection.
 *
 * <p>This is the only place the bridge inspects component classes reflectively. It runs once per class; the
 * resulting accessors are cached by {@link ComponentTypeRegistry}.</p>
 *
 * <ul>
 *   <li>Fields: every non-static, non-synthetic field of the class and its superclasses, any visibility, in
 *       declaration order with subclass fields first. Final fields are read-only.</li>
 *   <li>Properties: {@code getX()} or {@code isX()} getters of any visibility, paired with a {@code setX(T)}
 *       setter of the same type when one exists.</li>
 * </ul>
 *
 * <p>Members whose access cannot be opened (classes in named modules that do not open their package) are
 * skipped and logged at DEBUG.</p>
 */
final class ReflectiveMembers {
  private static final Logger log = LoggerFactory.getLogger(ReflectiveMembers.class);

  private ReflectiveMembers() {}

  static ComponentAdapter derive(Class<?> type) {
    List<MemberAccessor> members = new ArrayList<>();
    for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
      for (Field field : current.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        MemberAccessor accessor = fieldAccessor(field);
        if (accessor != null) {
          members.add(accessor);
        }
      }
    }
    members.addAll(properties(type));
    log.debug("Derived {} members for component type {}", members.size(), type.getName());
    return new ComponentAdapter(type, members);
  }

  private static MemberAccessor fieldAccessor(Field field) {
    if (!open(field, field.getName())) {
      return null;
    }
    boolean writable = !Modifier.isFinal(field.getModifiers());
    return new MemberAccessor(
        field.getName(),
        field.getType(),
        MemberKind.FIELD,
        Modifier.isPublic(field.getModifiers()),
        field.isAnnotationPresent(Exposed.class),
        target -> readField(field, target),
        writable ? (target, value) -> writeField(field, target, value) : null);
  }

  private static List<MemberAccessor> properties(Class<?> type) {
    Map<String, Method> getters = new LinkedHashMap<>();
    Map<String, List<Method>> setters = new LinkedHashMap<>();
    for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
      for (Method method : current.getDeclaredMethods()) {
        if (Modifier.isStatic(method.getModifiers()) || method.isSynthetic() || method.isBridge()) {
          continue;
        }
        String getterName = getterPropertyName(method);
        if (getterName != null) {
          getters.putIfAbsent(getterName, method);
          continue;
        }
        String setterName = setterPropertyName(method);
        if (setterName != null) {
          setters.computeIfAbsent(setterName, key -> new ArrayList<>()).add(method);
        }
      }
    }
    List<MemberAccessor> result = new ArrayList<>();
    for (Map.Entry<String, Method> entry : getters.entrySet()) {
      Method getter = entry.getValue();
      if (!open(getter, entry.getKey())) {
        continue;
      }
      Method setter = null;
      for (Method candidate : setters.getOrDefault(entry.getKey(), List.of())) {
        if (candidate.getParameterTypes()[0] == getter.getReturnType() && open(candidate, entry.getKey())) {
          setter = candidate;
          break;
        }
      }
      Method effectiveSetter = setter;
      result.add(new MemberAccessor(
          entry.getKey(),
          getter.getReturnType(),
          MemberKind.PROPERTY,
          Modifier.isPublic(getter.getModifiers()),
          false,
          target -> invoke(getter, target),
          effectiveSetter == null ? null : (target, value) -> invoke(effectiveSetter, target, value)));
    }
    return result;
  }

  private static String getterPropertyName(Method method) {
    if (method.getParameterCount() != 0 || method.getReturnType() == void.class) {
      return null;
    }
    String name = method.getName();
    if (name.startsWith("get") && name.length() > 3) {
      return decapitalize(name.substring(3));
    }
    if (name.startsWith("is") && name.length() > 2
        && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
      return decapitalize(name.substring(2));
    }
    return null;
  }

  private static String setterPropertyName(Method method) {
    String name = method.getName();
    if (method.getParameterCount() == 1 && name.startsWith("set") && name.length() > 3) {
      return decapitalize(name.substring(3));
    }
    return null;
  }

  // Follows the JavaBeans rule: "URL" stays "URL", "Speed" becomes "speed".
  private static String decapitalize(String name) {
    if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
      return name;
    }
    return Character.toLowerCase(name.charAt(0)) + name.substring(1);
  }

  private static boolean open(java.lang.reflect.AccessibleObject member, String name) {
    try {
      member.setAccessible(true);
      return true;
    } catch (RuntimeException ex) {
      log.debug("Skipping inaccessible member {}: {}", name, ex.getMessage());
      return false;
    }
  }

  private static Object readField(Field field, Object target) {
    try {
      return field.get(target);
    } catch (IllegalAccessException ex) {
      throw new BridgeException(ErrorKind.INTERNAL, "Cannot read field " + field.getName(), ex);
    }
  }

  private static void writeField(Field field, Object target, Object value) {
    try {
      field.set(target, value);
    } catch (IllegalAccessException ex) {
      throw new BridgeException(ErrorKind.MEMBER_NOT_WRITABLE, "Cannot write field " + field.getName(), ex);
    } catch (IllegalArgumentException ex) {
      throw new BridgeException(ErrorKind.CONVERSION,
          "Value of type " + ValueFormats.typeTag(value) + " cannot be assigned to "
              + field.getType().getSimpleName() + " field " + field.getName(), ex);
    }
  }

  private static Object invoke(Method method, Object target, Object... args) {
    try {
      return method.invoke(target, args);
    } catch (IllegalAccessException ex) {
      throw new BridgeException(ErrorKind.INTERNAL, "Cannot invoke " + method.getName(), ex);
    } catch (InvocationTargetException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new BridgeException(ErrorKind.HOST_EXCEPTION, String.valueOf(cause.getMessage()), cause);
    }
  }
}
