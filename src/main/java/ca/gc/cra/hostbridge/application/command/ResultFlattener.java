package ca.gc.cra.hostbridge.application.command;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.HostEvent;
import ca.gc.cra.hostbridge.domain.scene.Vector3;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts handler results into plain wire trees of maps, lists, strings, numbers, booleans and nulls.
 *
 * <p>Runs on the host thread as part of the invocation, so live scene objects are read where they are owned and
 * nothing but detached values crosses back to the session thread.</p>
 *
 * <ul>
 *   <li>Entities become reference summaries ({@code name}, {@code path}, {@code instanceId}).</li>
 *   <li>Vectors become {@code {x, y, z}}; enums their name; records a map of their components.</li>
 *   <li>Other objects, such as components, become {@code {type, ...public fields}}; objects nested inside them
 *       are summarized by type only, so wired component graphs never recurse.</li>
 *   <li>Self-referencing maps, lists and records raise an {@code ENCODE} error.</li>
 * </ul>
 */
public final class ResultFlattener {
  private static final int MAX_DEPTH = 64;

  /**
   * Flattens a handler result.
   *
   * @param value handler result
   * @return wire tree
   * @throws BridgeException of kind {@link ErrorKind#ENCODE} for cyclic or excessively deep values
   */
  public Object flatten(Object value) {
    return flatten(value, Collections.newSetFromMap(new IdentityHashMap<>()), 0, true);
  }

  private Object flatten(Object value, Set<Object> inProgress, int depth, boolean expandObjects) {
    if (depth > MAX_DEPTH) {
      throw new BridgeException(ErrorKind.ENCODE, "Result nesting exceeds " + MAX_DEPTH + " levels");
    }
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Number number) {
      return flattenNumber(number);
    }
    if (value instanceof Character || value instanceof CharSequence) {
      return value.toString();
    }
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    if (value instanceof Class<?> type) {
      return type.getSimpleName();
    }
    if (value instanceof Optional<?> optional) {
      return flatten(optional.orElse(null), inProgress, depth, expandObjects);
    }
    if (value instanceof Entity entity) {
      return entitySummary(entity);
    }
    if (value instanceof Vector3 vector) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("x", vector.x());
      map.put("y", vector.y());
      map.put("z", vector.z());
      return map;
    }
    if (value instanceof HostEvent<?> event) {
      return Map.of("listeners", event.listenerCount());
    }
    if (!inProgress.add(value)) {
      throw new BridgeException(ErrorKind.ENCODE,
          "Result contains a cyclic reference through " + value.getClass().getSimpleName());
    }
    try {
      if (value instanceof Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
          copy.put(String.valueOf(entry.getKey()),
              flatten(entry.getValue(), inProgress, depth + 1, expandObjects));
        }
        return copy;
      }
      if (value instanceof Iterable<?> iterable) {
        List<Object> list = new ArrayList<>();
        for (Object item : iterable) {
          list.add(flatten(item, inProgress, depth + 1, expandObjects));
        }
        return list;
      }
      if (value.getClass().isArray()) {
        int length = Array.getLength(value);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
          list.add(flatten(Array.get(value, i), inProgress, depth + 1, expandObjects));
        }
        return list;
      }
      if (value instanceof Record rec) {
        return flattenRecord(rec, inProgress, depth);
      }
      return expandObjects ? flattenObject(value, inProgress, depth) : typeSummary(value);
    } finally {
      inProgress.remove(value);
    }
  }

  private static Object flattenNumber(Number number) {
    if (number instanceof Double d && !Double.isFinite(d)) {
      return d.toString();
    }
    if (number instanceof Float f && !Float.isFinite(f)) {
      return f.toString();
    }
    if (number instanceof Integer || number instanceof Long || number instanceof Short
        || number instanceof Byte || number instanceof Float || number instanceof Double
        || number instanceof BigInteger || number instanceof BigDecimal) {
      return number;
    }
    return number.toString();
  }

  private Map<String, Object> flattenRecord(Record rec, Set<Object> inProgress, int depth) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (RecordComponent component : rec.getClass().getRecordComponents()) {
      try {
        component.getAccessor().setAccessible(true);
        Object item = component.getAccessor().invoke(rec);
        map.put(component.getName(), flatten(item, inProgress, depth + 1, true));
      } catch (IllegalAccessException | InvocationTargetException | RuntimeException ex) {
        throw new BridgeException(ErrorKind.ENCODE,
            "Cannot read record component " + component.getName() + ": " + ex.getMessage(), ex);
      }
    }
    return map;
  }

  private Map<String, Object> flattenObject(Object value, Set<Object> inProgress, int depth) {
    Map<String, Object> map = typeSummary(value);
    for (Field field : value.getClass().getFields()) {
      if (Modifier.isStatic(field.getModifiers())) {
        continue;
      }
      try {
        map.put(field.getName(), flatten(field.get(value), inProgress, depth + 1, false));
      } catch (IllegalAccessException ex) {
        throw new BridgeException(ErrorKind.ENCODE, "Cannot read field " + field.getName(), ex);
      }
    }
    return map;
  }

  private static Map<String, Object> typeSummary(Object value) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", value.getClass().getSimpleName());
    return map;
  }

  /**
   * Builds the reference summary used wherever an entity appears in a result.
   *
   * @param entity entity to describe
   * @return map with {@code name}, {@code path}, {@code instanceId}
   */
  public static Map<String, Object> entitySummary(Entity entity) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", entity.name());
    map.put("path", entity.path());
    map.put("instanceId", entity.instanceId());
    return map;
  }
}
