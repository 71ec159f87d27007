package io.intellixity.seccerts.registry;

import java.util.*;

/** Typed field access for {@link ComplexType#decode} implementations. */
public final class Fields {
  private Fields() {}

  public static Object requireField(Map<String, Object> fields, String name) {
    if (!fields.containsKey(name)) throw new ComplexTypeDecodeException("Missing field: " + name);
    return fields.get(name);
  }

  public static String requireString(Map<String, Object> fields, String name) {
    Object v = requireField(fields, name);
    if (v instanceof String s) return s;
    throw new ComplexTypeDecodeException("Field " + name + " must be a string but got: " + typeName(v));
  }

  /** Absent and null both yield null. */
  public static String optionalString(Map<String, Object> fields, String name) {
    Object v = fields.get(name);
    if (v == null || v instanceof String) return (String) v;
    throw new ComplexTypeDecodeException("Field " + name + " must be a string but got: " + typeName(v));
  }

  /** Collection-valued field (list, set or frozenset); absent and null both yield null. */
  public static Collection<?> optionalCollection(Map<String, Object> fields, String name) {
    Object v = fields.get(name);
    if (v == null) return null;
    if (v instanceof Collection<?> c) return c;
    throw new ComplexTypeDecodeException("Field " + name + " must be a collection but got: " + typeName(v));
  }

  public static List<String> stringList(Collection<?> raw, String name) {
    if (raw == null) return null;
    List<String> out = new ArrayList<>(raw.size());
    for (Object o : raw) {
      if (o != null && !(o instanceof String)) {
        throw new ComplexTypeDecodeException("Field " + name + " must contain strings but got: " + typeName(o));
      }
      out.add((String) o);
    }
    return out;
  }

  private static String typeName(Object v) {
    return v == null ? "null" : v.getClass().getName();
  }
}
