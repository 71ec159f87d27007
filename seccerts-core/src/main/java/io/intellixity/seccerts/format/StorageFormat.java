package io.intellixity.seccerts.format;

import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * The format documents have in the database.
 * <p>
 * Only database-safe values: no sets (they are {@code {_type: set|frozenset, _value: [...]}}), no
 * paths (they are {@code {_type: Path, _value: "..."}}), and no '.' in keys (stored as U+FF0E).
 */
public final class StorageFormat extends Format {
  public StorageFormat(Object obj) {
    super(obj);
  }

  /**
   * Rebuilds sets and restores dots in keys at every depth. Mappings that carry {@code _hash} become
   * {@link HashDict}s, as they do on every other path into the working format.
   */
  public WorkingFormat toWorkingFormat() {
    return new WorkingFormat(toWorking(get()));
  }

  /**
   * Plain tree for JSON export: sets become lists, paths become strings, dots are restored,
   * {@code _hash} entries are dropped and dates (including {@link Date}s read from the database)
   * are rendered as ISO strings.
   */
  public Object toJsonMapping() {
    return toJson(get());
  }

  private static Object toWorking(Object obj) {
    if (obj instanceof Map<?, ?> m) {
      if (FormatKeys.hasType(m, FormatKeys.SET)) {
        return new LinkedHashSet<>(elements(m));
      }
      if (FormatKeys.hasType(m, FormatKeys.FROZENSET)) {
        return FrozenSet.copyOf(elements(m));
      }
      Map<Object, Object> res = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) {
        res.put(restoreKey(e.getKey()), toWorking(e.getValue()));
      }
      return HashDict.ofIfHashed(res);
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toWorking(o));
      return out;
    }
    return obj;
  }

  private static List<Object> elements(Map<?, ?> tagged) {
    List<?> raw = taggedValues(tagged);
    List<Object> out = new ArrayList<>(raw.size());
    for (Object o : raw) out.add(toWorking(o));
    return out;
  }

  private static List<?> taggedValues(Map<?, ?> tagged) {
    Object tag = tagged.get(FormatKeys.TYPE);
    if (!tagged.containsKey(FormatKeys.VALUE)) {
      throw new MalformedDocumentException("Tagged '" + tag + "' mapping is missing " + FormatKeys.VALUE);
    }
    Object v = tagged.get(FormatKeys.VALUE);
    if (v instanceof List<?> l) return l;
    throw new MalformedDocumentException("Tagged '" + tag + "' mapping needs a list " + FormatKeys.VALUE
        + " but got: " + (v == null ? "null" : v.getClass().getName()));
  }

  private static Object restoreKey(Object key) {
    return key instanceof String s ? FormatKeys.unescapeKey(s) : key;
  }

  private static Object toJson(Object obj) {
    if (obj instanceof Map<?, ?> m) {
      if (FormatKeys.hasType(m, FormatKeys.SET) || FormatKeys.hasType(m, FormatKeys.FROZENSET)) {
        List<?> raw = taggedValues(m);
        List<Object> out = new ArrayList<>(raw.size());
        for (Object o : raw) out.add(toJson(o));
        return out;
      }
      if (FormatKeys.hasType(m, FormatKeys.PATH)) {
        return m.get(FormatKeys.VALUE);
      }
      Map<Object, Object> res = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) {
        Object key = restoreKey(e.getKey());
        if (FormatKeys.HASH.equals(key)) continue;
        res.put(key, toJson(e.getValue()));
      }
      return res;
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toJson(o));
      return out;
    }
    if (obj instanceof TemporalAccessor t) {
      return t.toString();
    }
    if (obj instanceof Date d) {
      return d.toInstant().toString();
    }
    return obj;
  }
}
