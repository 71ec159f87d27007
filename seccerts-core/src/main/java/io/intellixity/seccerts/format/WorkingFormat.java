package io.intellixity.seccerts.format;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.*;

/**
 * The format application code works with: sets and frozen sets are native, keys may contain dots.
 * Paths and domain objects are still tagged mappings.
 */
public final class WorkingFormat extends Format {
  public WorkingFormat(Object obj) {
    super(obj);
  }

  /** Encodes sets as tagged mappings and escapes dots in keys. */
  public StorageFormat toStorageFormat() {
    return new StorageFormat(toStorage(get()));
  }

  /** Materializes {@code Path} tagged mappings as {@link Path} values. */
  public RawFormat toRawFormat() {
    return new RawFormat(toRaw(get()));
  }

  static String storageKey(Object key) {
    if (key instanceof DiffSymbol s) return FormatKeys.escapeKey(s.storageKey());
    return FormatKeys.escapeKey(String.valueOf(key));
  }

  private static Object toStorage(Object obj) {
    if (obj instanceof Map<?, ?> m) {
      Map<String, Object> res = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) {
        String key = storageKey(e.getKey());
        if (res.containsKey(key)) {
          throw new MalformedDocumentException("Keys collide after encoding: " + key);
        }
        res.put(key, toStorage(e.getValue()));
      }
      return res;
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toStorage(o));
      return out;
    }
    if (obj instanceof FrozenSet<?> fs) {
      return tagged(FormatKeys.FROZENSET, fs);
    }
    if (obj instanceof Set<?> s) {
      return tagged(FormatKeys.SET, s);
    }
    return obj;
  }

  private static Map<String, Object> tagged(String tag, Set<?> elements) {
    List<Object> values = new ArrayList<>(elements.size());
    for (Object o : elements) values.add(toStorage(o));
    Map<String, Object> res = new LinkedHashMap<>();
    res.put(FormatKeys.TYPE, tag);
    res.put(FormatKeys.VALUE, values);
    return res;
  }

  private static Object toRaw(Object obj) {
    if (obj instanceof Map<?, ?> m) {
      if (FormatKeys.hasType(m, FormatKeys.PATH)) {
        return path(m);
      }
      Map<Object, Object> res = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) res.put(e.getKey(), toRaw(e.getValue()));
      return HashDict.ofIfHashed(res);
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toRaw(o));
      return out;
    }
    if (obj instanceof FrozenSet<?> fs) {
      List<Object> out = new ArrayList<>(fs.size());
      for (Object o : fs) out.add(toRaw(o));
      return FrozenSet.copyOf(out);
    }
    if (obj instanceof Set<?> s) {
      Set<Object> out = new LinkedHashSet<>();
      for (Object o : s) out.add(toRaw(o));
      return out;
    }
    return obj;
  }

  private static Path path(Map<?, ?> tagged) {
    Object v = tagged.get(FormatKeys.VALUE);
    if (!(v instanceof String s)) {
      throw new MalformedDocumentException("Tagged 'Path' mapping needs a string " + FormatKeys.VALUE
          + " but got: " + (v == null ? "null" : v.getClass().getName()));
    }
    try {
      return Path.of(s);
    } catch (InvalidPathException e) {
      throw new MalformedDocumentException("Tagged 'Path' mapping holds an invalid path: " + s, e);
    }
  }
}
