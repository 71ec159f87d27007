package io.intellixity.seccerts.format;

import io.intellixity.seccerts.registry.ComplexType;
import io.intellixity.seccerts.registry.ComplexTypeDecodeException;
import io.intellixity.seccerts.registry.ComplexTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Working format with paths materialized as {@link Path} values.
 * <p>
 * Anything that has to live in a set is hashable here: mappings that carry {@code _hash} are
 * {@link HashDict}s once converted back to the working format.
 */
public final class RawFormat extends Format {
  private static final Logger log = LoggerFactory.getLogger(RawFormat.class);

  public RawFormat(Object obj) {
    super(obj);
  }

  /**
   * Turns paths back into {@code {_type: Path, _value, _hash}} hash dicts and wraps every mapping
   * that carries {@code _hash} in a {@link HashDict}.
   */
  public WorkingFormat toWorkingFormat() {
    return new WorkingFormat(toWorking(get()));
  }

  /**
   * Resolves tagged mappings whose tag is registered into domain instances, innermost first.
   * Mappings with unknown tags are kept as they are.
   */
  public ObjFormat toObjFormat(ComplexTypeRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    return new ObjFormat(toObj(get(), registry));
  }

  /** Identity hash stored for a path. */
  static long pathHash(Path p) {
    return p.hashCode();
  }

  private static Object toWorking(Object obj) {
    if (obj instanceof Map<?, ?> m) {
      Map<Object, Object> d = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) d.put(e.getKey(), toWorking(e.getValue()));
      return HashDict.ofIfHashed(d);
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toWorking(o));
      return out;
    }
    if (obj instanceof FrozenSet<?> fs) {
      List<Object> out = new ArrayList<>(fs.size());
      for (Object o : fs) out.add(toWorking(o));
      return FrozenSet.copyOf(out);
    }
    if (obj instanceof Set<?> s) {
      Set<Object> out = new LinkedHashSet<>();
      for (Object o : s) out.add(toWorking(o));
      return out;
    }
    if (obj instanceof Path p) {
      Map<Object, Object> d = new LinkedHashMap<>();
      d.put(FormatKeys.TYPE, FormatKeys.PATH);
      d.put(FormatKeys.VALUE, p.toString());
      d.put(FormatKeys.HASH, pathHash(p));
      return HashDict.of(d);
    }
    return obj;
  }

  private static Object toObj(Object obj, ComplexTypeRegistry registry) {
    if (obj instanceof Map<?, ?> m) {
      Map<Object, Object> res = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) res.put(e.getKey(), toObj(e.getValue(), registry));
      Object tag = res.get(FormatKeys.TYPE);
      if (!(tag instanceof String t)) return HashDict.ofIfHashed(res);
      Optional<ComplexType<?>> type = registry.resolve(t);
      if (type.isEmpty()) {
        log.trace("seccerts.format unresolved tag={} kept as mapping", t);
        return HashDict.ofIfHashed(res);
      }
      res.remove(FormatKeys.TYPE);
      res.remove(FormatKeys.HASH);
      return decode(type.get(), res);
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toObj(o, registry));
      return out;
    }
    if (obj instanceof FrozenSet<?> fs) {
      List<Object> out = new ArrayList<>(fs.size());
      for (Object o : fs) out.add(toObj(o, registry));
      return FrozenSet.copyOf(out);
    }
    if (obj instanceof Set<?> s) {
      Set<Object> out = new LinkedHashSet<>();
      for (Object o : s) out.add(toObj(o, registry));
      return out;
    }
    return obj;
  }

  private static Object decode(ComplexType<?> type, Map<Object, Object> fields) {
    Map<String, Object> named = new LinkedHashMap<>();
    for (Map.Entry<Object, Object> e : fields.entrySet()) {
      if (!(e.getKey() instanceof String k)) {
        throw new ComplexTypeDecodeException("Type " + type.tag() + " has a non-string field key: " + e.getKey());
      }
      named.put(k, e.getValue());
    }
    Object out;
    try {
      out = type.decode(Collections.unmodifiableMap(named));
    } catch (ComplexTypeDecodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ComplexTypeDecodeException("Failed to decode " + type.tag() + ": " + e.getMessage(), e);
    }
    if (out == null) throw new ComplexTypeDecodeException("Type " + type.tag() + " decoded to null");
    return out;
  }
}
