package io.intellixity.seccerts.format;

import io.intellixity.seccerts.registry.ComplexType;
import io.intellixity.seccerts.registry.ComplexTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Raw format with registered domain types resolved into live instances. */
public final class ObjFormat extends Format {
  private static final Logger log = LoggerFactory.getLogger(ObjFormat.class);

  public ObjFormat(Object obj) {
    super(obj);
  }

  /**
   * Encodes every instance of a registered type as {@code {_type, _hash?, ...fields}}.
   * {@code _hash} is attached only when the type can compute it; the mapping is then a
   * {@link HashDict}.
   */
  public RawFormat toRawFormat(ComplexTypeRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    return new RawFormat(toRaw(get(), registry));
  }

  private static Object toRaw(Object obj, ComplexTypeRegistry registry) {
    if (obj == null) return null;
    Optional<? extends ComplexType<?>> type = registry.resolve(obj.getClass());
    if (type.isPresent()) {
      return encode(type.get(), obj, registry);
    }
    if (obj instanceof Map<?, ?> m) {
      Map<Object, Object> res = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) res.put(e.getKey(), toRaw(e.getValue(), registry));
      return HashDict.ofIfHashed(res);
    }
    if (obj instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toRaw(o, registry));
      return out;
    }
    if (obj instanceof FrozenSet<?> fs) {
      List<Object> out = new ArrayList<>(fs.size());
      for (Object o : fs) out.add(toRaw(o, registry));
      return FrozenSet.copyOf(out);
    }
    if (obj instanceof Set<?> s) {
      Set<Object> out = new LinkedHashSet<>();
      for (Object o : s) out.add(toRaw(o, registry));
      return out;
    }
    return obj;
  }

  @SuppressWarnings("unchecked")
  private static <T> Map<Object, Object> encode(ComplexType<T> type, Object value, ComplexTypeRegistry registry) {
    T typed = (T) value;
    Map<Object, Object> res = new LinkedHashMap<>();
    res.put(FormatKeys.TYPE, type.tag());
    boolean hashed = false;
    try {
      res.put(FormatKeys.HASH, type.identityHash(typed));
      hashed = true;
    } catch (UnhashableValueException e) {
      log.trace("seccerts.format tag={} emitted without {}: {}", type.tag(), FormatKeys.HASH, e.getMessage());
    }
    Map<String, Object> fields = type.encode(typed);
    if (fields == null) throw new MalformedDocumentException("Type " + type.tag() + " encoded to null");
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      String k = e.getKey();
      if (FormatKeys.TYPE.equals(k) || FormatKeys.HASH.equals(k)) {
        throw new MalformedDocumentException("Type " + type.tag() + " encoded reserved field " + k);
      }
      res.put(k, toRaw(e.getValue(), registry));
    }
    return hashed ? HashDict.of(res) : res;
  }
}
