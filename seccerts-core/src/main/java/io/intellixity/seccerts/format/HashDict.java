package io.intellixity.seccerts.format;

import java.util.*;

/**
 * Immutable mapping that carries a precomputed identity hash under {@link FormatKeys#HASH}.
 * <p>
 * {@link #hashCode()} is derived from that entry alone, so the mapping stays usable as a set
 * element even when its values are not. Equality is plain map equality; two equal hash dicts carry
 * the same {@code _hash} and therefore hash alike.
 */
public final class HashDict extends AbstractMap<Object, Object> {
  private final Map<Object, Object> entries;
  private final long hash;

  private HashDict(LinkedHashMap<Object, Object> entries, long hash) {
    this.entries = Collections.unmodifiableMap(entries);
    this.hash = hash;
  }

  /**
   * Copies {@code map} into a hash dict.
   *
   * @throws UnhashableValueException if {@code map} has no numeric {@code _hash} entry
   */
  public static HashDict of(Map<?, ?> map) {
    Objects.requireNonNull(map, "map");
    if (map instanceof HashDict hd) return hd;
    return new HashDict(new LinkedHashMap<>(map), hashOf(map));
  }

  /** {@code map} as a hash dict when it carries {@code _hash}, otherwise {@code map} itself. */
  static Map<Object, Object> ofIfHashed(Map<Object, Object> map) {
    return carriesHash(map) ? of(map) : map;
  }

  /** Whether {@code map} carries a {@code _hash} entry. */
  public static boolean carriesHash(Map<?, ?> map) {
    return map.containsKey(FormatKeys.HASH);
  }

  /**
   * Reads the identity hash carried by {@code map}.
   *
   * @throws UnhashableValueException if the entry is absent or not a number
   */
  public static long hashOf(Map<?, ?> map) {
    Object h = map.get(FormatKeys.HASH);
    if (h instanceof Number n) return n.longValue();
    if (h == null) throw new UnhashableValueException("Mapping carries no " + FormatKeys.HASH + " entry");
    throw new UnhashableValueException("Mapping carries a non-numeric " + FormatKeys.HASH + ": " + h.getClass().getName());
  }

  /** The identity hash carried under {@code _hash}. */
  public long hash() {
    return hash;
  }

  @Override
  public Set<Entry<Object, Object>> entrySet() {
    return entries.entrySet();
  }

  @Override
  public Object get(Object key) {
    return entries.get(key);
  }

  @Override
  public boolean containsKey(Object key) {
    return entries.containsKey(key);
  }

  @Override
  public int size() {
    return entries.size();
  }

  @Override
  public int hashCode() {
    return Long.hashCode(hash);
  }

  @Override
  public boolean equals(Object o) {
    return super.equals(o);
  }
}
