package io.intellixity.seccerts.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Immutable {@link ComplexTypeRegistry} assembled through a {@link Builder}.
 *
 * Registration semantics:
 * - registering an identical descriptor again is a no-op
 * - a different descriptor under a known tag is a conflict
 * - a second tag for an already registered Java type is a conflict
 */
public final class InMemoryComplexTypeRegistry implements ComplexTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(InMemoryComplexTypeRegistry.class);

  private final Map<String, ComplexType<?>> byTag;
  private final Map<Class<?>, ComplexType<?>> byType;

  private InMemoryComplexTypeRegistry(Map<String, ComplexType<?>> byTag, Map<Class<?>, ComplexType<?>> byType) {
    this.byTag = Map.copyOf(byTag);
    this.byType = Map.copyOf(byType);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static InMemoryComplexTypeRegistry of(Collection<? extends ComplexType<?>> types) {
    Builder b = builder();
    for (ComplexType<?> t : types) b.register(t);
    return b.build();
  }

  @Override
  public Optional<ComplexType<?>> resolve(String tag) {
    if (tag == null) return Optional.empty();
    return Optional.ofNullable(byTag.get(tag));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> Optional<ComplexType<T>> resolve(Class<T> javaType) {
    if (javaType == null) return Optional.empty();
    return Optional.ofNullable((ComplexType<T>) byType.get(javaType));
  }

  @Override
  public Set<String> tags() {
    return byTag.keySet();
  }

  @Override
  public String toString() {
    return "InMemoryComplexTypeRegistry" + new TreeSet<>(byTag.keySet());
  }

  public static final class Builder {
    private final Map<String, ComplexType<?>> byTag = new LinkedHashMap<>();
    private final Map<Class<?>, ComplexType<?>> byType = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Registers {@code type} under {@link ComplexType#tag()}.
     *
     * @throws TypeRegistryConflictException if a different descriptor owns the tag or the Java type
     */
    public Builder register(ComplexType<?> type) {
      Objects.requireNonNull(type, "type");
      String tag = Objects.requireNonNull(type.tag(), "type.tag");
      Class<?> javaType = Objects.requireNonNull(type.javaType(), "type.javaType");
      if (tag.isBlank()) throw new IllegalArgumentException("Complex type tag must not be blank: " + type);

      ComplexType<?> existing = byTag.get(tag);
      if (existing != null) {
        if (identical(existing, type)) {
          log.debug("seccerts.registry duplicate tag={} ignored", tag);
          return this;
        }
        throw new TypeRegistryConflictException("Tag " + tag + " is already registered to "
            + describe(existing) + "; refusing " + describe(type));
      }
      ComplexType<?> sameType = byType.get(javaType);
      if (sameType != null) {
        throw new TypeRegistryConflictException("Java type " + javaType.getName() + " is already registered under tag "
            + sameType.tag() + "; refusing tag " + tag);
      }

      byTag.put(tag, type);
      byType.put(javaType, type);
      log.debug("seccerts.registry registered tag={} type={}", tag, javaType.getName());
      return this;
    }

    public InMemoryComplexTypeRegistry build() {
      return new InMemoryComplexTypeRegistry(byTag, byType);
    }

    private static boolean identical(ComplexType<?> a, ComplexType<?> b) {
      if (a == b || a.equals(b)) return true;
      // records already compare by value; stateless descriptor classes compare by class
      if (a.getClass().isRecord()) return false;
      return a.getClass() == b.getClass() && a.javaType() == b.javaType();
    }

    private static String describe(ComplexType<?> t) {
      return t.getClass().getName() + "(" + t.javaType().getName() + ")";
    }
  }
}
