package io.intellixity.seccerts.registry;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup from tag (and from Java type) to {@link ComplexType}.
 * <p>
 * Implementations are immutable once built and safe to share between threads.
 */
public interface ComplexTypeRegistry {
  /** Descriptor registered under {@code tag}, or empty if the tag is unknown. */
  Optional<ComplexType<?>> resolve(String tag);

  /** Descriptor registered for exactly {@code javaType}, or empty. */
  <T> Optional<ComplexType<T>> resolve(Class<T> javaType);

  Set<String> tags();
}
