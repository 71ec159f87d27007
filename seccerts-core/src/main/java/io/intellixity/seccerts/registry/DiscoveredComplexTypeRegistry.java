package io.intellixity.seccerts.registry;

import io.intellixity.seccerts.util.SecCertsFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * ComplexTypeRegistry built via discovery (META-INF/seccerts.factories).
 *
 * <p>All providers are read and registered in the constructor, so the registry is complete before
 * the first conversion runs. Build one at startup and pass it to whatever resolves objects.
 * Conflicting registrations fail construction with {@link TypeRegistryConflictException}.</p>
 */
public final class DiscoveredComplexTypeRegistry implements ComplexTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredComplexTypeRegistry.class);

  private final ComplexTypeRegistry delegate;

  public DiscoveredComplexTypeRegistry() {
    this(SecCertsFactoriesLoader.load(ComplexTypeProvider.class));
  }

  public DiscoveredComplexTypeRegistry(ClassLoader cl) {
    this(SecCertsFactoriesLoader.load(ComplexTypeProvider.class, cl));
  }

  DiscoveredComplexTypeRegistry(List<ComplexTypeProvider> providers) {
    InMemoryComplexTypeRegistry.Builder b = InMemoryComplexTypeRegistry.builder();
    for (ComplexTypeProvider p : providers) {
      if (p == null) continue;
      Collection<ComplexType<?>> types = p.complexTypes();
      if (types == null) continue;
      for (ComplexType<?> t : types) {
        if (t != null) b.register(t);
      }
    }
    this.delegate = b.build();
    log.info("seccerts.registry providers={} tags={}", providers.size(), delegate.tags().size());
  }

  @Override
  public Optional<ComplexType<?>> resolve(String tag) {
    return delegate.resolve(tag);
  }

  @Override
  public <T> Optional<ComplexType<T>> resolve(Class<T> javaType) {
    return delegate.resolve(javaType);
  }

  @Override
  public Set<String> tags() {
    return delegate.tags();
  }
}
