package io.intellixity.seccerts.registry;

import java.util.Collection;

/**
 * Contributes {@link ComplexType} descriptors to a {@link DiscoveredComplexTypeRegistry}.
 * <p>
 * Listed in {@code META-INF/seccerts.factories} under this interface's name; needs a public
 * no-arg constructor.
 */
public interface ComplexTypeProvider {
  Collection<ComplexType<?>> complexTypes();
}
