package io.intellixity.seccerts.registry;

import io.intellixity.seccerts.format.FormatException;

/**
 * Raised while building a registry when two different descriptors claim the same tag or the same
 * Java type. A registry that hits this must not be used.
 */
public final class TypeRegistryConflictException extends FormatException {
  public TypeRegistryConflictException(String message) {
    super(message);
  }
}
