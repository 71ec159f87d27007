package io.intellixity.seccerts.registry;

import io.intellixity.seccerts.format.UnhashableValueException;

import java.util.Map;

/**
 * Descriptor for a domain type that is stored as a tagged mapping and resolved back into a live
 * instance at the object stage.
 *
 * @param <T> the domain type
 */
public interface ComplexType<T> {
  /** Stable, globally unique tag written under {@code _type}. */
  String tag();

  /** Exact runtime class of the instances this descriptor encodes. */
  Class<T> javaType();

  /** Field name to document value. Must not contain the reserved keys. */
  Map<String, Object> encode(T value);

  /**
   * Rebuilds an instance from its fields ({@code _type} and {@code _hash} already removed).
   *
   * @throws ComplexTypeDecodeException if required fields are absent or malformed
   */
  T decode(Map<String, Object> fields);

  /**
   * Stable identity hash written under {@code _hash}.
   *
   * @throws UnhashableValueException if the type (or this instance) has no identity hash
   */
  default long identityHash(T value) {
    throw new UnhashableValueException("Type " + tag() + " has no identity hash");
  }
}
