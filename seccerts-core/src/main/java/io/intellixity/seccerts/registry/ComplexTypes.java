package io.intellixity.seccerts.registry;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/** Factory for descriptors assembled from functions. */
public final class ComplexTypes {
  private ComplexTypes() {}

  /** Descriptor without an identity hash. */
  public static <T> ComplexType<T> of(String tag, Class<T> javaType,
                                      Function<? super T, Map<String, Object>> encoder,
                                      Function<Map<String, Object>, ? extends T> decoder) {
    return new FunctionalComplexType<>(tag, javaType, encoder, decoder, null);
  }

  /** Descriptor whose identity hash is computed by {@code hasher}. */
  public static <T> ComplexType<T> hashable(String tag, Class<T> javaType,
                                            Function<? super T, Map<String, Object>> encoder,
                                            Function<Map<String, Object>, ? extends T> decoder,
                                            ToLongFunction<? super T> hasher) {
    return new FunctionalComplexType<>(tag, javaType, encoder, decoder, Objects.requireNonNull(hasher, "hasher"));
  }

  record FunctionalComplexType<T>(String tag,
                                  Class<T> javaType,
                                  Function<? super T, Map<String, Object>> encoder,
                                  Function<Map<String, Object>, ? extends T> decoder,
                                  ToLongFunction<? super T> hasher) implements ComplexType<T> {
    FunctionalComplexType {
      Objects.requireNonNull(tag, "tag");
      Objects.requireNonNull(javaType, "javaType");
      Objects.requireNonNull(encoder, "encoder");
      Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public Map<String, Object> encode(T value) {
      return encoder.apply(value);
    }

    @Override
    public T decode(Map<String, Object> fields) {
      return decoder.apply(fields);
    }

    @Override
    public long identityHash(T value) {
      if (hasher == null) return ComplexType.super.identityHash(value);
      return hasher.applyAsLong(value);
    }
  }
}
