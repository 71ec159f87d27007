package io.intellixity.seccerts.format;

import java.util.*;

/**
 * Immutable, insertion-ordered set. Stored with the {@code frozenset} tag, as opposed to a plain
 * {@link Set} which is stored with the {@code set} tag.
 * <p>
 * Equality follows the {@link Set} contract, so a frozen set equals any set with the same elements.
 * Null elements are permitted.
 */
public final class FrozenSet<E> extends AbstractSet<E> {
  private static final FrozenSet<?> EMPTY = new FrozenSet<>(new LinkedHashSet<>());

  private final Set<E> elements;

  private FrozenSet(LinkedHashSet<E> elements) {
    this.elements = Collections.unmodifiableSet(elements);
  }

  @SuppressWarnings("unchecked")
  public static <E> FrozenSet<E> of() {
    return (FrozenSet<E>) EMPTY;
  }

  @SafeVarargs
  public static <E> FrozenSet<E> of(E... elements) {
    return copyOf(Arrays.asList(elements));
  }

  public static <E> FrozenSet<E> copyOf(Collection<? extends E> elements) {
    Objects.requireNonNull(elements, "elements");
    if (elements instanceof FrozenSet<?>) {
      @SuppressWarnings("unchecked")
      FrozenSet<E> fs = (FrozenSet<E>) elements;
      return fs;
    }
    return new FrozenSet<>(new LinkedHashSet<>(elements));
  }

  @Override
  public Iterator<E> iterator() {
    return elements.iterator();
  }

  @Override
  public int size() {
    return elements.size();
  }

  @Override
  public boolean contains(Object o) {
    return elements.contains(o);
  }
}
