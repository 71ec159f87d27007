package io.intellixity.seccerts.format;

import java.util.Objects;

/**
 * A document tree tagged with the stage it belongs to.
 * <p>
 * Conversions return a new instance holding a newly allocated tree; the wrapped tree is never
 * modified.
 */
public abstract class Format {
  private final Object obj;

  protected Format(Object obj) {
    this.obj = obj;
  }

  /** The wrapped document tree. */
  public Object get() {
    return obj;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Objects.equals(obj, ((Format) o).obj);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(obj);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + obj + "]";
  }
}
