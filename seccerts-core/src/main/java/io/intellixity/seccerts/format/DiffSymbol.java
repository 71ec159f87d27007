package io.intellixity.seccerts.format;

import java.util.Objects;

/**
 * Sentinel mapping key produced by diff/patch tooling (e.g. {@code insert}, {@code delete}).
 * <p>
 * Stored as {@code "__label__"}. The stored form is a plain string and is not turned back into a
 * symbol on load.
 */
public record DiffSymbol(String label) {
  public static final DiffSymbol INSERT = new DiffSymbol("insert");
  public static final DiffSymbol DELETE = new DiffSymbol("delete");
  public static final DiffSymbol UPDATE = new DiffSymbol("update");
  public static final DiffSymbol REPLACE = new DiffSymbol("replace");

  public DiffSymbol {
    Objects.requireNonNull(label, "label");
    if (label.isBlank()) throw new IllegalArgumentException("label must not be blank");
  }

  public String storageKey() {
    return "__" + label + "__";
  }

  @Override
  public String toString() {
    return "$" + label;
  }
}
