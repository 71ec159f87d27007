package io.intellixity.seccerts.format;

import java.util.Map;

/**
 * Reserved keys and tags shared by every format.
 * <p>
 * {@code _type}, {@code _value} and {@code _hash} must not be used as ordinary field names.
 */
public final class FormatKeys {
  private FormatKeys() {}

  public static final String TYPE = "_type";
  public static final String VALUE = "_value";
  public static final String HASH = "_hash";

  public static final String SET = "set";
  public static final String FROZENSET = "frozenset";
  public static final String PATH = "Path";

  /** U+FF0E FULLWIDTH FULL STOP, stands in for '.' in stored keys. */
  public static final char DOT_SUBSTITUTE = '\uFF0E';

  /** Replaces every '.' with {@link #DOT_SUBSTITUTE}. */
  public static String escapeKey(String key) {
    if (key.indexOf(DOT_SUBSTITUTE) >= 0) {
      throw new MalformedDocumentException("Key contains the reserved dot substitute U+FF0E: " + key);
    }
    return key.indexOf('.') < 0 ? key : key.replace('.', DOT_SUBSTITUTE);
  }

  /** Inverse of {@link #escapeKey(String)}. */
  public static String unescapeKey(String key) {
    return key.indexOf(DOT_SUBSTITUTE) < 0 ? key : key.replace(DOT_SUBSTITUTE, '.');
  }

  static boolean hasType(Map<?, ?> m, String tag) {
    return tag.equals(m.get(TYPE));
  }
}
