package io.intellixity.seccerts.format;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FormatKeysTest {

  @Test
  void escapeThenUnescape_isIdentity() {
    for (String key : List.of("", "plain", "a.b", ".lead", "trail.", "..", "a.b.c", "ümlaut.ß", "1.5")) {
      assertEquals(key, FormatKeys.unescapeKey(FormatKeys.escapeKey(key)), key);
      assertEquals(-1, FormatKeys.escapeKey(key).indexOf('.'), key);
    }
  }

  @Test
  void escapingIsInjective() {
    List<String> keys = List.of("a.b", "ab", "a..b", "a.b.", ".ab", "a_b", "a b", "a\u00B7b");
    Map<String, String> seen = new HashMap<>();
    for (String key : keys) {
      String prev = seen.put(FormatKeys.escapeKey(key), key);
      assertNull(prev, () -> key + " collides with " + prev);
    }
  }

  @Test
  void substituteIsFullwidthFullStop() {
    assertEquals(0xFF0E, FormatKeys.DOT_SUBSTITUTE);
    assertEquals("a\uFF0Eb", FormatKeys.escapeKey("a.b"));
  }
}
