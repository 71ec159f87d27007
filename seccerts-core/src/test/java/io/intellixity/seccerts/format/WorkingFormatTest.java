package io.intellixity.seccerts.format;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class WorkingFormatTest {

  @Test
  void dottedKeysAreEscapedAtEveryDepth() {
    Map<String, Object> doc = Map.of("a.b", Map.of("c.d", List.of(Map.of("e.f", 1))));

    Object s = new WorkingFormat(doc).toStorageFormat().get();

    assertEquals(Map.of("a\uFF0Eb", Map.of("c\uFF0Ed", List.of(Map.of("e\uFF0Ef", 1)))), s);
  }

  @Test
  void setsBecomeTaggedMappings() {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("s", new LinkedHashSet<>(List.of(1, 2)));
    doc.put("f", FrozenSet.of("x"));

    Map<?, ?> s = (Map<?, ?>) new WorkingFormat(doc).toStorageFormat().get();

    assertEquals(Map.of(FormatKeys.TYPE, "set", FormatKeys.VALUE, List.of(1, 2)), s.get("s"));
    assertEquals(Map.of(FormatKeys.TYPE, "frozenset", FormatKeys.VALUE, List.of("x")), s.get("f"));
  }

  @Test
  void nestedSetsAreEncodedRecursively() {
    Set<Object> inner = new LinkedHashSet<>(List.of(Map.of("k.k", 1)));
    Object s = new WorkingFormat(List.of(FrozenSet.of(inner))).toStorageFormat().get();

    Map<String, Object> innerTagged = Map.of(FormatKeys.TYPE, "set", FormatKeys.VALUE, List.of(Map.of("k\uFF0Ek", 1)));
    assertEquals(List.of(Map.of(FormatKeys.TYPE, "frozenset", FormatKeys.VALUE, List.of(innerTagged))), s);
  }

  @Test
  void diffSymbolKeysAreRenderedAsBracketedStrings() {
    Map<Object, Object> patch = new LinkedHashMap<>();
    patch.put(DiffSymbol.INSERT, List.of(1));
    patch.put(DiffSymbol.DELETE, List.of(2));

    Map<?, ?> s = (Map<?, ?>) new WorkingFormat(patch).toStorageFormat().get();

    assertEquals(List.of("__insert__", "__delete__"), new ArrayList<>(s.keySet()));
  }

  @Test
  void diffSymbolKeysDoNotComeBackAsSymbols() {
    Map<Object, Object> patch = Map.of(DiffSymbol.UPDATE, "x");

    Map<?, ?> back = (Map<?, ?>) Formats.load(Formats.store(patch));

    assertEquals(Map.of("__update__", "x"), back);
    assertFalse(back.containsKey(DiffSymbol.UPDATE));
  }

  @Test
  void dottedDiffSymbolKeysAreEscaped() {
    Map<Object, Object> patch = Map.of(new DiffSymbol("a.b"), 1);

    Map<?, ?> s = (Map<?, ?>) new WorkingFormat(patch).toStorageFormat().get();

    assertEquals(Set.of("__a\uFF0Eb__"), s.keySet());
    assertEquals(Map.of("__a.b__", 1), Formats.load(s));
  }

  @Test
  void nonStringKeysAreStringifiedAndEscaped() {
    Map<Object, Object> doc = new LinkedHashMap<>();
    doc.put(7, "seven");
    doc.put(1.5, "one and a half");

    Map<?, ?> s = (Map<?, ?>) new WorkingFormat(doc).toStorageFormat().get();

    assertEquals("seven", s.get("7"));
    assertEquals("one and a half", s.get("1\uFF0E5"));
  }

  @Test
  void keysCollidingAfterEncoding_areRejected() {
    Map<Object, Object> doc = new LinkedHashMap<>();
    doc.put(1, "int");
    doc.put("1", "string");

    assertThrows(MalformedDocumentException.class, () -> new WorkingFormat(doc).toStorageFormat());
  }

  @Test
  void keyContainingDotSubstitute_isRejected() {
    Map<String, Object> doc = Map.of("a\uFF0Eb", 1);

    assertThrows(MalformedDocumentException.class, () -> new WorkingFormat(doc).toStorageFormat());
  }

  @Test
  void pathTagBecomesPathValue() {
    Map<String, Object> doc = Map.of("p", Map.of(FormatKeys.TYPE, "Path", FormatKeys.VALUE, "/x/y"),
        "set", Set.of(Map.of(FormatKeys.TYPE, "Path", FormatKeys.VALUE, "/z")));

    Map<?, ?> raw = (Map<?, ?>) new WorkingFormat(doc).toRawFormat().get();

    assertEquals(Path.of("/x/y"), raw.get("p"));
    assertEquals(Set.of(Path.of("/z")), raw.get("set"));
  }

  @Test
  void frozenSetStaysFrozenInRaw() {
    Object raw = new WorkingFormat(FrozenSet.of(1, 2)).toRawFormat().get();

    assertInstanceOf(FrozenSet.class, raw);
  }

  @Test
  void pathTagWithoutStringValue_isStructuralError() {
    Map<String, Object> doc = Map.of(FormatKeys.TYPE, "Path", FormatKeys.VALUE, 5);

    assertThrows(MalformedDocumentException.class, () -> new WorkingFormat(doc).toRawFormat());
    assertThrows(MalformedDocumentException.class,
        () -> new WorkingFormat(Map.of(FormatKeys.TYPE, "Path")).toRawFormat());
  }
}
