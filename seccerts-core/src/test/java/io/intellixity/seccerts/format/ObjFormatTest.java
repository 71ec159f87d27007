package io.intellixity.seccerts.format;

import io.intellixity.seccerts.registry.ComplexTypeRegistry;
import io.intellixity.seccerts.registry.ComplexTypes;
import io.intellixity.seccerts.registry.Gadget;
import io.intellixity.seccerts.registry.InMemoryComplexTypeRegistry;
import io.intellixity.seccerts.registry.Widget;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ObjFormatTest {
  private static final ComplexTypeRegistry REGISTRY = InMemoryComplexTypeRegistry.of(List.of(Widget.TYPE, Gadget.TYPE));

  @Test
  void hashableInstance_encodesWithTypeAndHash() {
    Object raw = new ObjFormat(new Widget(3)).toRawFormat(REGISTRY).get();

    HashDict hd = assertInstanceOf(HashDict.class, raw);
    assertEquals(List.of(FormatKeys.TYPE, FormatKeys.HASH, "n"), new ArrayList<>(hd.keySet()));
    assertEquals("Widget", hd.get(FormatKeys.TYPE));
    assertEquals(3L, hd.get(FormatKeys.HASH));
    assertEquals(3, hd.get("n"));
  }

  @Test
  void unhashableInstance_encodesWithoutHash() {
    Object raw = new ObjFormat(new Gadget("g")).toRawFormat(REGISTRY).get();

    Map<?, ?> m = assertInstanceOf(Map.class, raw);
    assertFalse(m instanceof HashDict);
    assertEquals(Map.of(FormatKeys.TYPE, "Gadget", "name", "g"), m);
  }

  @Test
  void roundTripThroughRaw_yieldsEqualInstance() {
    Widget w = new Widget(3, "three");

    Object back = new ObjFormat(Map.of("w", w)).toRawFormat(REGISTRY).toObjFormat(REGISTRY).get();

    assertEquals(Map.of("w", w), back);
  }

  @Test
  void setsOfInstancesKeepCardinality() {
    Set<Object> s = new LinkedHashSet<>(List.of(new Widget(1), new Widget(2), new Gadget("g")));

    Set<?> raw = (Set<?>) new ObjFormat(s).toRawFormat(REGISTRY).get();
    Set<?> back = (Set<?>) new RawFormat(raw).toObjFormat(REGISTRY).get();

    assertEquals(3, raw.size());
    assertEquals(s, back);
  }

  @Test
  void encodedFieldsAreWalked() {
    record Box(Widget inner) {}
    ComplexTypeRegistry r = InMemoryComplexTypeRegistry.builder()
        .register(Widget.TYPE)
        .register(ComplexTypes.of("Box", Box.class,
            b -> Map.of("inner", b.inner()),
            f -> new Box((Widget) f.get("inner"))))
        .build();

    Map<?, ?> raw = (Map<?, ?>) new ObjFormat(new Box(new Widget(5))).toRawFormat(r).get();

    assertInstanceOf(HashDict.class, raw.get("inner"));
    assertEquals(new Box(new Widget(5)), new RawFormat(raw).toObjFormat(r).get());
  }

  @Test
  void encodingReservedField_isRejected() {
    ComplexTypeRegistry r = InMemoryComplexTypeRegistry.of(List.of(
        ComplexTypes.of("Bad", Gadget.class, g -> Map.of(FormatKeys.TYPE, "x"), f -> new Gadget("?"))));

    assertThrows(MalformedDocumentException.class, () -> new ObjFormat(new Gadget("g")).toRawFormat(r));
  }

  @Test
  void unregisteredValuesPassThrough() {
    Object raw = new ObjFormat(List.of("s", 1, Optional.empty())).toRawFormat(REGISTRY).get();

    assertEquals(List.of("s", 1, Optional.empty()), raw);
  }
}
