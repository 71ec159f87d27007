package io.intellixity.seccerts.registry;

import java.util.LinkedHashMap;
import java.util.Map;

/** Small hashable domain type used by the format tests. */
public record Widget(int n, String label) {
  public static final ComplexType<Widget> TYPE = new WidgetType();

  public Widget(int n) {
    this(n, null);
  }

  static final class WidgetType implements ComplexType<Widget> {
    @Override public String tag() { return "Widget"; }
    @Override public Class<Widget> javaType() { return Widget.class; }

    @Override
    public Map<String, Object> encode(Widget value) {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("n", value.n());
      if (value.label() != null) out.put("label", value.label());
      return out;
    }

    @Override
    public Widget decode(Map<String, Object> fields) {
      Object n = Fields.requireField(fields, "n");
      if (!(n instanceof Number num)) throw new ComplexTypeDecodeException("Field n must be a number: " + n);
      return new Widget(num.intValue(), Fields.optionalString(fields, "label"));
    }

    @Override
    public long identityHash(Widget value) {
      return value.n();
    }
  }
}
