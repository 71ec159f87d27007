package io.intellixity.seccerts.format.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.seccerts.format.FormatKeys;
import io.intellixity.seccerts.format.StorageFormat;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JsonExporterTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void exportsJsonMapping() throws Exception {
    Map<String, Object> set = new LinkedHashMap<>();
    set.put(FormatKeys.TYPE, "set");
    set.put(FormatKeys.VALUE, List.of("CVE-2020-1"));
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("cert\uFF0Eid", "310");
    doc.put("cves", set);
    doc.put(FormatKeys.HASH, 7);

    String json = JsonExporter.toJson(new StorageFormat(doc));
    JsonNode n = JSON.readTree(json);

    assertEquals("310", n.get("cert.id").asText());
    assertTrue(n.get("cves").isArray());
    assertEquals("CVE-2020-1", n.get("cves").get(0).asText());
    assertFalse(n.has(FormatKeys.HASH));
  }

  @Test
  void databaseDatesAreWrittenAsIsoText() throws Exception {
    Date notValidBefore = Date.from(Instant.parse("2020-01-02T00:00:00Z"));

    JsonNode n = JSON.readTree(JsonExporter.toJson(new StorageFormat(Map.of("not_valid_before", notValidBefore))));

    assertTrue(n.get("not_valid_before").isTextual());
    assertEquals("2020-01-02T00:00:00Z", n.get("not_valid_before").asText());
  }

  @Test
  void bytesAreUtf8() throws Exception {
    byte[] bytes = JsonExporter.toJsonBytes(new StorageFormat(Map.of("name", "Zertifizierungsstelle für Ü")));

    JsonNode n = JSON.readTree(new String(bytes, StandardCharsets.UTF_8));
    assertEquals("Zertifizierungsstelle für Ü", n.get("name").asText());
  }
}
