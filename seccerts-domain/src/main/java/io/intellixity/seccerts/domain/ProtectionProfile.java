package io.intellixity.seccerts.domain;

import io.intellixity.seccerts.format.FrozenSet;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Protection profile a certificate claims conformance with.
 * <p>
 * Name and link are sanitized on construction. Identity (equality, hash, ordering) uses name and
 * link only; {@code ppIds} is descriptive.
 */
public record ProtectionProfile(String ppName, String ppLink, Set<String> ppIds) implements Comparable<ProtectionProfile> {
  private static final Comparator<ProtectionProfile> ORDER =
      Comparator.comparing(ProtectionProfile::ppName, Comparator.nullsFirst(Comparator.naturalOrder()));

  public ProtectionProfile {
    ppName = Sanitizers.sanitizeString(ppName);
    ppLink = Sanitizers.sanitizeLink(ppLink);
    ppIds = (ppIds == null || ppIds.isEmpty()) ? null : FrozenSet.copyOf(ppIds);
  }

  public ProtectionProfile(String ppName, String ppLink) {
    this(ppName, ppLink, null);
  }

  /**
   * Reads the legacy export layout ({@code csv_scan.cc_pp_name}, {@code csv_scan.link_pp_document},
   * {@code processed.cc_pp_csvid}).
   */
  public static ProtectionProfile fromOldApiDict(Map<String, ?> dct) {
    Map<?, ?> csvScan = section(dct, "csv_scan");
    Map<?, ?> processed = section(dct, "processed");
    Object ids = processed.get("cc_pp_csvid");
    Set<String> ppIds = null;
    if (ids instanceof Collection<?> c && !c.isEmpty()) {
      ppIds = FrozenSet.copyOf(c.stream().map(String::valueOf).toList());
    }
    return new ProtectionProfile((String) csvScan.get("cc_pp_name"), (String) csvScan.get("link_pp_document"), ppIds);
  }

  private static Map<?, ?> section(Map<String, ?> dct, String name) {
    Object v = dct.get(name);
    if (v instanceof Map<?, ?> m) return m;
    throw new IllegalArgumentException("Legacy protection profile is missing section " + name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ProtectionProfile other)) return false;
    return Objects.equals(ppName, other.ppName) && Objects.equals(ppLink, other.ppLink);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ppName, ppLink);
  }

  @Override
  public int compareTo(ProtectionProfile o) {
    return ORDER.compare(this, o);
  }
}
