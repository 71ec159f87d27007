package io.intellixity.seccerts.domain;

import io.intellixity.seccerts.format.FrozenSet;
import io.intellixity.seccerts.registry.ComplexType;
import io.intellixity.seccerts.registry.ComplexTypeDecodeException;
import io.intellixity.seccerts.registry.ComplexTypeProvider;
import io.intellixity.seccerts.registry.Fields;

import java.time.LocalDate;
import java.util.*;

/**
 * Complex types of the certificate records.
 * <p>
 * Registered through {@code META-INF/seccerts.factories}, so any
 * {@link io.intellixity.seccerts.registry.DiscoveredComplexTypeRegistry} on this classpath resolves them.
 */
public final class CertificateComplexTypeProvider implements ComplexTypeProvider {
  public static final String PROTECTION_PROFILE = "ProtectionProfile";
  public static final String MAINTENANCE_REPORT = "MaintenanceReport";

  @Override
  public Collection<ComplexType<?>> complexTypes() {
    return List.of(new ProtectionProfileType(), new MaintenanceReportType());
  }

  static final class ProtectionProfileType implements ComplexType<ProtectionProfile> {
    @Override public String tag() { return PROTECTION_PROFILE; }
    @Override public Class<ProtectionProfile> javaType() { return ProtectionProfile.class; }

    @Override
    public Map<String, Object> encode(ProtectionProfile value) {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("pp_name", value.ppName());
      out.put("pp_link", value.ppLink());
      out.put("pp_ids", value.ppIds());
      return out;
    }

    @Override
    public ProtectionProfile decode(Map<String, Object> fields) {
      List<String> ids = Fields.stringList(Fields.optionalCollection(fields, "pp_ids"), "pp_ids");
      return new ProtectionProfile(
          Fields.optionalString(fields, "pp_name"),
          Fields.optionalString(fields, "pp_link"),
          ids == null ? null : FrozenSet.copyOf(ids));
    }

    @Override
    public long identityHash(ProtectionProfile value) {
      return value.hashCode();
    }
  }

  static final class MaintenanceReportType implements ComplexType<MaintenanceReport> {
    @Override public String tag() { return MAINTENANCE_REPORT; }
    @Override public Class<MaintenanceReport> javaType() { return MaintenanceReport.class; }

    @Override
    public Map<String, Object> encode(MaintenanceReport value) {
      Map<String, Object> out = new LinkedHashMap<>();
      LocalDate date = value.maintenanceDate();
      out.put("maintenance_date", date == null ? null : date.toString());
      out.put("maintenance_title", value.maintenanceTitle());
      out.put("maintenance_report_link", value.maintenanceReportLink());
      out.put("maintenance_st_link", value.maintenanceStLink());
      return out;
    }

    @Override
    public MaintenanceReport decode(Map<String, Object> fields) {
      LocalDate date;
      try {
        date = Sanitizers.sanitizeDate(fields.get("maintenance_date"));
      } catch (IllegalArgumentException e) {
        throw new ComplexTypeDecodeException("Field maintenance_date: " + e.getMessage(), e);
      }
      return new MaintenanceReport(
          date,
          Fields.optionalString(fields, "maintenance_title"),
          Fields.optionalString(fields, "maintenance_report_link"),
          Fields.optionalString(fields, "maintenance_st_link"));
    }

    @Override
    public long identityHash(MaintenanceReport value) {
      return Objects.hash(value.maintenanceDate(), value.maintenanceTitle(),
          value.maintenanceReportLink(), value.maintenanceStLink());
    }
  }
}
