package io.intellixity.seccerts.domain;

import java.time.LocalDate;

/** Maintenance update published for a certificate. All fields are sanitized on construction. */
public record MaintenanceReport(LocalDate maintenanceDate,
                               String maintenanceTitle,
                               String maintenanceReportLink,
                               String maintenanceStLink) {
  public MaintenanceReport {
    maintenanceTitle = Sanitizers.sanitizeString(maintenanceTitle);
    maintenanceReportLink = Sanitizers.sanitizeLink(maintenanceReportLink);
    maintenanceStLink = Sanitizers.sanitizeLink(maintenanceStLink);
  }

  /** Like the canonical constructor, but the date may be any value {@link Sanitizers#sanitizeDate} accepts. */
  public static MaintenanceReport of(Object maintenanceDate, String title, String reportLink, String stLink) {
    return new MaintenanceReport(Sanitizers.sanitizeDate(maintenanceDate), title, reportLink, stLink);
  }
}
