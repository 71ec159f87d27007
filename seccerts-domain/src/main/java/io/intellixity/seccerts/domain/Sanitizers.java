package io.intellixity.seccerts.domain;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;

/** Normalization applied to scraped certificate fields before they become values. */
public final class Sanitizers {
  private Sanitizers() {}

  /** Null or blank yields null; soft hyphens are removed, non-breaking spaces become spaces, then trimmed. */
  public static String sanitizeString(String s) {
    if (s == null || s.isBlank()) return null;
    String out = s.replace("\u00ad", "").replace('\u00a0', ' ').strip();
    return out.isEmpty() ? null : out;
  }

  /** Null or blank yields null; drops {@code :443}, encodes spaces and upgrades {@code http://} to {@code https://}. */
  public static String sanitizeLink(String s) {
    if (s == null || s.isBlank()) return null;
    return s.strip().replace(":443", "").replace(" ", "%20").replace("http://", "https://");
  }

  /**
   * Accepts a {@link LocalDate}, an ISO-8601 date string, a {@link Date} (read as UTC) or null.
   *
   * @throws IllegalArgumentException for anything else, or for an unparseable string
   */
  public static LocalDate sanitizeDate(Object o) {
    if (o == null) return null;
    if (o instanceof LocalDate d) return d;
    if (o instanceof Date d) return d.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
    if (o instanceof String s) {
      if (s.isBlank()) return null;
      try {
        return LocalDate.parse(s.strip());
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Not an ISO date: " + s, e);
      }
    }
    throw new IllegalArgumentException("Unsupported date value: " + o.getClass().getName());
  }
}
