package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.exception.QueryValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses {@code since}/{@code until} bounds.
 *
 * <p>Accepted encodings, tried in order:
 *
 * <ul>
 *   <li>unix seconds, integer or fractional ({@code 1769959655.922})
 *   <li>{@code YYYY-MM-DD}, read as UTC midnight
 *   <li>ISO-8601 date-time with offset ({@code 2026-02-01T00:00:00+01:00})
 *   <li>ISO-8601 local date-time, read as UTC
 * </ul>
 */
public final class TimeBoundParser {

  private static final Pattern UNIX_SECONDS = Pattern.compile("-?\\d+(\\.\\d+)?");
  private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private TimeBoundParser() {}

  /**
   * Parses one bound.
   *
   * @param field parameter name, reported in the validation error
   * @param raw raw value; null or blank means no bound
   * @return the instant, or null when {@code raw} is null or blank
   * @throws QueryValidationException if the value matches none of the encodings
   */
  public static Instant parse(String field, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.trim();

    if (UNIX_SECONDS.matcher(value).matches()) {
      return fromUnixSeconds(field, value);
    }
    try {
      if (DATE_ONLY.matcher(value).matches()) {
        return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      try {
        return OffsetDateTime.parse(value).toInstant();
      } catch (DateTimeParseException e) {
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      }
    } catch (DateTimeParseException e) {
      throw new QueryValidationException(
          field,
          "Invalid "
              + field
              + " '"
              + raw
              + "': expected unix seconds, YYYY-MM-DD or an ISO-8601 date-time");
    }
  }

  private static Instant fromUnixSeconds(String field, String value) {
    try {
      BigDecimal seconds = new BigDecimal(value);
      BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
      long nanos =
          seconds.subtract(whole).movePointRight(9).setScale(0, RoundingMode.DOWN).longValueExact();
      return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    } catch (ArithmeticException | DateTimeException e) {
      throw new QueryValidationException(
          field, "Invalid " + field + " '" + value + "': out of range");
    }
  }
}
