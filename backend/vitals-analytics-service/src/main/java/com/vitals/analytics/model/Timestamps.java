package com.vitals.analytics.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/** ISO-8601 parsing shared by the bus decoder and the history client. */
public final class Timestamps {

  private Timestamps() {}

  /**
   * Accepts an offset ({@code +02:00}), a {@code Z} suffix, or no zone at all,
   * in which case the value is taken as UTC.
   *
   * @throws DateTimeParseException if the text is not ISO-8601
   */
  public static Instant parse(String text) {
    String s = text.trim();
    try {
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
    }
  }
}
