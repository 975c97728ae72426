package com.kvrestore.core.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** UTC timestamp formats used in storage keys and artifact names. */
public final class Timestamps {

  public static final DateTimeFormatter RECOVERY_POINT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter CHANGE_ARTIFACT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter ERROR_ARTIFACT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

  private Timestamps() {}

  public static String recoveryPoint(Instant instant) {
    return RECOVERY_POINT.format(instant);
  }

  public static String changeArtifactSuffix(Instant instant) {
    return CHANGE_ARTIFACT.format(instant);
  }

  public static String errorArtifactSuffix(Instant instant) {
    return ERROR_ARTIFACT.format(instant);
  }

  /** Accepts {@code yyyyMMdd_HHmmss} (UTC), an ISO-8601 instant or an ISO-8601 offset date-time. */
  public static Instant parse(String text) {
    String value = text.trim();
    try {
      return LocalDateTime.parse(value, RECOVERY_POINT).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ignored) {
      // not the compact form
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ignored) {
      // not an instant
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          "Unsupported timestamp '" + text + "', expected yyyyMMdd_HHmmss or ISO-8601", e);
    }
  }
}
