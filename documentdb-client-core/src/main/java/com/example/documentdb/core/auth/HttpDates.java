package com.example.documentdb.core.auth;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Formats the {@code x-ms-date} header, e.g. {@code Thu, 27 Apr 2017 00:51:12 GMT}. */
public final class HttpDates {

  // RFC_1123_DATE_TIME does not zero-pad the day of month
  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
          .withZone(ZoneOffset.UTC);

  private HttpDates() {}

  public static String format(final Instant instant) {
    return FORMAT.format(instant);
  }

  public static String now(final Clock clock) {
    return format(clock.instant());
  }
}
