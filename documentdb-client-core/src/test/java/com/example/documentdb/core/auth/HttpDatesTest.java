package com.example.documentdb.core.auth;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class HttpDatesTest {

  @Test
  void shouldFormatInGmt() {
    assertEquals(
        "Thu, 27 Apr 2017 00:51:12 GMT", HttpDates.format(Instant.parse("2017-04-27T00:51:12Z")));
  }

  @Test
  void shouldZeroPadDayOfMonth() {
    assertEquals(
        "Wed, 01 Jan 2020 00:00:00 GMT", HttpDates.format(Instant.parse("2020-01-01T00:00:00Z")));
  }

  @Test
  void shouldIgnoreClockZone() {
    final var clock =
        Clock.fixed(Instant.parse("2017-04-27T00:51:12Z"), ZoneId.of("America/Los_Angeles"));
    assertEquals("Thu, 27 Apr 2017 00:51:12 GMT", HttpDates.now(clock));
  }
}
