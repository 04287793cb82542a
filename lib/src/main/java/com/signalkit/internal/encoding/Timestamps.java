package com.signalkit.internal.encoding;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class Timestamps {
  private Timestamps() {}

  // ISO_OFFSET_DATE_TIME prints up to nine fraction digits with trailing zeros trimmed, and "Z"
  // for UTC, which is the RFC3339 nanosecond layout.
  private static final DateTimeFormatter RFC3339_NANO =
      DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

  public static String rfc3339Nano(Instant instant) {
    return RFC3339_NANO.format(instant);
  }
}
