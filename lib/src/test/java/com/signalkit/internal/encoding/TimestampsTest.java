package com.signalkit.internal.encoding;

import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TimestampsTest {
  @Test
  void formatsRfc3339WithTrimmedNanoseconds() {
    Assertions.assertEquals(
        "2026-10-17T10:15:30.123456789Z",
        Timestamps.rfc3339Nano(Instant.parse("2026-10-17T10:15:30.123456789Z")));
    Assertions.assertEquals(
        "2026-10-17T10:15:30.5Z", Timestamps.rfc3339Nano(Instant.parse("2026-10-17T10:15:30.500Z")));
    Assertions.assertEquals(
        "2026-10-17T10:15:30Z", Timestamps.rfc3339Nano(Instant.parse("2026-10-17T10:15:30Z")));
  }
}
