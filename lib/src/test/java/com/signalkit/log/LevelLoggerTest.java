package com.signalkit.log;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LevelLoggerTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-10-17T10:15:30.123456789Z"), ZoneOffset.UTC);

  @Test
  void withAppendsInOrderAndLeavesParentUntouched() {
    final RecordingSink sink = new RecordingSink();
    final LevelLogger parent = LevelLogger.of(sink).with("a", 1);
    final LevelLogger child = parent.with("b", 2).with("c", 3);

    child.log("d", 4);
    parent.log("e", 5);

    final List<LogRecord> records = sink.getRecords();
    Assertions.assertEquals(2, records.size());
    Assertions.assertEquals(List.of("a", "b", "c", "d"), RecordingSink.keys(records.get(0)));
    Assertions.assertEquals(List.of("a", "e"), RecordingSink.keys(records.get(1)));
    Assertions.assertEquals(
        ImmutableList.of(LogField.of("a", 1)), parent.fields(), "parent fields changed");
  }

  @Test
  void siblingsDoNotSeeEachOthersFields() {
    final RecordingSink sink = new RecordingSink();
    final LevelLogger base = LevelLogger.of(sink).with("base", true);

    base.with("left", 1).log();
    base.with("right", 2).log();

    Assertions.assertEquals(List.of("base", "left"), RecordingSink.keys(sink.getRecords().get(0)));
    Assertions.assertEquals(List.of("base", "right"), RecordingSink.keys(sink.getRecords().get(1)));
  }

  @Test
  void lastLevelWins() {
    final RecordingSink sink = new RecordingSink();
    final LevelLogger logger = LevelLogger.of(sink);

    logger.debug().warn().info().log("msg", "x");
    logger.error().debug().log("msg", "y");
    logger.crit().log("msg", "z");

    Assertions.assertEquals(Level.INFO, sink.getRecords().get(0).level());
    Assertions.assertEquals(Level.DEBUG, sink.getRecords().get(1).level());
    Assertions.assertEquals(Level.ERROR, sink.getRecords().get(2).level());
  }

  @Test
  void levelDoesNotLeakIntoParent() {
    final RecordingSink sink = new RecordingSink();
    final LevelLogger logger = LevelLogger.of(sink);

    logger.warn().log();
    logger.log();

    Assertions.assertEquals(Level.WARN, sink.getRecords().get(0).level());
    Assertions.assertEquals(Level.INFO, sink.getRecords().get(1).level());
    Assertions.assertEquals(Optional.empty(), logger.level());
  }

  @Test
  void danglingKeyGetsMissingValue() {
    final RecordingSink sink = new RecordingSink();
    LevelLogger.of(sink).with("orphan").log("k", "v", "tail");

    final LogRecord record = sink.getRecords().get(0);
    Assertions.assertEquals(Optional.of(LevelLogger.MISSING_VALUE), record.firstValue("orphan"));
    Assertions.assertEquals(Optional.of(LevelLogger.MISSING_VALUE), record.firstValue("tail"));
    Assertions.assertEquals(Optional.of("v"), record.firstValue("k"));
  }

  @Test
  void createdLoggerStampsTimestampAndCaller() {
    final RecordingSink sink = new RecordingSink();
    final LevelLogger logger = LevelLogger.create(sink, FIXED_CLOCK);

    logger.info().log("msg", "hello");

    final LogRecord record = sink.getRecords().get(0);
    Assertions.assertEquals(List.of("ts", "caller", "msg"), RecordingSink.keys(record));
    Assertions.assertEquals(Optional.of("2026-10-17T10:15:30.123456789Z"), record.firstValue("ts"));
    final String caller = (String) record.firstValue("caller").orElseThrow();
    Assertions.assertTrue(
        caller.startsWith("LevelLoggerTest.java:"), "caller should name this file, got " + caller);
  }

  @Test
  void callerIsResolvedThroughDerivedLoggers() {
    final RecordingSink sink = new RecordingSink();
    final LevelLogger logger = LevelLogger.create(sink, FIXED_CLOCK).with("k", "v").warn();

    logThroughHelper(logger);

    final String caller = (String) sink.getRecords().get(0).firstValue("caller").orElseThrow();
    Assertions.assertTrue(caller.startsWith("LevelLoggerTest.java:"), caller);
  }

  private static void logThroughHelper(LevelLogger logger) {
    logger.log("msg", "from helper");
  }

  @Test
  void logfmtOutputHasLevelTimestampAndCaller() {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    final LevelLogger logger =
        LevelLogger.create(
            LoggerConfig.builder()
                .output(new PrintStream(buffer, true, StandardCharsets.UTF_8))
                .clock(FIXED_CLOCK)
                .build());

    logger.with("user", "ada").warn().log("msg", "disk almost full");

    final String line = buffer.toString(StandardCharsets.UTF_8).strip();
    Assertions.assertTrue(
        line.startsWith("level=warn ts=2026-10-17T10:15:30.123456789Z caller=LevelLoggerTest.java:"),
        line);
    Assertions.assertTrue(line.endsWith(" user=ada msg=\"disk almost full\""), line);
  }

  @Test
  void humanOutputLeadsWithTimestampLevelAndCaller() {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    final LevelLogger logger =
        LevelLogger.create(
            LoggerConfig.builder()
                .format(LogFormat.HUMAN)
                .output(new PrintStream(buffer, true, StandardCharsets.UTF_8))
                .clock(FIXED_CLOCK)
                .build());

    logger.error().log("msg", "boom", "attempt", 3);

    final String line = buffer.toString(StandardCharsets.UTF_8).strip();
    Assertions.assertTrue(
        line.startsWith("2026-10-17T10:15:30.123456789Z ERROR [LevelLoggerTest.java:"), line);
    Assertions.assertTrue(line.endsWith("] boom attempt=3"), line);
  }

  @Test
  void nopLoggerAcceptsEverything() {
    final LevelLogger logger = LevelLogger.nop();

    Assertions.assertDoesNotThrow(
        () -> {
          logger.with("a", 1).debug().log("msg", "ignored");
          logger.wrapError(new IllegalStateException("ignored")).log();
          logger.crit().log();
        });
  }
}
