package com.signalkit.log;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/** Keeps emitted records for assertions. */
public class RecordingSink implements RecordSink {
  private final ConcurrentLinkedQueue<LogRecord> records = new ConcurrentLinkedQueue<>();

  @Override
  public void emit(LogRecord record) {
    records.add(record);
  }

  public List<LogRecord> getRecords() {
    return ImmutableList.copyOf(records);
  }

  public List<LogRecord> getRecordsAt(Level level) {
    return records.stream().filter(r -> r.level() == level).collect(Collectors.toList());
  }

  public static List<String> keys(LogRecord record) {
    return record.fields().stream().map(LogField::key).collect(Collectors.toList());
  }
}
