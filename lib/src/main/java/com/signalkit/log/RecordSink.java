package com.signalkit.log;

/**
 * Destination of materialized records. Implementations must tolerate concurrent calls from
 * independently derived loggers.
 */
@FunctionalInterface
public interface RecordSink {
  RecordSink NOP = record -> {};

  void emit(LogRecord record);
}
