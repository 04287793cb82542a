package com.signalkit.log;

import java.io.PrintStream;
import java.time.Clock;
import org.immutables.value.Value;

/** Explicit construction parameters for {@link LevelLogger#create(LoggerConfig)}. */
@Value.Immutable
public abstract class LoggerConfig {
  @Value.Default
  public LogFormat format() {
    return LogFormat.LOGFMT;
  }

  @Value.Default
  public PrintStream output() {
    return System.out;
  }

  @Value.Default
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Logger name used when {@link #format()} is {@link LogFormat#SLF4J}. */
  @Value.Default
  public String slf4jLoggerName() {
    return "signalkit";
  }

  public static LoggerConfig defaults() {
    return ImmutableLoggerConfig.builder().build();
  }

  public static ImmutableLoggerConfig.Builder builder() {
    return ImmutableLoggerConfig.builder();
  }
}
