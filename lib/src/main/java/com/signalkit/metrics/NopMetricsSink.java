package com.signalkit.metrics;

import java.time.Instant;
import java.util.Map;

/** Discards every measurement. */
public final class NopMetricsSink implements MetricsSink {
  public static final NopMetricsSink INSTANCE = new NopMetricsSink();

  private NopMetricsSink() {}

  @Override
  public void insertRecord(
      String measurement, Number value, Map<String, String> tags, Map<String, ?> fields, Instant at) {}

  @Override
  public void count(String measurement, double value, Map<String, String> tags, Map<String, ?> fields) {}

  @Override
  public void close() {}
}
