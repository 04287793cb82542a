package com.signalkit.metrics;

import com.google.common.collect.ImmutableMap;
import com.signalkit.internal.encoding.ValueRenderer;
import java.time.Instant;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Fire-and-forget destination for numeric measurements. No method reports whether the backend
 * accepted the point and none throws because the backend failed; failures are logged instead.
 */
public interface MetricsSink extends AutoCloseable {
  String ERROR_TAG = "error";

  /**
   * Submits one point whose {@code value} field is {@code value}.
   *
   * @param measurement name of the measurement
   * @param value the numeric value, also stored as the {@code value} field
   * @param tags indexed string dimensions, or {@code null} for none
   * @param fields additional scalar fields, or {@code null} for none
   * @param at timestamp of the point
   */
  void insertRecord(
      String measurement,
      Number value,
      @Nullable Map<String, String> tags,
      @Nullable Map<String, ?> fields,
      Instant at);

  /** {@link #insertRecord} stamped with the current time. */
  void count(
      String measurement,
      double value,
      @Nullable Map<String, String> tags,
      @Nullable Map<String, ?> fields);

  /** Counts {@code value} with the error's message stored in the {@code error} tag. */
  default void countError(String measurement, double value, Throwable error) {
    count(measurement, value, ImmutableMap.of(ERROR_TAG, ValueRenderer.errorMessage(error)), null);
  }

  /** Counts {@code value} with no tags and no extra fields. */
  default void countSimple(String measurement, double value) {
    count(measurement, value, null, null);
  }

  /** Stops background work and releases the backend. */
  @Override
  void close();
}
