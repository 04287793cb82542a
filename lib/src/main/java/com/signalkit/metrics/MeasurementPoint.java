package com.signalkit.metrics;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * One data point of one submission. Tags and fields are copied on construction, so callers may
 * reuse their maps as soon as the submitting call returns.
 */
@Value.Immutable
public abstract class MeasurementPoint {
  public static final String VALUE_FIELD = "value";

  public abstract String measurement();

  public abstract Number value();

  public abstract ImmutableMap<String, String> tags();

  public abstract ImmutableMap<String, Object> fields();

  public abstract Instant time();

  @Value.Check
  protected void check() {
    Preconditions.checkState(
        value().equals(fields().get(VALUE_FIELD)),
        "field '%s' must hold the point's value",
        VALUE_FIELD);
  }

  /**
   * Builds a point whose {@code value} field is {@code value}, overriding any caller-supplied
   * {@code value} field. Null maps are empty; entries with null values are dropped.
   */
  public static MeasurementPoint of(
      String measurement,
      Number value,
      @Nullable Map<String, String> tags,
      @Nullable Map<String, ?> fields,
      Instant at) {
    final Map<String, Object> allFields = new LinkedHashMap<>();
    if (fields != null) {
      fields.forEach(
          (key, fieldValue) -> {
            if (key != null && fieldValue != null) {
              allFields.put(key, fieldValue);
            }
          });
    }
    allFields.put(VALUE_FIELD, value);

    final ImmutableMap.Builder<String, String> allTags = ImmutableMap.builder();
    if (tags != null) {
      tags.forEach(
          (key, tagValue) -> {
            if (key != null && tagValue != null) {
              allTags.put(key, tagValue);
            }
          });
    }

    return ImmutableMeasurementPoint.builder()
        .measurement(measurement)
        .value(value)
        .tags(allTags.build())
        .fields(allFields)
        .time(at)
        .build();
  }
}
