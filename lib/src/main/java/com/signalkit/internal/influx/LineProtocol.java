package com.signalkit.internal.influx;

import com.signalkit.metrics.MeasurementPoint;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * InfluxDB line protocol: {@code measurement[,tag=value...] field=value[,field=value...] nanos}.
 * Tags are written sorted by key, which is the order InfluxDB stores them in.
 */
public final class LineProtocol {
  private LineProtocol() {}

  /**
   * @throws IllegalArgumentException if no field survives encoding (non-finite floats are
   *     dropped), since InfluxDB rejects a point without fields
   */
  public static String encode(MeasurementPoint point) {
    final StringBuilder line = new StringBuilder();
    line.append(escape(point.measurement(), false));

    for (Map.Entry<String, String> tag : new TreeMap<>(point.tags()).entrySet()) {
      line.append(',')
          .append(escape(tag.getKey(), true))
          .append('=')
          .append(escape(tag.getValue(), true));
    }

    boolean isFirstField = true;
    for (Map.Entry<String, Object> field : point.fields().entrySet()) {
      final String encodedValue = encodeFieldValue(field.getValue());
      if (encodedValue == null) {
        continue;
      }
      line.append(isFirstField ? ' ' : ',')
          .append(escape(field.getKey(), true))
          .append('=')
          .append(encodedValue);
      isFirstField = false;
    }
    if (isFirstField) {
      throw new IllegalArgumentException(
          "point for measurement " + point.measurement() + " has no writable fields");
    }

    return line.append(' ').append(epochNanos(point.time())).toString();
  }

  static long epochNanos(Instant time) {
    return TimeUnit.SECONDS.toNanos(time.getEpochSecond()) + time.getNano();
  }

  // Returns null for values that cannot be represented.
  private static String encodeFieldValue(Object value) {
    if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? Double.toString(d) : null;
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger) {
      return value + "i";
    }
    if (value instanceof Number) {
      final double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? Double.toString(d) : null;
    }
    if (value instanceof Boolean) {
      return value.toString();
    }
    return quote(String.valueOf(value));
  }

  // A point never spans lines: line breaks become a backslash followed by n or r.
  private static String quote(String value) {
    return '"'
        + value
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
        + '"';
  }

  // Measurements escape commas and spaces; keys and tag values also escape '='. Line breaks are
  // handled as in quote().
  private static String escape(String value, boolean escapeEquals) {
    final StringBuilder escaped = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == '\n') {
        escaped.append("\\n");
      } else if (c == '\r') {
        escaped.append("\\r");
      } else {
        if (c == ',' || c == ' ' || (escapeEquals && c == '=')) {
          escaped.append('\\');
        }
        escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
