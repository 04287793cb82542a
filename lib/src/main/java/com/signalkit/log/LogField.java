package com.signalkit.log;

import javax.annotation.Nullable;
import org.immutables.value.Value;

/** A single key-value pair of a log record. */
@Value.Immutable
public abstract class LogField {
  @Value.Parameter
  public abstract String key();

  @Value.Parameter
  @Nullable
  public abstract Object value();

  public static LogField of(String key, @Nullable Object value) {
    return ImmutableLogField.of(key, value);
  }

  LogField resolve() {
    final Object value = value();
    if (value instanceof LogValuer) {
      return of(key(), ((LogValuer) value).value());
    }
    return this;
  }
}
