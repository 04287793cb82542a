package com.signalkit.log;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A materialized log record: one severity plus the ordered fields of the emitting logger and of
 * the terminal {@link LevelLogger#log(Object...)} call. Lazy values are already resolved.
 */
@Value.Immutable
public abstract class LogRecord {
  public abstract Level level();

  public abstract ImmutableList<LogField> fields();

  /** Returns the value of the first field named {@code key}, if any. */
  public Optional<Object> firstValue(String key) {
    return fields().stream()
        .filter(field -> field.key().equals(key))
        .findFirst()
        .map(LogField::value);
  }
}
