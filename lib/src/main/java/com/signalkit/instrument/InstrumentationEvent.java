package com.signalkit.instrument;

import java.time.Duration;
import java.util.List;
import org.immutables.value.Value;

/** A completed call reported by a data-access layer, ready to become a log record. */
@Value.Enclosing
public abstract class InstrumentationEvent {
  public static final String SQL_CATEGORY = "sql";
  public static final String LOG_CATEGORY = "log";

  public interface Cases<R> {
    R timedCall(TimedCall call);

    R message(Message message);
  }

  /** Kind of event, such as {@code sql}. */
  public abstract String category();

  /** Where the event was raised, typically a file and line in the caller's code. */
  public abstract String source();

  public abstract <R> R match(Cases<R> cases);

  /** A statement and how long it took. */
  @Value.Immutable
  public abstract static class TimedCall extends InstrumentationEvent {
    public abstract Duration duration();

    public abstract String statement();

    public abstract List<LogValue> boundValues();

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.timedCall(this);
    }
  }

  /** Free-form values, such as an error or a notice from the driver. */
  @Value.Immutable
  public abstract static class Message extends InstrumentationEvent {
    public abstract List<LogValue> values();

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.message(this);
    }
  }

  public static TimedCall timedCall(
      String source, Duration duration, String statement, List<LogValue> boundValues) {
    return ImmutableInstrumentationEvent.TimedCall.builder()
        .category(SQL_CATEGORY)
        .source(source)
        .duration(duration)
        .statement(statement)
        .boundValues(boundValues)
        .build();
  }

  public static Message message(String source, List<LogValue> values) {
    return ImmutableInstrumentationEvent.Message.builder()
        .category(LOG_CATEGORY)
        .source(source)
        .values(values)
        .build();
  }
}
