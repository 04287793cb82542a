package com.signalkit.instrument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.signalkit.log.Level;
import com.signalkit.log.LevelLogger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns data-access callbacks into log records. Timed calls are logged at a severity chosen by
 * how long they took: above {@link #WARN_THRESHOLD} at WARN, above {@link #INFO_THRESHOLD} at
 * INFO, otherwise at DEBUG.
 */
public class CallInstrumentationAdapter {
  public static final Duration WARN_THRESHOLD = Duration.ofMillis(100);
  public static final Duration INFO_THRESHOLD = Duration.ofMillis(50);

  private final LevelLogger logger;

  public CallInstrumentationAdapter(LevelLogger logger) {
    this.logger = logger;
  }

  public void record(InstrumentationEvent event) {
    final LevelLogger eventLogger = logger.with("type", event.category(), "source", event.source());
    event.match(
        new InstrumentationEvent.Cases<Void>() {
          @Override
          public Void timedCall(InstrumentationEvent.TimedCall call) {
            logTimedCall(eventLogger, call);
            return null;
          }

          @Override
          public Void message(InstrumentationEvent.Message message) {
            logMessage(eventLogger, message.values());
            return null;
          }
        });
  }

  /**
   * Untyped entry point for ORM-style print callbacks. With two or more values the first two are
   * the category and the source; {@code sql} expects a duration, a statement and the bound values,
   * {@code log} takes the remaining values as a message. A lone value is logged at INFO as is and
   * any other shape as a rendered dump.
   */
  public void print(Object... values) {
    if (values.length > 1) {
      final String category = String.valueOf(values[0]);
      final String source = String.valueOf(values[1]);
      if (InstrumentationEvent.SQL_CATEGORY.equals(category)
          && values.length >= 4
          && values[2] instanceof Duration
          && values[3] instanceof String) {
        record(
            InstrumentationEvent.timedCall(
                source,
                (Duration) values[2],
                (String) values[3],
                values.length > 4 && values[4] != null
                    ? toLogValues(values[4])
                    : ImmutableList.of()));
        return;
      }
      if (InstrumentationEvent.LOG_CATEGORY.equals(category)) {
        record(
            InstrumentationEvent.message(
                source,
                Arrays.stream(values, 2, values.length).map(LogValue::of).collect(Collectors.toList())));
        return;
      }
    }
    if (values.length == 1) {
      logger.info().log(LevelLogger.MSG_KEY, LogValue.of(values[0]).render());
      return;
    }
    logger.info().log(LevelLogger.MSG_KEY, LogValue.render(toLogValues(values)));
  }

  @VisibleForTesting
  static Level levelFor(Duration elapsed) {
    if (elapsed.compareTo(WARN_THRESHOLD) > 0) {
      return Level.WARN;
    }
    if (elapsed.compareTo(INFO_THRESHOLD) > 0) {
      return Level.INFO;
    }
    return Level.DEBUG;
  }

  private static void logTimedCall(LevelLogger eventLogger, InstrumentationEvent.TimedCall call) {
    final long elapsedMicros = TimeUnit.NANOSECONDS.toMicros(call.duration().toNanos());
    final ImmutableList.Builder<Object> keyvals =
        ImmutableList.builder().add("query_us", elapsedMicros, "query", call.statement());
    if (!call.boundValues().isEmpty()) {
      keyvals.add("values", LogValue.render(call.boundValues()));
    }
    atLevel(eventLogger, levelFor(call.duration())).log(keyvals.build().toArray());
  }

  private static void logMessage(LevelLogger eventLogger, List<LogValue> values) {
    if (values.size() != 1) {
      eventLogger.info().log(LevelLogger.MSG_KEY, LogValue.render(values));
      return;
    }
    values
        .get(0)
        .match(
            new LogValue.Cases<Void>() {
              @Override
              public Void error(Throwable error) {
                eventLogger.error().log(LevelLogger.MSG_KEY, error);
                return null;
              }

              @Override
              public Void text(String text) {
                eventLogger.info().log(LevelLogger.MSG_KEY, text);
                return null;
              }

              @Override
              public Void duration(Duration duration) {
                eventLogger.info().log(LevelLogger.MSG_KEY, duration.toString());
                return null;
              }

              @Override
              public Void number(Number number) {
                eventLogger.info().log(LevelLogger.MSG_KEY, number.toString());
                return null;
              }
            });
  }

  private static LevelLogger atLevel(LevelLogger eventLogger, Level level) {
    switch (level) {
      case DEBUG:
        return eventLogger.debug();
      case INFO:
        return eventLogger.info();
      case WARN:
        return eventLogger.warn();
      case ERROR:
        return eventLogger.error();
      default:
        throw new IllegalStateException("Unhandled level " + level);
    }
  }

  private static List<LogValue> toLogValues(Object raw) {
    final Stream<?> items;
    if (raw instanceof Collection) {
      items = ((Collection<?>) raw).stream();
    } else if (raw instanceof Object[]) {
      items = Arrays.stream((Object[]) raw);
    } else {
      items = Stream.of(raw);
    }
    return items.map(LogValue::of).collect(Collectors.toList());
  }
}
