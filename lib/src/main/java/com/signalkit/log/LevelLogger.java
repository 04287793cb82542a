package com.signalkit.log;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.signalkit.internal.encoding.CallerLocator;
import com.signalkit.internal.encoding.RecordSinks;
import com.signalkit.internal.encoding.Timestamps;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * An immutable structured logger. Every decorating call returns a new logger and leaves the
 * receiver untouched, so loggers can be shared freely across threads:
 *
 * <pre>{@code
 * LevelLogger requestLogger = logger.with("request_id", id);
 * requestLogger.info().log("msg", "accepted", "bytes", size);
 * requestLogger.wrapError(exception).log();
 * }</pre>
 *
 * <p>Only {@link #log(Object...)} has a side effect: it resolves lazy values such as the timestamp
 * and call site and hands the finished {@link LogRecord} to the {@link RecordSink}.
 */
public final class LevelLogger {
  /** Value given to a trailing key that has no value. */
  public static final String MISSING_VALUE = "(MISSING)";

  public static final String TS_KEY = "ts";
  public static final String CALLER_KEY = "caller";
  public static final String MSG_KEY = "msg";
  public static final String STACKTRACE_KEY = "stacktrace";

  private static final LevelLogger NOP = new LevelLogger(RecordSink.NOP, ImmutableList.of(), Optional.empty());

  private final RecordSink sink;
  private final ImmutableList<LogField> fields;
  private final Optional<Level> level;

  private LevelLogger(RecordSink sink, ImmutableList<LogField> fields, Optional<Level> level) {
    this.sink = sink;
    this.fields = fields;
    this.level = level;
  }

  /** Logger with {@code ts} and {@code caller} fields, rendered as configured. */
  public static LevelLogger create(LoggerConfig config) {
    return create(RecordSinks.forConfig(config), config.clock());
  }

  /** Logger with {@code ts} and {@code caller} fields, emitting into a custom sink. */
  public static LevelLogger create(RecordSink sink, Clock clock) {
    final LogValuer timestamp = () -> Timestamps.rfc3339Nano(Instant.now(clock));
    final LogValuer caller = CallerLocator::locate;
    return of(sink).with(TS_KEY, timestamp, CALLER_KEY, caller);
  }

  /** Logfmt on standard output. */
  public static LevelLogger createDefault() {
    return create(LoggerConfig.defaults());
  }

  /**
   * Like {@link #createDefault()}, but switches to the human-readable format when {@link
   * LogFormat#HUMAN_TOGGLE_ENV} is set to a truthy value. Meant for process entry points only.
   */
  public static LevelLogger fromEnvironment() {
    return create(environmentConfig(System::getenv));
  }

  @VisibleForTesting
  static LoggerConfig environmentConfig(Function<String, String> getenv) {
    return LoggerConfig.builder()
        .format(LogFormat.fromHumanToggle(getenv.apply(LogFormat.HUMAN_TOGGLE_ENV)))
        .build();
  }

  /** Logger with no fields at all, emitting into {@code sink}. */
  public static LevelLogger of(RecordSink sink) {
    return new LevelLogger(sink, ImmutableList.of(), Optional.empty());
  }

  /** Logger that accepts every call and discards everything. */
  public static LevelLogger nop() {
    return NOP;
  }

  public LevelLogger with(Object... keyvals) {
    if (keyvals.length == 0) {
      return this;
    }
    return withFields(toFields(keyvals));
  }

  LevelLogger withFields(List<LogField> extra) {
    if (extra.isEmpty()) {
      return this;
    }
    final ImmutableList<LogField> combined =
        ImmutableList.<LogField>builderWithExpectedSize(fields.size() + extra.size())
            .addAll(fields)
            .addAll(extra)
            .build();
    return new LevelLogger(sink, combined, level);
  }

  public LevelLogger debug() {
    return withLevel(Level.DEBUG);
  }

  public LevelLogger info() {
    return withLevel(Level.INFO);
  }

  public LevelLogger warn() {
    return withLevel(Level.WARN);
  }

  public LevelLogger error() {
    return withLevel(Level.ERROR);
  }

  /** Same severity as {@link #error()}. */
  public LevelLogger crit() {
    return withLevel(Level.ERROR);
  }

  private LevelLogger withLevel(Level newLevel) {
    return new LevelLogger(sink, fields, Optional.of(newLevel));
  }

  /**
   * Attaches {@code error} wrapped at this call site, so the record carries a stack trace even
   * for errors created without one. A {@code null} error returns this logger unchanged.
   */
  public LevelLogger wrapError(@Nullable Throwable error) {
    if (error == null) {
      return this;
    }
    return withError(ContextualException.wrap(error, ""));
  }

  /**
   * Appends the error's context pairs, its message under {@code msg} and, when it has one, its
   * stack trace under {@code stacktrace}. The result is always at {@link Level#ERROR}. A {@code
   * null} error returns this logger unchanged.
   */
  public LevelLogger withError(@Nullable Throwable error) {
    if (error == null) {
      return this;
    }
    final ErrorContext context = ErrorContext.extract(error);
    final ImmutableList.Builder<LogField> extra =
        ImmutableList.<LogField>builder()
            .addAll(context.keyvals())
            .add(LogField.of(MSG_KEY, context.message()));
    context.stacktrace().ifPresent(trace -> extra.add(LogField.of(STACKTRACE_KEY, trace)));
    return withFields(extra.build()).error();
  }

  /** Emits one record made of this logger's fields followed by {@code keyvals}. */
  public void log(Object... keyvals) {
    if (sink == RecordSink.NOP) {
      return;
    }
    final ImmutableList.Builder<LogField> resolved =
        ImmutableList.builderWithExpectedSize(fields.size() + (keyvals.length + 1) / 2);
    for (LogField field : fields) {
      resolved.add(field.resolve());
    }
    resolved.addAll(toFields(keyvals));
    sink.emit(
        ImmutableLogRecord.builder()
            .level(level.orElse(Level.INFO))
            .fields(resolved.build())
            .build());
  }

  private static ImmutableList<LogField> toFields(Object[] keyvals) {
    final ImmutableList.Builder<LogField> result =
        ImmutableList.builderWithExpectedSize((keyvals.length + 1) / 2);
    for (int i = 0; i < keyvals.length; i += 2) {
      final String key = String.valueOf(keyvals[i]);
      final Object value = i + 1 < keyvals.length ? keyvals[i + 1] : MISSING_VALUE;
      result.add(LogField.of(key, value));
    }
    return result.build();
  }

  @VisibleForTesting
  ImmutableList<LogField> fields() {
    return fields;
  }

  @VisibleForTesting
  Optional<Level> level() {
    return level;
  }
}
