package com.signalkit.instrument;

import com.signalkit.internal.encoding.ValueRenderer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A value carried by an instrumentation event. The set of variants is closed; callers branch on
 * it with {@link #match(Cases)} rather than {@code instanceof}.
 */
public abstract class LogValue {
  public interface Cases<R> {
    R error(Throwable error);

    R text(String text);

    R duration(Duration duration);

    R number(Number number);
  }

  private LogValue() {}

  public abstract <R> R match(Cases<R> cases);

  /** Text form used in log fields. */
  public abstract String render();

  public static LogValue error(Throwable error) {
    return new ErrorValue(error);
  }

  public static LogValue text(String text) {
    return new TextValue(text);
  }

  public static LogValue duration(Duration duration) {
    return new DurationValue(duration);
  }

  public static LogValue number(Number number) {
    return new NumberValue(number);
  }

  /** Classifies an untyped value. Anything unrecognized, {@code null} included, becomes text. */
  public static LogValue of(@Nullable Object raw) {
    if (raw instanceof LogValue) {
      return (LogValue) raw;
    }
    if (raw instanceof Throwable) {
      return error((Throwable) raw);
    }
    if (raw instanceof Duration) {
      return duration((Duration) raw);
    }
    if (raw instanceof Number) {
      return number((Number) raw);
    }
    return text(ValueRenderer.render(raw));
  }

  public static String render(List<LogValue> values) {
    return values.stream().map(LogValue::render).collect(Collectors.joining(", ", "[", "]"));
  }

  @Override
  public String toString() {
    return render();
  }

  static final class ErrorValue extends LogValue {
    private final Throwable error;

    ErrorValue(Throwable error) {
      this.error = Objects.requireNonNull(error);
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.error(error);
    }

    @Override
    public String render() {
      return ValueRenderer.errorMessage(error);
    }
  }

  static final class TextValue extends LogValue {
    private final String text;

    TextValue(String text) {
      this.text = Objects.requireNonNull(text);
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.text(text);
    }

    @Override
    public String render() {
      return text;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TextValue && ((TextValue) other).text.equals(text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }
  }

  static final class DurationValue extends LogValue {
    private final Duration duration;

    DurationValue(Duration duration) {
      this.duration = Objects.requireNonNull(duration);
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.duration(duration);
    }

    @Override
    public String render() {
      return duration.toString();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof DurationValue && ((DurationValue) other).duration.equals(duration);
    }

    @Override
    public int hashCode() {
      return duration.hashCode();
    }
  }

  static final class NumberValue extends LogValue {
    private final Number number;

    NumberValue(Number number) {
      this.number = Objects.requireNonNull(number);
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.number(number);
    }

    @Override
    public String render() {
      return number.toString();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof NumberValue && ((NumberValue) other).number.equals(number);
    }

    @Override
    public int hashCode() {
      return number.hashCode();
    }
  }
}
