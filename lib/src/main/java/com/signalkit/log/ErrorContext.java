package com.signalkit.log;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.immutables.value.Value;

/** What {@link LevelLogger#withError(Throwable)} reads out of an error. */
@Value.Immutable
public abstract class ErrorContext {
  public abstract String message();

  public abstract ImmutableList<LogField> keyvals();

  public abstract Optional<String> stacktrace();

  /**
   * Reads the cause chain of {@code error} without modifying it. Context pairs of every {@link
   * ContextualException} are collected outermost first; messages are joined with {@code ": "},
   * skipping empty ones and those the JDK derived from the cause.
   */
  public static ErrorContext extract(Throwable error) {
    Preconditions.checkNotNull(error, "error");
    final List<Throwable> chain = ExceptionUtils.getThrowableList(error);

    final ImmutableList.Builder<LogField> keyvals = ImmutableList.builder();
    for (Throwable throwable : chain) {
      if (throwable instanceof ContextualException) {
        keyvals.addAll(((ContextualException) throwable).context());
      }
    }

    final String joined =
        chain.stream()
            .map(ErrorContext::ownMessage)
            .flatMap(Optional::stream)
            .collect(Collectors.joining(": "));
    final String message = joined.isEmpty() ? chain.get(chain.size() - 1).getClass().getName() : joined;

    final boolean hasFrames = chain.stream().anyMatch(t -> t.getStackTrace().length > 0);
    final Optional<String> stacktrace =
        hasFrames
            ? Optional.of(ExceptionUtils.getStackTrace(error)).filter(s -> !s.isEmpty())
            : Optional.empty();

    return ImmutableErrorContext.builder()
        .message(message)
        .keyvals(keyvals.build())
        .stacktrace(stacktrace)
        .build();
  }

  private static Optional<String> ownMessage(Throwable throwable) {
    final String message = throwable.getMessage();
    if (message == null || message.isEmpty()) {
      return Optional.empty();
    }
    final Throwable cause = throwable.getCause();
    if (cause != null && message.equals(cause.toString())) {
      return Optional.empty();
    }
    return Optional.of(message);
  }
}
