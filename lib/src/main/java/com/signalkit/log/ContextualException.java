package com.signalkit.log;

import com.google.common.collect.ImmutableList;

/**
 * Carries structured key-value context alongside a cause. The pairs end up as fields when the
 * exception passes through {@link LevelLogger#withError(Throwable)}.
 *
 * <pre>{@code
 * throw ContextualException.wrap(exception, "loading order", "order_id", orderId);
 * }</pre>
 */
public class ContextualException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<LogField> context;

  public ContextualException(String message, Throwable cause, Object... keyvals) {
    super(message, cause);
    final ImmutableList.Builder<LogField> pairs = ImmutableList.builder();
    for (int i = 0; i < keyvals.length; i += 2) {
      final Object value = i + 1 < keyvals.length ? keyvals[i + 1] : LevelLogger.MISSING_VALUE;
      pairs.add(LogField.of(String.valueOf(keyvals[i]), value));
    }
    this.context = pairs.build();
  }

  public static ContextualException wrap(Throwable cause, String message, Object... keyvals) {
    return new ContextualException(message, cause, keyvals);
  }

  public ImmutableList<LogField> context() {
    return context;
  }
}
