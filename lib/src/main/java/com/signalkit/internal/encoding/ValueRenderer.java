package com.signalkit.internal.encoding;

import java.util.Optional;
import javax.annotation.Nullable;

public final class ValueRenderer {
  private ValueRenderer() {}

  public static final String NULL = "null";

  /** Text form of a field value. Throwables render as their message, like an error string. */
  public static String render(@Nullable Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof Throwable) {
      return errorMessage((Throwable) value);
    }
    return String.valueOf(value);
  }

  public static String errorMessage(Throwable error) {
    return Optional.ofNullable(error.getMessage())
        .filter(message -> !message.isEmpty())
        .orElse(error.getClass().getName());
  }
}
