package com.signalkit.log;

import java.util.Locale;
import javax.annotation.Nullable;

/** How records are rendered. */
public enum LogFormat {
  /** {@code key=value} pairs on one line. */
  LOGFMT,
  /** Timestamp, level and caller up front, then the message and remaining pairs. */
  HUMAN,
  /** One JSON object per line. */
  JSON,
  /** Handed to SLF4J at the mapped level, rendered as logfmt. */
  SLF4J;

  /** Environment variable that switches {@link LevelLogger#fromEnvironment()} to {@link #HUMAN}. */
  public static final String HUMAN_TOGGLE_ENV = "SIGNALKIT_LOG_HUMAN";

  /**
   * Parses the human-readable toggle. Absent, empty, {@code false} and {@code 0} (any case) select
   * {@link #LOGFMT}; every other value selects {@link #HUMAN}.
   */
  public static LogFormat fromHumanToggle(@Nullable String toggle) {
    if (toggle == null) {
      return LOGFMT;
    }
    final String normalized = toggle.toLowerCase(Locale.ROOT);
    if (normalized.isEmpty() || normalized.equals("false") || normalized.equals("0")) {
      return LOGFMT;
    }
    return HUMAN;
  }
}
