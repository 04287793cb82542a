package com.signalkit.log;

import java.io.Writer;

/**
 * A {@link Writer} that emits every completed line as a {@code msg} field through a {@link
 * LevelLogger}. Useful for APIs that only accept a writer, such as {@code
 * DriverManager.setLogWriter}.
 */
public class LogWriter extends Writer {
  private final LevelLogger logger;
  private final StringBuilder pending = new StringBuilder();
  private boolean isClosed = false;

  public LogWriter(LevelLogger logger) {
    this.logger = logger;
  }

  @Override
  public void write(char[] buffer, int offset, int length) {
    synchronized (lock) {
      if (isClosed) {
        return;
      }
      for (int i = offset; i < offset + length; i++) {
        final char c = buffer[i];
        if (c == '\n') {
          emitPending();
        } else {
          pending.append(c);
        }
      }
    }
  }

  /** Emits a partially written line, if there is one. */
  @Override
  public void flush() {
    synchronized (lock) {
      if (pending.length() > 0) {
        emitPending();
      }
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      flush();
      isClosed = true;
    }
  }

  private void emitPending() {
    int end = pending.length();
    if (end > 0 && pending.charAt(end - 1) == '\r') {
      end--;
    }
    final String line = pending.substring(0, end);
    pending.setLength(0);
    logger.log(LevelLogger.MSG_KEY, line);
  }
}
