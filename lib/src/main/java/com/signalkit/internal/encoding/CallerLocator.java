package com.signalkit.internal.encoding;

import com.google.common.collect.ImmutableSet;
import java.util.Optional;

/**
 * Resolves the {@code File.java:line} of the code that called into the logger. Frames belonging
 * to the logger itself, and to {@code java.io} writers sitting in front of {@code LogWriter}, are
 * skipped so the result never names a wrapper.
 */
public final class CallerLocator {
  private CallerLocator() {}

  public static final String UNKNOWN = "???";

  private static final StackWalker WALKER = StackWalker.getInstance();

  private static final ImmutableSet<String> SKIPPED_CLASSES =
      ImmutableSet.of(
          CallerLocator.class.getName(),
          "com.signalkit.log.LevelLogger",
          "com.signalkit.log.LogField",
          "com.signalkit.log.ImmutableLogField",
          "com.signalkit.log.LogWriter");

  private static final ImmutableSet<String> SKIPPED_PREFIXES = ImmutableSet.of("java.io.");

  public static String locate() {
    return WALKER
        .walk(frames -> frames.filter(frame -> !isSkipped(frame.getClassName())).findFirst())
        .map(CallerLocator::format)
        .orElse(UNKNOWN);
  }

  private static boolean isSkipped(String className) {
    return SKIPPED_CLASSES.contains(className)
        || SKIPPED_PREFIXES.stream().anyMatch(className::startsWith);
  }

  private static String format(StackWalker.StackFrame frame) {
    final String fileName =
        Optional.ofNullable(frame.getFileName())
            .orElse(frame.getClassName().substring(frame.getClassName().lastIndexOf('.') + 1));
    return fileName + ":" + frame.getLineNumber();
  }
}
