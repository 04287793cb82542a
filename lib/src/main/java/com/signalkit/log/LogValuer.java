package com.signalkit.log;

/**
 * A field value computed at emission time rather than when the field is attached. Used for the
 * timestamp and call site that every default logger carries.
 */
@FunctionalInterface
public interface LogValuer {
  Object value();
}
