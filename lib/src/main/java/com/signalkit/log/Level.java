package com.signalkit.log;

/** Severity of a log record, lowest first. */
public enum Level {
  DEBUG("debug"),
  INFO("info"),
  WARN("warn"),
  ERROR("error");

  private final String text;

  Level(final String text) {
    this.text = text;
  }

  public String toWireString() {
    return text;
  }
}
