package com.signalkit;

/** Library-wide constants. */
public final class Signalkit {
  /** The version of the signalkit library. */
  public static final String VERSION = "0.1.0";

  private Signalkit() {}
}
