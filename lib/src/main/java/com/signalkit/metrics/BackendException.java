package com.signalkit.metrics;

import java.util.OptionalInt;

/** A backend round trip failed. */
public class BackendException extends Exception {
  private static final long serialVersionUID = 1L;

  private final OptionalInt statusCode;

  public BackendException(String message) {
    super(message);
    this.statusCode = OptionalInt.empty();
  }

  public BackendException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = OptionalInt.empty();
  }

  public BackendException(String message, int statusCode) {
    super(message);
    this.statusCode = OptionalInt.of(statusCode);
  }

  /** HTTP status of the failed response, when the backend answered at all. */
  public OptionalInt statusCode() {
    return statusCode;
  }
}
