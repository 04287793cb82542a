package com.signalkit.metrics;

/** The metrics backend URL could not be used; no sink was created. */
public abstract class BackendConfigException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String config;

  protected BackendConfigException(String message, String config, Throwable cause) {
    super(message, cause);
    this.config = config;
  }

  protected BackendConfigException(String message, String config) {
    super(message);
    this.config = config;
  }

  /** The configuration string as given. */
  public String config() {
    return config;
  }
}
