package com.signalkit.metrics;

/** The configuration string is not a URL at all. */
public class UnparseableUrlException extends BackendConfigException {
  private static final long serialVersionUID = 1L;

  public UnparseableUrlException(String config, Throwable cause) {
    super(String.format("couldn't parse influxdb url %s: %s", config, cause.getMessage()), config, cause);
  }

  public UnparseableUrlException(String config) {
    super(String.format("couldn't parse influxdb url %s", config), config);
  }
}
