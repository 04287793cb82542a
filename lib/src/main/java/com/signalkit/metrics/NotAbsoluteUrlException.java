package com.signalkit.metrics;

/** The configuration string is a URL, but lacks a scheme or a host. */
public class NotAbsoluteUrlException extends BackendConfigException {
  private static final long serialVersionUID = 1L;

  public NotAbsoluteUrlException(String config) {
    super(String.format("influxdb monitoring url %s not absolute url", config), config);
  }
}
