package com.proxypool.exception;

/** Missing or invalid configuration. */
public class ConfigException extends ProxyPoolException {
  public ConfigException(String message) {
    super(ProxyPoolErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ProxyPoolErrorCode.CONFIG_ERROR, message, cause);
  }
}
