package com.proxypool.exception;

/** A component was used before it was initialized, or after it was shut down. */
public class StateException extends ProxyPoolException {
  public StateException(String message) {
    super(ProxyPoolErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(ProxyPoolErrorCode.STATE_ERROR, message, cause);
  }
}
