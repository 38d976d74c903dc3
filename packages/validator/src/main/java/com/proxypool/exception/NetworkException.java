package com.proxypool.exception;

/** Failures binding or starting local network listeners. */
public class NetworkException extends ProxyPoolException {
  public NetworkException(String message) {
    super(ProxyPoolErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(ProxyPoolErrorCode.NETWORK_ERROR, message, cause);
  }
}
