package com.proxypool.exception;

/**
 * A call between a worker and the coordinator could not be completed: connection failure, timeout
 * or an unexpected HTTP status from the control plane.
 */
public class TransportException extends ProxyPoolException {
  public TransportException(String message) {
    super(ProxyPoolErrorCode.TRANSPORT_ERROR, message);
  }

  public TransportException(String message, Throwable cause) {
    super(ProxyPoolErrorCode.TRANSPORT_ERROR, message, cause);
  }
}
