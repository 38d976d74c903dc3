package com.proxypool.exception;

/** Stable error codes surfaced in logs and control-plane error bodies. */
public enum ProxyPoolErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  NETWORK_ERROR,
  STATE_ERROR,
  TRANSPORT_ERROR,
  VALIDATION_ERROR
}
