package com.proxypool.proxy;

/** Why a probe did not succeed. Carried as data in a {@link ProbeResult}, never thrown. */
public enum ProbeErrorKind {
  TIMEOUT,
  CONNECTION_REFUSED,
  CONNECTION_ERROR,
  /** The peer did not speak the expected protocol (TLS failure, bad proxy reply). */
  PROTOCOL_MISMATCH,
  UNSUPPORTED_SCHEME,
  /** The echo endpoint saw a different source address than the proxy's. */
  IP_MISMATCH,
  HTTP_STATUS,
  INTERNAL
}
