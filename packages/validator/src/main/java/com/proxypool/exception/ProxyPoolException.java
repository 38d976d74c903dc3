package com.proxypool.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the proxy pool. Carries a {@link ProxyPoolErrorCode} and an optional
 * context map that ends up in {@link ErrorDetails} when the error is reported over the wire.
 */
public class ProxyPoolException extends RuntimeException {
  private final ProxyPoolErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ProxyPoolException(ProxyPoolErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ProxyPoolException(ProxyPoolErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ProxyPoolErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public ProxyPoolException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
