package com.proxypool.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of an error. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetails(
    String type,
    String message,
    ProxyPoolErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
