package com.proxypool.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** One recorded check of one proxy. */
public record CheckHistoryEntry(
    @JsonProperty("proxy_id") String proxyId,
    @JsonProperty("is_working") boolean working,
    @JsonProperty("response_time_ms") Long responseTimeMs,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("check_method") String checkMethod,
    @JsonProperty("checked_at") Instant checkedAt) {}
