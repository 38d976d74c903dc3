package com.proxypool.proxy;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxypool.utility.JacksonUtility;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ProbeResultTest {
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  @Test
  void serializesWithSnakeCaseWireNames() throws Exception {
    ProbeResult result =
        ProbeResult.builder(ProxyRecord.of("p-1", "10.0.0.1", 1080, "socks5"))
            .failed(ProbeErrorKind.CONNECTION_REFUSED, "Connection refused")
            .httpsFailed("not attempted")
            .checkTime(Instant.parse("2024-01-01T00:00:00Z"))
            .checkMethod("socket")
            .workerId("w1")
            .build();

    JsonNode json = mapper.valueToTree(result);

    assertEquals("p-1", json.path("proxy_id").asText());
    assertFalse(json.path("is_working").asBoolean(true));
    assertEquals("CONNECTION_REFUSED", json.path("error_kind").asText());
    assertEquals("socket", json.path("check_method").asText());
    assertEquals("w1", json.path("worker_id").asText());
    assertFalse(json.has("working"));
    assertEquals(result, mapper.treeToValue(json, ProbeResult.class));
  }

  @Test
  void proxyStatusUsesLowercaseWireForm() throws Exception {
    ProxyRecord record =
        mapper.readValue(
            "{\"id\":\"a\",\"ip\":\"1.2.3.4\",\"port\":80,"
                + "\"type\":\"http\",\"status\":\"inactive\"}",
            ProxyRecord.class);

    assertEquals(ProxyStatus.INACTIVE, record.status());
    assertEquals("inactive", mapper.valueToTree(record).path("status").asText());
    assertEquals(
        ProxyStatus.UNTESTED,
        mapper.readValue("{\"id\":\"b\",\"ip\":\"h\",\"port\":1}", ProxyRecord.class).status());
  }
}
