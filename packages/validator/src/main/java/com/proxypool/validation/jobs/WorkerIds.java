package com.proxypool.validation.jobs;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerIds {
  private WorkerIds() {}

  /** {@code worker-<hostname>-<8 hex chars>} */
  public static String generate() {
    return "worker-%s-%s".formatted(hostname(), UUID.randomUUID().toString().substring(0, 8));
  }

  public static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }
}
