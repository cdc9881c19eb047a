package com.mk.fx.qa.burst.execution.metrics;

import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

final class FailureTracker {

  private final Map<String, AtomicLong> breakdown = new ConcurrentHashMap<>();

  void recordStatus(int statusCode) {
    increment("HTTP_" + statusCode);
  }

  void recordTransportFailure(Throwable t) {
    increment(classifyError(t));
  }

  Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new HashMap<>();
    for (var e : breakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  private void increment(String key) {
    breakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  static String classifyError(Throwable t) {
    if (t == null) return "UNKNOWN";
    Throwable rootCause = t;
    while (true) {
      // connect timeouts carry a ConnectException cause, so timeouts win over the root cause
      if (rootCause instanceof HttpConnectTimeoutException) return "CONNECT_TIMEOUT";
      if (rootCause instanceof HttpTimeoutException) return "HTTP_TIMEOUT";
      if (rootCause.getCause() == null) break;
      rootCause = rootCause.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "InterruptedException" -> "INTERRUPTED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }
}
