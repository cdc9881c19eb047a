package com.mk.fx.qa.burst.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import javax.net.ssl.SSLException;
import org.junit.jupiter.api.Test;

class FailureTrackerTest {

  @Test
  void classifyError_usesRootCause() {
    assertEquals(
        "CONNECTION_REFUSED",
        FailureTracker.classifyError(new RuntimeException("wrap", new ConnectException("no"))));
    assertEquals("UNKNOWN_HOST", FailureTracker.classifyError(new UnknownHostException("nohost")));
    assertEquals("SOCKET_TIMEOUT", FailureTracker.classifyError(new SocketTimeoutException()));
    assertEquals("SSL_ERROR", FailureTracker.classifyError(new SSLException("ssl")));
    assertEquals("IllegalStateException", FailureTracker.classifyError(new IllegalStateException()));
    assertEquals("UNKNOWN", FailureTracker.classifyError(null));
  }

  @Test
  void classifyError_prefersTimeoutsOverTheirConnectCause() {
    var connectTimeout = new HttpConnectTimeoutException("HTTP connect timed out");
    connectTimeout.initCause(new ConnectException("HTTP connect timed out"));

    assertEquals(
        "CONNECT_TIMEOUT",
        FailureTracker.classifyError(new RuntimeException("wrap", connectTimeout)));
    assertEquals(
        "HTTP_TIMEOUT",
        FailureTracker.classifyError(
            new RuntimeException("wrap", new HttpTimeoutException("request timed out"))));
  }

  @Test
  void breakdownSnapshot_isDetachedCopy() {
    var tracker = new FailureTracker();
    tracker.recordStatus(503);
    var snapshot = tracker.breakdownSnapshot();
    tracker.recordStatus(503);
    assertEquals(1L, snapshot.get("HTTP_503"));
    assertEquals(2L, tracker.breakdownSnapshot().get("HTTP_503"));
    assertThrows(UnsupportedOperationException.class, () -> snapshot.put("x", 1L));
  }
}
