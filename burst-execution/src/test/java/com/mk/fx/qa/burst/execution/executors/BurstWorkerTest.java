package com.mk.fx.qa.burst.execution.executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.burst.execution.metrics.BurstReport;
import com.mk.fx.qa.burst.execution.model.OutcomeType;
import com.mk.fx.qa.burst.execution.support.TargetServer;
import com.mk.fx.qa.burst.rest.JsonUtil;
import com.mk.fx.qa.burst.rest.LoadHttpClient;
import com.mk.fx.qa.burst.rest.TransportException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BurstWorkerTest {

  private final BurstReport report = new BurstReport();
  private final OutcomeChannel successChannel = new OutcomeChannel("success");
  private final OutcomeChannel errorChannel = new OutcomeChannel("error");

  private BurstWorker worker(String url) {
    return new BurstWorker(
        new LoadHttpClient(url, Duration.ofSeconds(1), Duration.ofSeconds(5), Map.of()),
        "api-key-123",
        report,
        () -> false,
        Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC));
  }

  @Test
  void acceptedStatus_publishesSuccessAndCountsIt() throws Exception {
    try (var server = TargetServer.respondingWith(201)) {
      var outcome = worker(server.url()).run(1, 3, successChannel, errorChannel).orElseThrow();

      assertEquals(OutcomeType.SUCCESS, outcome.type());
      assertEquals(201, outcome.response().getStatusCode());
      assertEquals(1, report.totalRequests());
      assertEquals(1, report.totalSuccess());
      assertEquals(0, report.totalFail());

      successChannel.close();
      errorChannel.close();
      assertEquals(3, successChannel.take().orElseThrow().sequenceIndex());
      assertTrue(errorChannel.take().isEmpty());
    }
  }

  @Test
  void request_carriesHeadersAndJsonBody() throws Exception {
    try (var server = TargetServer.respondingWith(200)) {
      worker(server.url()).run(1, 2, successChannel, errorChannel);

      var received = server.received().get(0);
      assertEquals("application/json; charset=UTF-8", received.contentType());
      assertEquals("api-key-123", received.apiKey());
      JsonNode body = JsonUtil.mapper().readTree(received.body());
      assertEquals("request #2", body.get("name").asText());
      assertEquals(2, body.get("requests_sent").asInt());
      assertEquals("2024-05-01T10:15:30Z", body.get("date").asText());
    }
  }

  @Test
  void serverError_publishesFailureWithResponse() throws Exception {
    try (var server = TargetServer.respondingWith(500)) {
      var outcome = worker(server.url()).run(1, 1, successChannel, errorChannel).orElseThrow();

      assertEquals(OutcomeType.FAIL, outcome.type());
      assertNotNull(outcome.response());
      assertNull(outcome.error());
      assertEquals(1, report.totalFail());
      assertEquals(0, report.totalSuccess());
      assertEquals(1L, report.failureBreakdown().get("HTTP_500"));

      errorChannel.close();
      assertEquals(500, errorChannel.take().orElseThrow().response().getStatusCode());
    }
  }

  @Test
  void unreachableTarget_publishesTransportErrorWithoutResponse() throws Exception {
    var outcome =
        worker("http://127.0.0.1:1/post").run(1, 1, successChannel, errorChannel).orElseThrow();

    assertEquals(OutcomeType.FAIL, outcome.type());
    assertNull(outcome.response());
    assertInstanceOf(TransportException.class, outcome.error());
    assertEquals(1, report.totalRequests());
    assertEquals(1, report.totalFail());
    assertEquals(1L, report.failureBreakdown().get("CONNECTION_REFUSED"));
  }

  @Test
  void unexpectedClientError_isCountedAsFailedAttempt() throws Exception {
    var client = mock(LoadHttpClient.class);
    when(client.execute(any())).thenThrow(new IllegalArgumentException("invalid URI scheme"));
    var failing = new BurstWorker(client, "k", report, () -> false);

    var outcome = failing.run(1, 1, successChannel, errorChannel).orElseThrow();

    assertEquals(OutcomeType.FAIL, outcome.type());
    assertNull(outcome.response());
    assertInstanceOf(IllegalArgumentException.class, outcome.error());
    assertEquals(1, report.totalRequests());
    assertEquals(1, report.totalFail());
    assertEquals(1L, report.failureBreakdown().get("IllegalArgumentException"));

    errorChannel.close();
    assertEquals(1, errorChannel.take().orElseThrow().sequenceIndex());
  }

  @Test
  void cancelledRun_skipsTheAttempt() {
    var cancelled =
        new BurstWorker(
            new LoadHttpClient("http://127.0.0.1:1/post", Map.of()), "k", report, () -> true);

    assertTrue(cancelled.run(1, 1, successChannel, errorChannel).isEmpty());
    assertEquals(0, report.totalRequests());
  }
}
