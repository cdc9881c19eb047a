package com.mk.fx.qa.burst.execution.executors;

import com.mk.fx.qa.burst.execution.metrics.BurstReport;
import com.mk.fx.qa.burst.execution.model.RequestOutcome;
import com.mk.fx.qa.burst.rest.HttpMethod;
import com.mk.fx.qa.burst.rest.LoadHttpClient;
import com.mk.fx.qa.burst.rest.Request;
import com.mk.fx.qa.burst.rest.TransportException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Performs a single POST attempt, classifies it, records it in the run report and publishes the
 * outcome on the matching channel of its burst.
 */
@Slf4j
public class BurstWorker {

  public static final String API_KEY_HEADER = "X-Api-Key";
  public static final String CONTENT_TYPE = "application/json; charset=UTF-8";

  private final LoadHttpClient client;
  private final BurstReport report;
  private final Map<String, String> headers;
  private final BooleanSupplier cancellationRequested;
  private final Clock clock;

  public BurstWorker(
      LoadHttpClient client,
      String apiKey,
      BurstReport report,
      BooleanSupplier cancellationRequested) {
    this(client, apiKey, report, cancellationRequested, Clock.systemDefaultZone());
  }

  BurstWorker(
      LoadHttpClient client,
      String apiKey,
      BurstReport report,
      BooleanSupplier cancellationRequested,
      Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.report = Objects.requireNonNull(report, "report");
    this.cancellationRequested =
        Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.headers = Map.of("Content-Type", CONTENT_TYPE, API_KEY_HEADER, apiKey != null ? apiKey : "");
  }

  /**
   * Runs the attempt for {@code sequenceIndex} of {@code burst}.
   *
   * @return the published outcome, or empty if cancellation was requested before the attempt
   */
  public Optional<RequestOutcome> run(
      int burst, int sequenceIndex, OutcomeChannel successChannel, OutcomeChannel errorChannel) {
    if (cancellationRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
      log.debug("Burst {} request #{} skipped: run cancelled", burst, sequenceIndex);
      return Optional.empty();
    }

    RequestOutcome outcome;
    try {
      var response = client.execute(buildRequest(sequenceIndex));
      outcome = RequestOutcome.ofResponse(burst, sequenceIndex, response);
      if (outcome.isSuccess()) {
        report.recordSuccess();
      } else {
        report.recordUnacceptedStatus(response.getStatusCode());
      }
    } catch (TransportException e) {
      outcome = RequestOutcome.ofError(burst, sequenceIndex, e);
      report.recordTransportFailure(e);
    } catch (RuntimeException e) {
      // still an initiated attempt, so it is counted as failed
      log.error(
          "Burst {} request #{} failed unexpectedly: {}", burst, sequenceIndex, e.getMessage(), e);
      outcome = RequestOutcome.ofError(burst, sequenceIndex, e);
      report.recordTransportFailure(e);
    }

    if (outcome.isSuccess()) {
      successChannel.publish(outcome);
    } else {
      errorChannel.publish(outcome);
    }
    return Optional.of(outcome);
  }

  Request buildRequest(int sequenceIndex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "request #" + sequenceIndex);
    body.put("date", OffsetDateTime.now(clock).toString());
    body.put("requests_sent", sequenceIndex);

    var request = new Request();
    request.setMethod(HttpMethod.POST);
    request.setHeaders(headers);
    request.setBody(body);
    return request;
  }
}
