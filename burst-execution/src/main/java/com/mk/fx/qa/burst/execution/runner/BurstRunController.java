package com.mk.fx.qa.burst.execution.runner;

import com.mk.fx.qa.burst.execution.executors.BurstDispatcher;
import com.mk.fx.qa.burst.execution.executors.BurstParameters;
import com.mk.fx.qa.burst.execution.executors.DispatchResult;
import com.mk.fx.qa.burst.execution.metrics.BurstReport;
import com.mk.fx.qa.burst.execution.metrics.ReportSnapshot;
import com.mk.fx.qa.burst.rest.LoadHttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns the wall-clock lifetime of a run: starts the dispatcher, keeps it launching bursts for the
 * configured duration, stops it and hands back the final report.
 */
@Slf4j
@Component
public class BurstRunController {

  /**
   * Executes one run.
   *
   * @param parameters validated run parameters
   * @return the report taken after every burst finished or was cancelled
   * @throws InterruptedException if the calling thread is interrupted; the dispatcher is stopped
   *     before this propagates
   */
  public ReportSnapshot run(BurstParameters parameters) throws InterruptedException {
    Objects.requireNonNull(parameters, "Run parameters must not be null");
    String runId = UUID.randomUUID().toString().substring(0, 8);
    var report = new BurstReport();

    log.info(
        "Run {} started: url={}, requestsPerTick={}, duration={}s, tick={}ms, expectedRequests={}",
        runId,
        parameters.url(),
        parameters.requestsPerTick(),
        parameters.duration().toSeconds(),
        parameters.tickInterval().toMillis(),
        parameters.expectedTotalRequests());

    try (var client =
        new LoadHttpClient(
            parameters.url(), parameters.connectTimeout(), parameters.requestTimeout(), Map.of())) {
      var dispatcher = new BurstDispatcher(runId, parameters, client, report);
      long windowNanos = parameters.duration().toNanos();

      log.info("Waiting for all requests to be executed...");
      long startNanos = System.nanoTime();
      dispatcher.start(() -> System.nanoTime() - startNanos >= windowNanos);

      try {
        sleepUntil(startNanos + windowNanos);
      } catch (InterruptedException e) {
        log.warn("Run {} interrupted, cancelling in-flight bursts", runId);
        dispatcher.stop(Duration.ZERO);
        throw e;
      }
      DispatchResult result = dispatcher.stop(parameters.drainGrace());

      log.info(
          "Requests executed successfully. ticks={} burstsCompleted={} cancelled={}",
          result.ticks(),
          result.burstsCompleted(),
          result.cancelled());
    }

    var snapshot = report.snapshot();
    log.info("--------------------REPORT--------------------");
    var breakdown = report.failureBreakdown();
    if (!breakdown.isEmpty()) {
      log.info("Run {} failure breakdown: {}", runId, breakdown);
    }
    return snapshot;
  }

  private static void sleepUntil(long deadlineNanos) throws InterruptedException {
    long remaining;
    while ((remaining = deadlineNanos - System.nanoTime()) > 0) {
      TimeUnit.NANOSECONDS.sleep(remaining);
    }
  }
}
