package com.mk.fx.qa.burst.execution.executors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Uninterruptibles;
import com.mk.fx.qa.burst.execution.metrics.BurstReport;
import com.mk.fx.qa.burst.rest.LoadHttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Launches a burst of {@code requestsPerTick} concurrent workers on every tick of a fixed-rate
 * clock.
 *
 * <p>The clock thread only hands bursts over to the burst executor, so a burst that outlives its
 * tick never delays the next one and several bursts may be in flight at once. Each burst gets its
 * own pair of outcome channels and collectors; all of them update the same {@link BurstReport}.
 *
 * <p>The dispatcher never stops on its own: it launches bursts until the stop signal passed to
 * {@link #start(BooleanSupplier)} turns true and is shut down with {@link #stop(Duration)}.
 */
@Slf4j
public class BurstDispatcher {

  private static final Duration CANCELLED_WORKER_WAIT = Duration.ofSeconds(2);
  private static final Duration COLLECTOR_DRAIN_WAIT = Duration.ofSeconds(5);

  private final BurstParameters parameters;
  private final BurstWorker worker;
  private final BurstExecutors executors;
  private final String runId;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final AtomicLong ticks = new AtomicLong();
  private final AtomicLong burstsCompleted = new AtomicLong();
  private final AtomicLong burstsInFlight = new AtomicLong();

  public BurstDispatcher(
      String runId, BurstParameters parameters, LoadHttpClient client, BurstReport report) {
    this(runId, parameters, client, report, new BurstExecutors(runId));
  }

  BurstDispatcher(
      String runId,
      BurstParameters parameters,
      LoadHttpClient client,
      BurstReport report,
      BurstExecutors executors) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    this.worker = new BurstWorker(client, parameters.apiKey(), report, cancelled::get);
    this.executors = Objects.requireNonNull(executors, "executors");
  }

  /**
   * Starts the tick clock. The first tick fires immediately.
   *
   * @param stopRequested checked on every tick; once true no further bursts are launched
   * @throws IllegalStateException if the dispatcher was already started
   */
  public void start(BooleanSupplier stopRequested) {
    Objects.requireNonNull(stopRequested, "stopRequested");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Dispatcher " + runId + " already started");
    }

    Runnable tick =
        () -> {
          try {
            if (cancelled.get() || stopRequested.getAsBoolean()) {
              return;
            }
            long burst = ticks.incrementAndGet();
            burstsInFlight.incrementAndGet();
            try {
              executors.bursts().execute(() -> runBurst((int) burst));
            } catch (RejectedExecutionException rejected) {
              ticks.decrementAndGet();
              burstsInFlight.decrementAndGet();
              log.debug("Run {} burst #{} not launched: dispatcher stopping", runId, burst);
            }
          } catch (Throwable throwable) {
            log.error(
                "Run {} tick clock encountered error: {}", runId, throwable.getMessage(), throwable);
          }
        };

    long periodNanos = parameters.tickInterval().toNanos();
    executors.ticker().scheduleAtFixedRate(tick, 0L, periodNanos, TimeUnit.NANOSECONDS);
    log.debug(
        "Run {} dispatcher started: {} requests every {}ms",
        runId,
        parameters.requestsPerTick(),
        parameters.tickInterval().toMillis());
  }

  /**
   * Stops the clock, waits up to {@code grace} for in-flight bursts and cancels whatever is still
   * running after that.
   */
  public DispatchResult stop(Duration grace) {
    Objects.requireNonNull(grace, "grace");
    executors.stopTicker();

    boolean drained = executors.awaitBursts(grace);
    if (!drained) {
      log.warn(
          "Run {}: {} burst(s) still in flight after {}ms, cancelling outstanding requests",
          runId,
          burstsInFlight.get(),
          grace.toMillis());
      cancelled.set(true);
      executors.cancelInFlight();
    }
    executors.cleanup();

    var result = new DispatchResult(ticks.get(), burstsCompleted.get(), !drained);
    log.debug(
        "Run {} dispatcher stopped: ticks={} burstsCompleted={} cancelled={}",
        runId,
        result.ticks(),
        result.burstsCompleted(),
        result.cancelled());
    return result;
  }

  @VisibleForTesting
  long burstsInFlight() {
    return burstsInFlight.get();
  }

  private void runBurst(int burst) {
    int requests = parameters.requestsPerTick();
    var successChannel = new OutcomeChannel("burst-" + burst + "-success");
    var errorChannel = new OutcomeChannel("burst-" + burst + "-error");
    var done = new CountDownLatch(requests);
    List<Future<?>> workers = new ArrayList<>(requests);
    List<Future<Integer>> collectors = new ArrayList<>(2);

    log.debug("Run {} burst #{} dispatching {} requests", runId, burst, requests);
    try {
      for (int idx = 1; idx <= requests; idx++) {
        int sequenceIndex = idx;
        workers.add(
            executors
                .workers()
                .submit(
                    () -> {
                      try {
                        worker.run(burst, sequenceIndex, successChannel, errorChannel);
                      } catch (RuntimeException e) {
                        log.error(
                            "Burst {} request #{} failed unexpectedly: {}",
                            burst,
                            sequenceIndex,
                            e.getMessage(),
                            e);
                      } finally {
                        done.countDown();
                      }
                    }));
      }
      collectors.add(
          executors
              .collectors()
              .submit(
                  new OutcomeCollector(
                      OutcomeCollector.Kind.SUCCESS, burst, successChannel, parameters.verbose())));
      collectors.add(
          executors
              .collectors()
              .submit(
                  new OutcomeCollector(
                      OutcomeCollector.Kind.ERROR, burst, errorChannel, parameters.verbose())));

      done.await();
      burstsCompleted.incrementAndGet();
    } catch (InterruptedException e) {
      log.warn(
          "Burst {} interrupted with {} of {} requests outstanding",
          burst,
          done.getCount(),
          requests);
      workers.forEach(future -> future.cancel(true));
      Uninterruptibles.awaitUninterruptibly(done, CANCELLED_WORKER_WAIT);
      Thread.currentThread().interrupt();
    } catch (RejectedExecutionException e) {
      log.warn("Burst {} cut short: dispatcher stopping", burst);
      workers.forEach(future -> future.cancel(true));
    } finally {
      successChannel.close();
      errorChannel.close();
      collectors.forEach(collector -> awaitCollector(burst, collector));
      burstsInFlight.decrementAndGet();
    }
  }

  private void awaitCollector(int burst, Future<Integer> collector) {
    try {
      Uninterruptibles.getUninterruptibly(collector, COLLECTOR_DRAIN_WAIT);
    } catch (ExecutionException e) {
      log.error("Burst {} collector failed: {}", burst, e.getCause().getMessage(), e.getCause());
    } catch (TimeoutException e) {
      log.warn("Burst {} collector did not drain within {}ms", burst, COLLECTOR_DRAIN_WAIT.toMillis());
      collector.cancel(true);
    } catch (CancellationException e) {
      log.debug("Burst {} collector cancelled", burst);
    }
  }
}
