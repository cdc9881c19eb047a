package com.mk.fx.qa.burst.execution.executors;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/** Owns the threads of one dispatcher: the tick clock, burst coordinators, workers, collectors. */
@Slf4j
final class BurstExecutors {

  private static final int FORCED_SHUTDOWN_WAIT_SECONDS = 2;
  private static final int SHUTDOWN_WAIT_SECONDS = 5;

  private final ScheduledExecutorService ticker;
  private final ExecutorService bursts;
  private final ExecutorService workers;
  private final ExecutorService collectors;

  BurstExecutors(String runId) {
    this.ticker = Executors.newSingleThreadScheduledExecutor(daemonThreads("burst-ticker-" + runId));
    this.bursts = Executors.newCachedThreadPool(daemonThreads("burst-" + runId));
    this.workers = Executors.newCachedThreadPool(daemonThreads("burst-worker-" + runId));
    this.collectors = Executors.newCachedThreadPool(daemonThreads("burst-collector-" + runId));
  }

  private static ThreadFactory daemonThreads(String prefix) {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + thread.getId());
      thread.setDaemon(true);
      return thread;
    };
  }

  ScheduledExecutorService ticker() {
    return ticker;
  }

  ExecutorService bursts() {
    return bursts;
  }

  ExecutorService workers() {
    return workers;
  }

  ExecutorService collectors() {
    return collectors;
  }

  void stopTicker() {
    ticker.shutdownNow();
  }

  /**
   * Stops accepting bursts and waits for the ones in flight.
   *
   * @return true if every burst finished within {@code grace}
   */
  boolean awaitBursts(Duration grace) {
    bursts.shutdown();
    try {
      return bursts.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      log.warn("Interrupted while waiting for in-flight bursts");
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Interrupts in-flight bursts and their workers. */
  void cancelInFlight() {
    bursts.shutdownNow();
    workers.shutdownNow();
    awaitQuietly("Burst", bursts, FORCED_SHUTDOWN_WAIT_SECONDS);
  }

  void cleanup() {
    shutdownExecutorService("Ticker", ticker, FORCED_SHUTDOWN_WAIT_SECONDS);
    shutdownExecutorService("Burst", bursts, SHUTDOWN_WAIT_SECONDS);
    shutdownExecutorService("Worker", workers, SHUTDOWN_WAIT_SECONDS);
    shutdownExecutorService("Collector", collectors, SHUTDOWN_WAIT_SECONDS);
  }

  private void awaitQuietly(String name, ExecutorService executor, int timeoutSeconds) {
    try {
      if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
        log.warn("{} executor did not terminate within {} seconds of cancellation", name, timeoutSeconds);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void shutdownExecutorService(String name, ExecutorService executor, int timeoutSeconds) {
    try {
      log.debug("Shutting down {} executor service...", name);
      executor.shutdown();

      if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
        log.warn(
            "{} executor did not terminate within {} seconds, forcing shutdown", name, timeoutSeconds);
        executor.shutdownNow();

        if (!executor.awaitTermination(FORCED_SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("{} executor did not terminate even after forced shutdown", name);
        }
      } else {
        log.debug("{} executor service shut down successfully", name);
      }
    } catch (InterruptedException e) {
      log.warn("{} executor shutdown was interrupted, forcing immediate shutdown", name);
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
