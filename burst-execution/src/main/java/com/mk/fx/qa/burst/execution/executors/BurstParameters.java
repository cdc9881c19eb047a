package com.mk.fx.qa.burst.execution.executors;

import com.mk.fx.qa.burst.rest.LoadHttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Parameters for a burst run.
 *
 * @param url target URL every request is posted to
 * @param apiKey value sent in the {@code X-Api-Key} header
 * @param requestsPerTick number of concurrent requests launched on each tick
 * @param duration wall-clock window during which ticks launch bursts
 * @param verbose whether collectors log response bodies
 * @param tickInterval period of the burst clock
 * @param connectTimeout connection timeout of each request
 * @param requestTimeout deadline of each request
 * @param drainGrace how long in-flight bursts may keep running once the window closed
 */
public record BurstParameters(
    String url,
    String apiKey,
    int requestsPerTick,
    Duration duration,
    boolean verbose,
    Duration tickInterval,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration drainGrace) {

  public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_DRAIN_GRACE = Duration.ofSeconds(1);

  public BurstParameters {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(duration, "duration");
    Objects.requireNonNull(tickInterval, "tickInterval");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(drainGrace, "drainGrace");
    if (url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    LoadHttpClient.parseTargetUrl(url);
    if (requestsPerTick <= 0) {
      throw new IllegalArgumentException(
          "requestsPerTick must be positive but was " + requestsPerTick);
    }
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException("duration must be positive but was " + duration);
    }
    if (tickInterval.isZero() || tickInterval.isNegative()) {
      throw new IllegalArgumentException("tickInterval must be positive but was " + tickInterval);
    }
    if (connectTimeout.isZero() || connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must be positive but was " + connectTimeout);
    }
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be positive but was " + requestTimeout);
    }
    if (drainGrace.isNegative()) {
      throw new IllegalArgumentException("drainGrace must not be negative but was " + drainGrace);
    }
    apiKey = apiKey != null ? apiKey : "";
  }

  /** Parameters with default tick, timeouts and drain grace. */
  public static BurstParameters of(
      String url, String apiKey, int requestsPerTick, Duration duration, boolean verbose) {
    return new BurstParameters(
        url,
        apiKey,
        requestsPerTick,
        duration,
        verbose,
        DEFAULT_TICK_INTERVAL,
        DEFAULT_CONNECT_TIMEOUT,
        DEFAULT_REQUEST_TIMEOUT,
        DEFAULT_DRAIN_GRACE);
  }

  /** Number of ticks that fall inside the run window, i.e. {@code ceil(duration / tickInterval)}. */
  public long expectedTicks() {
    long window = duration.toNanos();
    long tick = tickInterval.toNanos();
    return (window + tick - 1) / tick;
  }

  public long expectedTotalRequests() {
    return expectedTicks() * requestsPerTick;
  }
}
