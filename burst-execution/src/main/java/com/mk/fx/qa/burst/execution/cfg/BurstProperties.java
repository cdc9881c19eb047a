package com.mk.fx.qa.burst.execution.cfg;

import com.mk.fx.qa.burst.execution.executors.BurstParameters;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "burst")
public class BurstProperties {

  /** The server POST url. */
  @NotBlank private String url = "https://postman-echo.com/post";

  /** The server API key, sent as {@code X-Api-Key}. */
  private String apiKey = "";

  /** Requests launched on every tick. */
  @Positive private int requestsPerTick = 10;

  /** Run duration in seconds. */
  @Positive private int duration = 1;

  /** Whether to log the response body of each request. */
  private boolean verbose;

  @NotNull private Duration tickInterval = BurstParameters.DEFAULT_TICK_INTERVAL;

  @NotNull private Duration connectTimeout = BurstParameters.DEFAULT_CONNECT_TIMEOUT;

  @NotNull private Duration requestTimeout = BurstParameters.DEFAULT_REQUEST_TIMEOUT;

  /** Time in-flight bursts may keep running once the run window closed. */
  @NotNull private Duration drainGrace = BurstParameters.DEFAULT_DRAIN_GRACE;

  public BurstParameters toParameters() {
    return new BurstParameters(
        url,
        apiKey,
        requestsPerTick,
        Duration.ofSeconds(duration),
        verbose,
        tickInterval,
        connectTimeout,
        requestTimeout,
        drainGrace);
  }
}
