package com.mk.fx.qa.burst.execution.executors;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BurstParametersTest {

  private static final String URL = "http://localhost:8080/post";

  @Test
  void of_appliesDefaults() {
    var p = BurstParameters.of(URL, null, 5, Duration.ofSeconds(3), false);
    assertEquals("", p.apiKey());
    assertEquals(Duration.ofSeconds(1), p.tickInterval());
    assertEquals(Duration.ofSeconds(30), p.requestTimeout());
    assertEquals(Duration.ofSeconds(1), p.drainGrace());
    assertEquals(3, p.expectedTicks());
    assertEquals(15, p.expectedTotalRequests());
  }

  @Test
  void expectedTicks_roundsPartialTicksUp() {
    var p =
        new BurstParameters(
            URL,
            "k",
            2,
            Duration.ofMillis(250),
            false,
            Duration.ofMillis(100),
            Duration.ofSeconds(1),
            Duration.ofSeconds(1),
            Duration.ZERO);
    assertEquals(3, p.expectedTicks());
    assertEquals(6, p.expectedTotalRequests());
  }

  @Test
  void nonPositiveRequestsPerTick_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of(URL, "k", 0, Duration.ofSeconds(1), false));
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of(URL, "k", -3, Duration.ofSeconds(1), false));
  }

  @Test
  void nonPositiveDuration_isRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> BurstParameters.of(URL, "k", 1, Duration.ZERO, false));
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of(URL, "k", 1, Duration.ofSeconds(-1), false));
  }

  @Test
  void invalidTimingsAndUrl_areRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BurstParameters(
                URL, "k", 1, Duration.ofSeconds(1), false, Duration.ZERO,
                Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BurstParameters(
                URL, "k", 1, Duration.ofSeconds(1), false, Duration.ofSeconds(1),
                Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofMillis(-1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of(" ", "k", 1, Duration.ofSeconds(1), false));
    assertThrows(
        NullPointerException.class, () -> BurstParameters.of(null, "k", 1, Duration.ofSeconds(1), false));
  }

  @Test
  void urlWithoutHttpSchemeOrHost_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of("localhost:8080/post", "k", 1, Duration.ofSeconds(1), false));
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of("ftp://localhost/post", "k", 1, Duration.ofSeconds(1), false));
    assertThrows(
        IllegalArgumentException.class,
        () -> BurstParameters.of("http:///post", "k", 1, Duration.ofSeconds(1), false));
  }
}
