package com.mk.fx.qa.burst.execution.executors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.burst.execution.model.RequestOutcome;
import com.mk.fx.qa.burst.rest.JsonUtil;
import com.mk.fx.qa.burst.rest.RestResponseData;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains one {@link OutcomeChannel} and logs every outcome it carries.
 *
 * <p>Blocks on the channel until it is closed and empty, so no published outcome is missed.
 * Returns the number of outcomes it observed.
 */
@Slf4j
public final class OutcomeCollector implements Callable<Integer> {

  public enum Kind {
    SUCCESS,
    ERROR
  }

  private final Kind kind;
  private final int burst;
  private final OutcomeChannel channel;
  private final boolean verbose;

  public OutcomeCollector(Kind kind, int burst, OutcomeChannel channel, boolean verbose) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.burst = burst;
    this.channel = Objects.requireNonNull(channel, "channel");
    this.verbose = verbose;
  }

  @Override
  public Integer call() throws InterruptedException {
    int count = 0;
    Optional<RequestOutcome> next;
    while ((next = channel.take()).isPresent()) {
      count++;
      if (count == 1) {
        log.info("burst #{}", burst);
      }
      if (kind == Kind.SUCCESS) {
        logSuccess(next.get());
      } else {
        logError(next.get());
      }
    }
    log.debug("Burst {} {} collector drained {} outcomes", burst, kind, count);
    return count;
  }

  private void logSuccess(RequestOutcome outcome) {
    RestResponseData response = outcome.response();
    log.info(
        "request #{} >> http status response {}",
        outcome.sequenceIndex(),
        response.getStatusCode());
    if (verbose) {
      log.info("request #{} >> response: {}", outcome.sequenceIndex(), formatBody(response));
    }
  }

  private void logError(RequestOutcome outcome) {
    if (outcome.error() != null) {
      log.info("error on request #{} >> {}", outcome.sequenceIndex(), outcome.error().getMessage());
      return;
    }
    RestResponseData response = outcome.response();
    log.info(
        "error on request #{} >> http status code: {}",
        outcome.sequenceIndex(),
        response.getStatusCode());
    if (verbose && response.getBody() != null && !response.getBody().isEmpty()) {
      log.info("request #{} >> response: {}", outcome.sequenceIndex(), response.getBody());
    }
  }

  static String formatBody(RestResponseData response) {
    String body = response.getBody();
    if (body == null || body.isBlank()) {
      return "";
    }
    try {
      return JsonUtil.prettyPrint(body);
    } catch (JsonProcessingException e) {
      log.debug("Response body is not JSON, logging it as received: {}", e.getOriginalMessage());
      return body;
    }
  }
}
