package com.mk.fx.qa.burst.execution.model;

import com.mk.fx.qa.burst.rest.RestResponseData;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Result of one request attempt.
 *
 * <p>Exactly one of {@code response} and {@code error} is present. A response with an unaccepted
 * status still travels as a response; {@code error} is reserved for attempts that never received
 * one.
 *
 * @param burst number of the burst that produced the outcome, starting at 1
 * @param sequenceIndex position of the request within its burst, 1..N
 * @param response captured response, or {@code null}
 * @param error transport failure, or {@code null}
 */
public record RequestOutcome(
    int burst, int sequenceIndex, RestResponseData response, Throwable error) {

  /** Status codes counted as success. */
  public static final Set<Integer> ACCEPTED_STATUSES = Set.of(200, 201, 202, 204);

  public RequestOutcome {
    if ((response == null) == (error == null)) {
      throw new IllegalArgumentException(
          "Exactly one of response or error must be present for request #" + sequenceIndex);
    }
  }

  public static RequestOutcome ofResponse(int burst, int sequenceIndex, RestResponseData response) {
    return new RequestOutcome(
        burst, sequenceIndex, Objects.requireNonNull(response, "response"), null);
  }

  public static RequestOutcome ofError(int burst, int sequenceIndex, Throwable error) {
    return new RequestOutcome(burst, sequenceIndex, null, Objects.requireNonNull(error, "error"));
  }

  public static boolean isAccepted(int statusCode) {
    return ACCEPTED_STATUSES.contains(statusCode);
  }

  public OutcomeType type() {
    return response != null && isAccepted(response.getStatusCode())
        ? OutcomeType.SUCCESS
        : OutcomeType.FAIL;
  }

  public boolean isSuccess() {
    return type() == OutcomeType.SUCCESS;
  }

  public Optional<Integer> statusCode() {
    return Optional.ofNullable(response).map(RestResponseData::getStatusCode);
  }
}
