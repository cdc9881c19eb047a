package com.mk.fx.qa.burst.execution.model;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.burst.rest.RestResponseData;
import com.mk.fx.qa.burst.rest.TransportException;
import java.net.ConnectException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class RequestOutcomeTest {

  private static RestResponseData response(int status) {
    var data = new RestResponseData();
    data.setStatusCode(status);
    data.setBody("");
    return data;
  }

  @ParameterizedTest
  @ValueSource(ints = {200, 201, 202, 204})
  void acceptedStatuses_areSuccess(int status) {
    var outcome = RequestOutcome.ofResponse(1, 1, response(status));
    assertEquals(OutcomeType.SUCCESS, outcome.type());
    assertTrue(outcome.isSuccess());
    assertEquals(status, outcome.statusCode().orElseThrow());
  }

  @ParameterizedTest
  @ValueSource(ints = {203, 301, 400, 404, 429, 500, 503})
  void otherStatuses_failButKeepResponse(int status) {
    var outcome = RequestOutcome.ofResponse(2, 3, response(status));
    assertEquals(OutcomeType.FAIL, outcome.type());
    assertNotNull(outcome.response());
    assertNull(outcome.error());
  }

  @Test
  void transportFailure_failsWithoutResponse() {
    var outcome =
        RequestOutcome.ofError(
            1, 4, new TransportException("refused", new ConnectException("refused")));
    assertEquals(OutcomeType.FAIL, outcome.type());
    assertNull(outcome.response());
    assertTrue(outcome.statusCode().isEmpty());
    assertEquals(4, outcome.sequenceIndex());
  }

  @Test
  void exactlyOneOfResponseOrError_isEnforced() {
    assertThrows(IllegalArgumentException.class, () -> new RequestOutcome(1, 1, null, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new RequestOutcome(1, 1, response(500), new RuntimeException("both")));
    assertThrows(NullPointerException.class, () -> RequestOutcome.ofResponse(1, 1, null));
    assertThrows(NullPointerException.class, () -> RequestOutcome.ofError(1, 1, null));
  }
}
