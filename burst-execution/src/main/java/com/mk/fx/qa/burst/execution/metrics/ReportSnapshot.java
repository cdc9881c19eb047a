package com.mk.fx.qa.burst.execution.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Point-in-time copy of a {@link BurstReport}, in the shape printed at the end of a run. */
@JsonPropertyOrder({"TotalRequests", "TotalSuccess", "TotalFail"})
public record ReportSnapshot(
    @JsonProperty("TotalRequests") long totalRequests,
    @JsonProperty("TotalSuccess") long totalSuccess,
    @JsonProperty("TotalFail") long totalFail) {

  @JsonIgnore
  public boolean isConsistent() {
    return totalSuccess + totalFail == totalRequests;
  }
}
