package com.mk.fx.qa.burst.execution.model;

public enum OutcomeType {
  SUCCESS,
  FAIL
}
