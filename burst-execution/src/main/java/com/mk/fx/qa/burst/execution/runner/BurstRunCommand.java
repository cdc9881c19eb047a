package com.mk.fx.qa.burst.execution.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.burst.execution.cfg.BurstProperties;
import com.mk.fx.qa.burst.execution.executors.BurstParameters;
import com.mk.fx.qa.burst.execution.metrics.ReportSnapshot;
import com.mk.fx.qa.burst.rest.JsonUtil;
import java.io.PrintStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: echoes the resolved configuration, runs the burst load and prints the final
 * report as indented JSON on standard output.
 */
@Slf4j
@Component
public class BurstRunCommand implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  private final BurstProperties properties;
  private final BurstRunController controller;
  private final PrintStream out;
  private volatile int exitCode = EXIT_OK;

  @Autowired
  public BurstRunCommand(BurstProperties properties, BurstRunController controller) {
    this(properties, controller, System.out);
  }

  BurstRunCommand(BurstProperties properties, BurstRunController controller, PrintStream out) {
    this.properties = properties;
    this.controller = controller;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    BurstParameters parameters;
    try {
      parameters = properties.toParameters();
    } catch (IllegalArgumentException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      exitCode = EXIT_FAILURE;
      return;
    }
    printConfiguration(parameters);

    ReportSnapshot report = controller.run(parameters);
    try {
      out.println(JsonUtil.toPrettyJson(report));
    } catch (JsonProcessingException e) {
      log.error("Failed to render report: {}", e.getOriginalMessage(), e);
      exitCode = EXIT_FAILURE;
    }
  }

  private void printConfiguration(BurstParameters parameters) {
    out.println("url: " + parameters.url());
    out.println("key: " + mask(parameters.apiKey()));
    out.println("rqs: " + parameters.requestsPerTick());
    out.println("duration: " + parameters.duration().toSeconds());
    out.println("verbose: " + parameters.verbose());
  }

  static String mask(String apiKey) {
    if (apiKey == null || apiKey.isEmpty()) {
      return "<none>";
    }
    if (apiKey.length() <= 4) {
      return "****";
    }
    return apiKey.substring(0, 4) + "*".repeat(apiKey.length() - 4);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
