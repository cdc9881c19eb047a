package com.mk.fx.qa.burst.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BurstLoadApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(BurstLoadApplication.class, args)));
  }
}
