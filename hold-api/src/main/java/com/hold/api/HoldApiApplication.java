package com.hold.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.hold")
@ConfigurationPropertiesScan(basePackages = "com.hold")
@EnableScheduling
public class HoldApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(HoldApiApplication.class, args);
  }
}
