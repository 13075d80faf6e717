package com.vitals.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VitalsAnalyticsApplication {
  public static void main(String[] args) {
    SpringApplication.run(VitalsAnalyticsApplication.class, args);
  }
}
