package com.sentinel.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SentinelAnalyzerApplication {
  public static void main(String[] args) {
    SpringApplication.run(SentinelAnalyzerApplication.class, args);
  }
}
