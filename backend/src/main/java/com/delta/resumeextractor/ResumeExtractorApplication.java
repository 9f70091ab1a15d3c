package com.delta.resumeextractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResumeExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResumeExtractorApplication.class, args);
  }
}
