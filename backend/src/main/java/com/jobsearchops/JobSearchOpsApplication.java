package com.jobsearchops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobSearchOpsApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobSearchOpsApplication.class, args);
  }
}
