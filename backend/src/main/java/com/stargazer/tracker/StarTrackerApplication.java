package com.stargazer.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StarTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(StarTrackerApplication.class, args);
  }
}
