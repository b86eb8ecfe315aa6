package com.signalwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SignalWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(SignalWatchApplication.class, args);
  }
}
