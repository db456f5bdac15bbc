package com.sectracker.resolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TickerResolverApplication {

  public static void main(String[] args) {
    SpringApplication.run(TickerResolverApplication.class, args);
  }
}
