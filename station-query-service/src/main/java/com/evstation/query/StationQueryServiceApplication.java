package com.evstation.query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Read-only HTTP API over the latest station states. */
@SpringBootApplication
public class StationQueryServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(StationQueryServiceApplication.class, args);
  }
}
