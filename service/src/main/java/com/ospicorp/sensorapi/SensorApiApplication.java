package com.ospicorp.sensorapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensorApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(SensorApiApplication.class, args);
  }
}
