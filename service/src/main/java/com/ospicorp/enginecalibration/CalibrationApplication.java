package com.ospicorp.enginecalibration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalibrationApplication {

  public static void main(String[] args) {
    SpringApplication.run(CalibrationApplication.class, args);
  }
}
