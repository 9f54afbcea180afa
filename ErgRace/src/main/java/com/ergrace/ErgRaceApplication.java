package com.ergrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ErgRaceApplication {
  public static void main(String[] args) {
    SpringApplication.run(ErgRaceApplication.class, args);
  }
}
