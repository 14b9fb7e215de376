package com.crossbot.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.crossbot.api")
public class CrossbotApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(CrossbotApiApplication.class, args);
  }
}
