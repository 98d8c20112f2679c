package com.flamingo.ai.beoarchive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the BEO archive service. */
@SpringBootApplication
public class BeoArchiveApplication {

  public static void main(String[] args) {
    SpringApplication.run(BeoArchiveApplication.class, args);
  }
}
