package com.flamingo.ai.filingrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilingRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(FilingRagApplication.class, args);
  }
}
