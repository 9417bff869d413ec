package com.flamingo.ai.finqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Financial statement question answering backend. */
@SpringBootApplication
public class FinQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(FinQaApplication.class, args);
  }
}
