package com.acme.triage.processor;

import io.micronaut.runtime.Micronaut;

public class TriageApplication {

  public static void main(String[] args) {
    Micronaut.run(TriageApplication.class, args);
  }
}
