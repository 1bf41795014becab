package com.acme.dispatch;

import io.micronaut.runtime.Micronaut;

public class DispatchServiceApplication {
  public static void main(String[] args) {
    Micronaut.run(DispatchServiceApplication.class, args);
  }
}
