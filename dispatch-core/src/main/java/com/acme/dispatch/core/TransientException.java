package com.acme.dispatch.core;

/** Infrastructure failure that may succeed on retry (connection loss, deadlock, timeout). */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
