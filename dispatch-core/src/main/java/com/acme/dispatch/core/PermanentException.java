package com.acme.dispatch.core;

/** Infrastructure failure that will not succeed on retry (constraint violation, bad SQL). */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
