package com.acme.dispatch.core;

/** A downstream provider (payment gateway, email service) failed to answer. */
public class ExternalServiceException extends TransientException {
  private final String service;

  public ExternalServiceException(String service, String details) {
    super("External service " + service + " error: " + details);
    this.service = service;
  }

  public String getService() {
    return service;
  }
}
