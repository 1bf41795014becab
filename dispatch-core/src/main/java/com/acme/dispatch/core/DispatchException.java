package com.acme.dispatch.core;

/**
 * Base type for every failure that carries a stable, machine-readable error code. The execution
 * wrapper surfaces the code and message of these exceptions verbatim; anything else becomes {@link
 * ErrorCodes#INTERNAL_ERROR}.
 */
public abstract class DispatchException extends RuntimeException {
  private final String errorCode;

  protected DispatchException(String errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  protected DispatchException(String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
