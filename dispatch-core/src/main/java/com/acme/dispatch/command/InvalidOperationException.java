package com.acme.dispatch.command;

import com.acme.dispatch.core.DispatchException;
import com.acme.dispatch.core.ErrorCodes;

/** The context's operation sub-selector is missing or not one the handler understands. */
public class InvalidOperationException extends DispatchException {
  /**
   * @param selector the sub-selector from the context, possibly {@code null}
   * @param registeredOperation the operation the handler was resolved for
   */
  public InvalidOperationException(String selector, String registeredOperation) {
    super(
        ErrorCodes.INVALID_OPERATION,
        selector == null
            ? "Missing operation for " + registeredOperation
            : "Operation " + selector + " does not match " + registeredOperation);
  }
}
