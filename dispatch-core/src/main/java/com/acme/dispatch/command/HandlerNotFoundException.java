package com.acme.dispatch.command;

import com.acme.dispatch.core.DispatchException;
import com.acme.dispatch.core.ErrorCodes;

public class HandlerNotFoundException extends DispatchException {
  public HandlerNotFoundException(String operation) {
    super(ErrorCodes.HANDLER_NOT_FOUND, "No handler registered for operation: " + operation);
  }
}
