package com.acme.dispatch.command;

import com.acme.dispatch.core.DispatchException;
import com.acme.dispatch.core.ErrorCodes;

public class DuplicateRequestException extends DispatchException {
  public DuplicateRequestException(String operation, String correlationId) {
    super(
        ErrorCodes.DUPLICATE_REQUEST,
        "Operation " + operation + " already processed for correlation id " + correlationId);
  }
}
