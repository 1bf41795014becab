package com.acme.dispatch.command;

import com.acme.dispatch.core.DispatchException;
import com.acme.dispatch.core.ErrorCodes;
import java.util.Set;

/** The operation is known, but not over the requested transport. */
public class TransportNotSupportedException extends DispatchException {
  public TransportNotSupportedException(
      String operation, Transport transport, Set<Transport> supported) {
    super(
        ErrorCodes.TRANSPORT_NOT_SUPPORTED,
        "Operation " + operation + " is not available over " + transport + " (supported: "
            + supported + ")");
  }
}
