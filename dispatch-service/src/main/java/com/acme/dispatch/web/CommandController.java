package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.CommandResult;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.Transport;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Base class for controllers that turn a request into an HTTP command. The correlation id from
 * {@link CorrelationIdFilter} goes into the command context and into the MDC while the command
 * runs.
 */
public abstract class CommandController {
  static final String MDC_CORRELATION_ID = "correlationId";

  private final CommandDispatcher dispatcher;

  protected CommandController(CommandDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  protected HttpResponse<Map<String, Object>> dispatch(
      HttpRequest<?> request,
      String operation,
      Map<String, Object> payload,
      Map<String, Object> extraContext) {
    String correlationId = CorrelationIdFilter.correlationId(request);

    Map<String, Object> context = new HashMap<>(extraContext);
    if (correlationId != null) {
      context.put(ContextKeys.CORRELATION_ID, correlationId);
      context.put(ContextKeys.REQUEST_ID, correlationId);
    }

    MDC.put(MDC_CORRELATION_ID, correlationId);
    try {
      CommandResult result =
          dispatcher.dispatch(
              operation, Transport.HTTP, payload != null ? payload : Map.of(), context);
      return ResultResponses.of(result);
    } finally {
      MDC.remove(MDC_CORRELATION_ID);
    }
  }
}
