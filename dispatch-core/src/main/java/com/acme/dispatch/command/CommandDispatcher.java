package com.acme.dispatch.command;

import com.acme.dispatch.core.DispatchException;
import com.acme.dispatch.core.ErrorCodes;
import com.acme.dispatch.spi.InboxService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution wrapper shared by all transports: builds the envelope, resolves the handler, runs it
 * and always returns a {@link CommandResult}. No exception escapes {@link #dispatch}.
 *
 * <p>QUEUE and STREAM deliveries carrying a caller-supplied correlation id are recorded in the
 * inbox; a second delivery for the same operation and correlation id is answered with {@code
 * DUPLICATE_REQUEST} instead of being executed again.
 */
public class CommandDispatcher {
  private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

  public static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred.";

  private final HandlerRegistry registry;
  private final InboxService inboxService;

  public CommandDispatcher(HandlerRegistry registry, InboxService inboxService) {
    this.registry = registry;
    this.inboxService = inboxService;
  }

  public CommandResult dispatch(
      String operation,
      Transport transport,
      Map<String, Object> payload,
      Map<String, Object> context) {
    return dispatch(CommandEnvelope.of(operation, transport, payload, context));
  }

  public CommandResult dispatch(CommandEnvelope envelope) {
    long start = System.nanoTime();
    log.info(
        "Dispatching operation={} transport={} correlationId={}",
        envelope.operation(),
        envelope.transport(),
        envelope.correlationId());

    try {
      CommandHandler handler = registry.resolve(envelope.operation(), envelope.transport());
      if (isRedelivery(envelope)) {
        throw new DuplicateRequestException(envelope.operation(), envelope.correlationId());
      }
      CommandResult result = handler.handle(envelope.payload(), envelope.context());
      return result.withExecutionTime(CommandResult.millisSince(start));
    } catch (DispatchException e) {
      log.warn(
          "Operation {} over {} rejected: {} {}",
          envelope.operation(),
          envelope.transport(),
          e.getErrorCode(),
          e.getMessage());
      return CommandResult.failure(e.getErrorCode(), e.getMessage())
          .withExecutionTime(CommandResult.millisSince(start));
    } catch (Exception e) {
      log.error(
          "Unexpected error in operation {} over {} correlationId={}",
          envelope.operation(),
          envelope.transport(),
          envelope.correlationId(),
          e);
      return CommandResult.failure(ErrorCodes.INTERNAL_ERROR, UNEXPECTED_ERROR_MESSAGE)
          .withExecutionTime(CommandResult.millisSince(start));
    }
  }

  private boolean isRedelivery(CommandEnvelope envelope) {
    if (envelope.transport() == Transport.HTTP || !envelope.correlationSupplied()) {
      return false;
    }
    String messageId = envelope.operation() + ":" + envelope.correlationId();
    return !inboxService.markIfAbsent(messageId, envelope.transport().name());
  }
}
