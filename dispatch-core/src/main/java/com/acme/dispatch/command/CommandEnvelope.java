package com.acme.dispatch.command;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Transport-neutral form of an inbound request.
 *
 * @param correlationSupplied whether the caller provided the correlation id, as opposed to one
 *     generated on arrival
 */
public record CommandEnvelope(
    String operation,
    Transport transport,
    Map<String, Object> payload,
    Map<String, Object> context,
    String correlationId,
    boolean correlationSupplied,
    Instant receivedAt) {

  /**
   * Build an envelope, taking the correlation id from {@code context} or generating one. The
   * resulting context always carries the correlation id.
   */
  public static CommandEnvelope of(
      String operation,
      Transport transport,
      Map<String, Object> payload,
      Map<String, Object> context) {
    Map<String, Object> ctx = context != null ? new HashMap<>(context) : new HashMap<>();
    Object supplied = ctx.get(ContextKeys.CORRELATION_ID);
    boolean hasCorrelation = supplied != null && !supplied.toString().isBlank();
    String correlationId = hasCorrelation ? supplied.toString() : UUID.randomUUID().toString();
    ctx.put(ContextKeys.CORRELATION_ID, correlationId);

    return new CommandEnvelope(
        operation,
        transport,
        Collections.unmodifiableMap(payload != null ? new HashMap<>(payload) : new HashMap<>()),
        Collections.unmodifiableMap(ctx),
        correlationId,
        hasCorrelation,
        Instant.now());
  }
}
