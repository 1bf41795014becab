package com.acme.dispatch.command;

import java.util.Map;

/**
 * Handles one operation arriving over one transport.
 *
 * <p>Instances are created per request by the {@link HandlerRegistry} and must not share mutable
 * state across requests.
 */
@FunctionalInterface
public interface CommandHandler {
  CommandResult handle(Map<String, Object> data, Map<String, Object> context);
}
