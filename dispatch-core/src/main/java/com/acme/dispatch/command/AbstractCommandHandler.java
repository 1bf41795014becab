package com.acme.dispatch.command;

import com.acme.dispatch.core.DispatchException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for transport handlers. Times the call and turns coded exceptions into failed
 * results; subclasses only build the command and call their use case.
 */
public abstract class AbstractCommandHandler implements CommandHandler {
  protected final Logger log = LoggerFactory.getLogger(getClass());

  @Override
  public final CommandResult handle(Map<String, Object> data, Map<String, Object> context) {
    long start = System.nanoTime();
    Map<String, Object> payload = data != null ? data : Map.of();
    Map<String, Object> ctx = context != null ? context : Map.of();
    try {
      Map<String, Object> body = execute(payload, ctx);
      CommandResult result =
          CommandResult.success(body).withExecutionTime(CommandResult.millisSince(start));
      log.info(
          "{} succeeded correlationId={} in {} ms",
          getClass().getSimpleName(),
          ctx.get(ContextKeys.CORRELATION_ID),
          String.format("%.2f", result.executionTimeMs()));
      return result;
    } catch (DispatchException e) {
      log.warn(
          "{} rejected correlationId={}: {} {}",
          getClass().getSimpleName(),
          ctx.get(ContextKeys.CORRELATION_ID),
          e.getErrorCode(),
          e.getMessage());
      return CommandResult.failure(e.getErrorCode(), e.getMessage())
          .withExecutionTime(CommandResult.millisSince(start));
    }
  }

  /**
   * Build the command from {@code data} and {@code context}, run the use case, and return the
   * result data.
   */
  protected abstract Map<String, Object> execute(
      Map<String, Object> data, Map<String, Object> context);

  protected static String contextValue(Map<String, Object> context, String key) {
    Object value = context.get(key);
    return value != null ? value.toString() : null;
  }

  /** Copy of {@code data} with the given context value added under {@code key}, when present. */
  protected static Map<String, Object> withContext(
      Map<String, Object> data, Map<String, Object> context, String... keys) {
    Map<String, Object> fields = new HashMap<>(data);
    for (String key : keys) {
      Object value = context.get(key);
      if (value != null) {
        fields.put(key, value);
      }
    }
    return fields;
  }
}
