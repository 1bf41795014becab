package com.acme.dispatch.command;

import com.acme.dispatch.core.Jsons;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform outcome returned to every transport.
 */
public record CommandResult(
    boolean success,
    Map<String, Object> data,
    @JsonProperty("error_code") String errorCode,
    String message,
    @JsonProperty("execution_time_ms") double executionTimeMs) {

  public static CommandResult success(Map<String, Object> data) {
    Map<String, Object> copy =
        data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
    return new CommandResult(true, copy, null, null, 0.0);
  }

  public static CommandResult failure(String errorCode, String message) {
    return new CommandResult(false, null, errorCode, message, 0.0);
  }

  public CommandResult withExecutionTime(double millis) {
    return new CommandResult(success, data, errorCode, message, millis);
  }

  /** Serialize to JSON for sending over a queue or topic */
  public String toJson() {
    return Jsons.toJson(this);
  }

  static double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
