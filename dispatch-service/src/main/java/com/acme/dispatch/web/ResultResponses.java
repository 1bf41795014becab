package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandResult;
import com.acme.dispatch.core.ErrorCodes;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps command results to HTTP responses. */
public final class ResultResponses {

  private ResultResponses() {}

  public static HttpStatus statusFor(CommandResult result) {
    if (result.success()) {
      return HttpStatus.OK;
    }
    return statusFor(result.errorCode());
  }

  public static HttpStatus statusFor(String errorCode) {
    if (errorCode == null) {
      return HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return switch (errorCode) {
      case ErrorCodes.VALIDATION_ERROR, ErrorCodes.INVALID_OPERATION -> HttpStatus.BAD_REQUEST;
      case ErrorCodes.NOT_FOUND, ErrorCodes.HANDLER_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case ErrorCodes.ALREADY_EXISTS, ErrorCodes.DUPLICATE_REQUEST -> HttpStatus.CONFLICT;
      case ErrorCodes.BUSINESS_RULE_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
      case ErrorCodes.TRANSPORT_NOT_SUPPORTED -> HttpStatus.METHOD_NOT_ALLOWED;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  /** The uniform result shape plus a timestamp */
  public static Map<String, Object> body(CommandResult result) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", result.success());
    body.put("data", result.data());
    body.put("error_code", result.errorCode());
    body.put("message", result.message());
    body.put("execution_time_ms", result.executionTimeMs());
    body.put("timestamp", Instant.now().toString());
    return body;
  }

  public static HttpResponse<Map<String, Object>> of(CommandResult result) {
    return HttpResponse.<Map<String, Object>>status(statusFor(result)).body(body(result));
  }
}
