package com.acme.dispatch.web;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.RequestFilter;
import io.micronaut.http.annotation.ResponseFilter;
import io.micronaut.http.annotation.ServerFilter;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns every request a correlation id. An incoming {@value #HEADER} is kept, otherwise a short
 * random id is generated. The id is stored as a request attribute for the controllers and echoed
 * back in the response header.
 */
@Slf4j
@ServerFilter(ServerFilter.MATCH_ALL_PATTERN)
public class CorrelationIdFilter {

  public static final String HEADER = "X-Request-ID";
  public static final String ATTRIBUTE = "dispatch.correlationId";
  private static final String STARTED_AT = "dispatch.startedAt";

  @RequestFilter
  public void assignCorrelationId(HttpRequest<?> request) {
    String correlationId = request.getHeaders().get(HEADER);
    if (correlationId == null || correlationId.isBlank()) {
      correlationId = newCorrelationId();
    }
    request.setAttribute(ATTRIBUTE, correlationId);
    request.setAttribute(STARTED_AT, System.nanoTime());
    log.info("[{}] {} {} - Started", correlationId, request.getMethodName(), request.getPath());
  }

  @ResponseFilter
  public void echoCorrelationId(HttpRequest<?> request, MutableHttpResponse<?> response) {
    String correlationId = correlationId(request);
    if (correlationId == null) {
      return;
    }
    response.header(HEADER, correlationId);

    long startedAt = request.getAttribute(STARTED_AT, Long.class).orElse(System.nanoTime());
    log.info(
        "[{}] {} {} - Completed {} in {} ms",
        correlationId,
        request.getMethodName(),
        request.getPath(),
        response.code(),
        (System.nanoTime() - startedAt) / 1_000_000);
  }

  /** Correlation id assigned to the request, or null when the filter did not run */
  public static String correlationId(HttpRequest<?> request) {
    return request.getAttribute(ATTRIBUTE, String.class).orElse(null);
  }

  static String newCorrelationId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
