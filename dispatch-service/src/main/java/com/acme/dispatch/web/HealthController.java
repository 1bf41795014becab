package com.acme.dispatch.web;

import com.acme.dispatch.config.DispatchProperties;
import com.acme.dispatch.kafka.KafkaSettings;
import com.acme.dispatch.mq.JmsSettings;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.LinkedHashMap;
import java.util.Map;

@Controller("/health")
public class HealthController {
  static final String SERVICE = "dispatch-platform";
  static final String VERSION = "1.0.0";

  private final DispatchProperties properties;
  private final KafkaSettings kafkaSettings;
  private final JmsSettings jmsSettings;

  public HealthController(
      DispatchProperties properties, KafkaSettings kafkaSettings, JmsSettings jmsSettings) {
    this.properties = properties;
    this.kafkaSettings = kafkaSettings;
    this.jmsSettings = jmsSettings;
  }

  @Get
  public HttpResponse<Map<String, Object>> health() {
    return HttpResponse.ok(Map.of("status", "UP", "service", SERVICE, "version", VERSION));
  }

  /** Reports which adapters are bound; no remote system is probed. */
  @Get("/ready")
  public HttpResponse<Map<String, Object>> ready() {
    Map<String, Object> checks = new LinkedHashMap<>();
    checks.put("persistence", properties.getPersistence().getMode());
    checks.put("stream", kafkaSettings.isEnabled() ? "enabled" : "disabled");
    checks.put("queue", jmsSettings.isEnabled() ? "enabled" : "disabled");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "READY");
    body.put("checks", checks);
    return HttpResponse.ok(body);
  }
}
