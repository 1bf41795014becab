package com.acme.dispatch.kafka;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kafka connection, consumer and publishing settings. Pure POJO - bound from {@code dispatch.kafka.*}
 * by the service module.
 */
public class KafkaSettings {

  private boolean enabled = false;
  private String bootstrapServers = "localhost:9092";
  private String groupId = "dispatch-platform";
  private String autoOffsetReset = "earliest";
  private Duration publishTimeout = Duration.ofSeconds(10);
  private Duration pollTimeout = Duration.ofSeconds(1);

  // Entries of the form topic=operation
  private List<String> topicMappings =
      new ArrayList<>(List.of("user.commands=create_user", "payment.commands=process_payment"));

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getGroupId() {
    return groupId;
  }

  public void setGroupId(String groupId) {
    this.groupId = groupId;
  }

  public String getAutoOffsetReset() {
    return autoOffsetReset;
  }

  public void setAutoOffsetReset(String autoOffsetReset) {
    this.autoOffsetReset = autoOffsetReset;
  }

  public Duration getPublishTimeout() {
    return publishTimeout;
  }

  public void setPublishTimeout(Duration publishTimeout) {
    this.publishTimeout = publishTimeout;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  public List<String> getTopicMappings() {
    return topicMappings;
  }

  public void setTopicMappings(List<String> topicMappings) {
    this.topicMappings = topicMappings;
  }

  /**
   * Topic to operation map parsed from {@link #getTopicMappings()}, in declaration order.
   *
   * @throws IllegalArgumentException if an entry is not of the form {@code topic=operation}
   */
  public Map<String, String> topicOperations() {
    Map<String, String> operations = new LinkedHashMap<>();
    if (topicMappings == null) {
      return operations;
    }
    for (String mapping : topicMappings) {
      int separator = mapping.indexOf('=');
      if (separator <= 0 || separator == mapping.length() - 1) {
        throw new IllegalArgumentException("Invalid topic mapping: " + mapping);
      }
      operations.put(
          mapping.substring(0, separator).trim(), mapping.substring(separator + 1).trim());
    }
    return operations;
  }
}
