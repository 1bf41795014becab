package com.acme.dispatch.application.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Command to send a notification. {@code {key}} placeholders in the body are filled from
 * {@code variables}.
 */
public record SendNotificationCommand(
        String recipient,
        String channel,
        String subject,
        String body,
        @JsonProperty("user_id") String userId,
        @JsonProperty("template_id") String templateId,
        Map<String, Object> variables,
        Map<String, Object> metadata,
        @JsonProperty("correlation_id") String correlationId) {

    public SendNotificationCommand {
        CommandPayloads.require(recipient, "recipient");
        CommandPayloads.require(channel, "channel");
        CommandPayloads.require(subject, "subject");
        CommandPayloads.require(body, "body");
        variables = variables != null ? CommandPayloads.copyOf(variables) : Map.of();
        metadata = metadata != null ? CommandPayloads.copyOf(metadata) : Map.of();
    }
}
