package com.acme.dispatch.application.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Partial update of a user. A {@code null} component means "leave unchanged".
 */
public record UpdateUserCommand(
        @JsonProperty("user_id") String userId,
        String name,
        Integer age,
        Map<String, Object> metadata,
        @JsonProperty("correlation_id") String correlationId) {

    public UpdateUserCommand {
        CommandPayloads.require(userId, "user_id");
        metadata = CommandPayloads.copyOf(metadata);
    }
}
