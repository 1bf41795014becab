package com.acme.dispatch.application.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Command to register a new user
 */
public record CreateUserCommand(
        String name,
        String email,
        Integer age,
        Map<String, Object> metadata,
        @JsonProperty("correlation_id") String correlationId) {

    public CreateUserCommand {
        CommandPayloads.require(name, "name");
        CommandPayloads.require(email, "email");
        metadata = metadata != null ? CommandPayloads.copyOf(metadata) : Map.of();
    }
}
