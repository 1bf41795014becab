package com.acme.dispatch.application.command;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteUserCommand(
        @JsonProperty("user_id") String userId,
        @JsonProperty("correlation_id") String correlationId) {

    public DeleteUserCommand {
        CommandPayloads.require(userId, "user_id");
    }
}
