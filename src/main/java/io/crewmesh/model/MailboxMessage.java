package io.crewmesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MailboxMessage(
        @JsonProperty("from") String from,
        @JsonProperty("type") MessageType type,
        @JsonProperty("content") String content,
        @JsonProperty("ts") long timestampMs
) {
}
