package io.crewmesh.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a {@code review_request} mailbox message.
 */
public record ReviewRequest(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("author_id") String authorId,
        @JsonProperty("description") String description,
        @JsonProperty("result") String result
) {
}
