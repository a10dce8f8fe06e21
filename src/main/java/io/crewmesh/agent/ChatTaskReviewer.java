package io.crewmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.crewmesh.llm.ChatClient;
import io.crewmesh.llm.ChatException;
import io.crewmesh.llm.ChatMessage;
import io.crewmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Asks a chat model for a {@code {"score": n, "comment": "..."}} verdict and falls back to
 * another reviewer when the call fails or the reply cannot be parsed.
 */
public final class ChatTaskReviewer implements TaskReviewer {
    private static final Logger LOG = LoggerFactory.getLogger(ChatTaskReviewer.class);

    private final ChatClient chat;
    private final String model;
    private final TaskReviewer fallback;

    public ChatTaskReviewer(ChatClient chat, String model, TaskReviewer fallback) {
        this.chat = chat;
        this.model = model;
        this.fallback = fallback;
    }

    @Override
    public ReviewVerdict review(ReviewRequest request) throws Exception {
        String prompt = "Task:\n" + request.description() + "\n\nResult:\n" + request.result()
                + "\n\nScore the result from 0 to 100. Reply with JSON only: {\"score\": <int>, \"comment\": \"<one sentence>\"}";
        try {
            String reply = chat.chat(List.of(
                    ChatMessage.system("You are a strict peer reviewer."),
                    ChatMessage.user(prompt)
            ), model);
            return parse(reply);
        } catch (ChatException | IOException | IllegalArgumentException e) {
            LOG.warn("chat review of {} failed, falling back: {}", request.taskId(), e.getMessage());
            return fallback.review(request);
        }
    }

    static ReviewVerdict parse(String reply) throws IOException {
        if (reply == null) {
            throw new IllegalArgumentException("empty review reply");
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("review reply has no JSON object");
        }
        JsonNode node = Jsons.mapper().readTree(reply.substring(start, end + 1));
        if (!node.path("score").isNumber()) {
            throw new IllegalArgumentException("review reply has no numeric score");
        }
        return new ReviewVerdict(node.path("score").asDouble(), node.path("comment").asText(""));
    }
}
