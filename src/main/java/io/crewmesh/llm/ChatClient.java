package io.crewmesh.llm;

import java.util.List;

/**
 * Chat completion capability. Provider adapters, retry wrappers and routers all implement this
 * one method, so they can be stacked as decorators.
 */
@FunctionalInterface
public interface ChatClient {
    String chat(List<ChatMessage> messages, String model) throws ChatException;
}
