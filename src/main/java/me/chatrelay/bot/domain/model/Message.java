package me.chatrelay.bot.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in a conversation between user and assistant.
 * Supports the user, assistant, system and tool roles; assistant messages may
 * carry tool calls and tool messages reference the call they answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String role; // user, assistant, system, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Instant timestamp;

    public static Message user(String content) {
        return user(content, Instant.now());
    }

    public static Message user(String content, Instant timestamp) {
        return Message.builder().role("user").content(content).timestamp(timestamp).build();
    }

    public static Message assistant(String content) {
        return assistant(content, Instant.now());
    }

    public static Message assistant(String content, Instant timestamp) {
        return Message.builder().role("assistant").content(content).timestamp(timestamp).build();
    }

    public boolean isUserMessage() {
        return "user".equals(role);
    }

    public boolean isAssistantMessage() {
        return "assistant".equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * A single function invocation requested by the LLM.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
