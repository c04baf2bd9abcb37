package me.chatrelay.bot.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Completion returned by an LLM provider: either final text or a set of tool
 * calls to execute before asking again.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private List<Message.ToolCall> toolCalls;
    private String model;
    private String finishReason;
    private Integer inputTokens;
    private Integer outputTokens;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
