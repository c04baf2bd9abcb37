package me.chatrelay.bot.port.outbound;

import me.chatrelay.bot.domain.model.LlmRequest;
import me.chatrelay.bot.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for integrating with LLM providers. Provides chat completion with
 * function calling support.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the current or default model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
