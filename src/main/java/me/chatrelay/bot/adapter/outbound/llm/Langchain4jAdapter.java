package me.chatrelay.bot.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.model.LlmRequest;
import me.chatrelay.bot.domain.model.LlmResponse;
import me.chatrelay.bot.domain.model.Message;
import me.chatrelay.bot.domain.model.ToolDefinition;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * OpenAI-compatible chat adapter built on langchain4j.
 *
 * <p>
 * The model is created lazily on first use from {@code bot.llm.*}. Rate-limit
 * errors are retried with exponential backoff; langchain4j's own retries are
 * disabled. Any other failure completes the future with an
 * {@link LlmException}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;

    public Langchain4jAdapter(BotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getChatModel();
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response;
                    if (!tools.isEmpty()) {
                        log.debug("[LLM] calling model with {} tools", tools.size());
                        response = model.chat(ChatRequest.builder()
                                .messages(messages)
                                .toolSpecifications(tools)
                                .build());
                    } else {
                        response = model.chat(messages);
                    }
                    return convertResponse(response);
                } catch (Exception e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        throw new LlmException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new LlmException("LLM chat failed: max retries exhausted", null);
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    protected ChatModel createChatModel() {
        BotProperties.LlmProperties llm = properties.getLlm();
        if (!isAvailable()) {
            throw new LlmException("LLM is not configured, set bot.llm.api-key", null);
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .maxRetries(0)
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        log.info("[LLM] OpenAI model initialized: {}", llm.getModel());
        return builder.build();
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(new LlmException("LLM chat interrupted during retry backoff", e));
        }
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createChatModel();
                }
                model = chatModel;
            }
        }
        return model;
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            case "assistant" -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case "tool" -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            default -> log.warn("[LLM] Unknown message role: {}, skipped", msg.getRole());
            }
        }

        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> props) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : props.entrySet()) {
                Map<String, Object> param = (Map<String, Object>) entry.getValue();
                // directory tools only declare string parameters
                schemaBuilder.addStringProperty((String) entry.getKey(), (String) param.get("description"));
            }
            List<String> required = (List<String>) schema.get("required");
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }

        return builder.build();
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.debug("[LLM] parsed {} tool calls from response", toolCalls.size());
        }

        LlmResponse.LlmResponseBuilder builder = LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(getCurrentModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "STOP");
        if (response.tokenUsage() != null) {
            builder.inputTokens(response.tokenUsage().inputTokenCount())
                    .outputTokens(response.tokenUsage().outputTokenCount());
        }
        return builder.build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * Raised when the model call fails for a reason other than a retried rate
     * limit.
     */
    public static class LlmException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public LlmException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
