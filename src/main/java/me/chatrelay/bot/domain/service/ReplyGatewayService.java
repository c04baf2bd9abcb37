package me.chatrelay.bot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.model.LlmRequest;
import me.chatrelay.bot.domain.model.LlmResponse;
import me.chatrelay.bot.domain.model.Message;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.LlmPort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one combined user turn into a reply.
 *
 * <p>
 * Flow: load history, call the model with the directory tools, and when the
 * model asks for tools run them and call it once more without tools. The
 * exchange is then written back to conversation memory. Model failures
 * propagate to the caller.
 */
@Service
@Slf4j
public class ReplyGatewayService {

    static final String EMPTY_REPLY = "Lo siento, no pude generar una respuesta. ¿Puedes intentarlo de nuevo?";
    private static final String DEFAULT_SYSTEM_PROMPT = "Eres un asistente que ayuda a encontrar profesionales "
            + "de la salud. Responde en español.";

    private final LlmPort llmPort;
    private final DirectoryService directoryService;
    private final ConversationMemoryService memoryService;
    private final BotProperties properties;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    private volatile String systemPrompt;

    public ReplyGatewayService(LlmPort llmPort, DirectoryService directoryService,
            ConversationMemoryService memoryService, BotProperties properties, ResourceLoader resourceLoader,
            Clock clock) {
        this.llmPort = llmPort;
        this.directoryService = directoryService;
        this.memoryService = memoryService;
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    /**
     * Produces the reply for a chat turn.
     *
     * @param chatId
     *            conversation key
     * @param userText
     *            the combined user turn
     * @return reply text, never blank
     */
    public String process(String chatId, String userText) {
        List<Message> history = memoryService.getHistory(chatId);
        log.info("[Gateway] processing turn for {} ({} chars, {} history messages)", chatId,
                userText.length(), history.size());

        List<Message> messages = new ArrayList<>(history);
        messages.add(Message.user(userText, clock.instant()));

        LlmResponse response = llmPort.chat(buildRequest(chatId, messages, true)).join();

        if (response.hasToolCalls()) {
            log.info("[Gateway] model requested {} tool call(s)", response.getToolCalls().size());
            messages.add(Message.builder()
                    .role("assistant")
                    .toolCalls(response.getToolCalls())
                    .timestamp(clock.instant())
                    .build());
            for (Message.ToolCall toolCall : response.getToolCalls()) {
                String result = directoryService.executeTool(toolCall);
                log.debug("[Gateway] tool {} returned {} chars", toolCall.getName(), result.length());
                messages.add(Message.builder()
                        .role("tool")
                        .toolCallId(toolCall.getId())
                        .toolName(toolCall.getName())
                        .content(result)
                        .timestamp(clock.instant())
                        .build());
            }
            response = llmPort.chat(buildRequest(chatId, messages, false)).join();
        }

        String reply = response.getContent();
        if (reply == null || reply.isBlank()) {
            log.warn("[Gateway] model returned an empty reply for {}", chatId);
            reply = EMPTY_REPLY;
        }
        log.info("[Gateway] reply ready for {} ({} chars)", chatId, reply.length());

        memoryService.recordTurn(chatId, history, userText, reply);
        return reply;
    }

    private LlmRequest buildRequest(String chatId, List<Message> messages, boolean withTools) {
        return LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .systemPrompt(getSystemPrompt())
                .messages(new ArrayList<>(messages))
                .tools(withTools ? directoryService.getToolDefinitions() : new ArrayList<>())
                .temperature(properties.getLlm().getTemperature())
                .chatId(chatId)
                .build();
    }

    String getSystemPrompt() {
        String prompt = systemPrompt;
        if (prompt == null) {
            prompt = loadSystemPrompt();
            systemPrompt = prompt;
        }
        return prompt;
    }

    private String loadSystemPrompt() {
        String path = properties.getLlm().getSystemPromptPath();
        if (path == null || path.isBlank()) {
            return DEFAULT_SYSTEM_PROMPT;
        }
        Resource resource = resourceLoader.getResource(path);
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            log.info("[Gateway] system prompt loaded from {} ({} chars)", path, text.length());
            return text.isEmpty() ? DEFAULT_SYSTEM_PROMPT : text;
        } catch (IOException e) {
            log.warn("[Gateway] system prompt not readable at {}, using default: {}", path, e.getMessage());
            return DEFAULT_SYSTEM_PROMPT;
        }
    }
}
