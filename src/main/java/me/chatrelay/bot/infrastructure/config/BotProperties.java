package me.chatrelay.bot.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the relay bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link BatcherProperties} - message coalescing (idle window, batch
 * cap)</li>
 * <li>{@link MessagingProperties} - WhatsApp providers (Evolution API,
 * Twilio)</li>
 * <li>{@link LlmProperties} - OpenAI-compatible model settings</li>
 * <li>{@link DirectoryProperties} - spreadsheet-style professional
 * directory</li>
 * <li>{@link MemoryProperties} - per-chat conversation memory bounds</li>
 * <li>{@link AccessProperties} - allowlist of phone numbers</li>
 * </ul>
 *
 * <p>
 * Batcher values are read once at startup; changing them requires a restart.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private BatcherProperties batcher = new BatcherProperties();
    private MessagingProperties messaging = new MessagingProperties();
    private LlmProperties llm = new LlmProperties();
    private DirectoryProperties directory = new DirectoryProperties();
    private MemoryProperties memory = new MemoryProperties();
    private AccessProperties access = new AccessProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== BATCHER ====================

    @Data
    public static class BatcherProperties {
        /**
         * When false, every inbound message is processed as its own turn.
         */
        private boolean enabled = true;

        /** Quiet period after the last fragment before a turn is flushed. */
        private Duration idleWindow = Duration.ofSeconds(20);

        /** Fragment count that forces an immediate flush. */
        private int maxBatch = 10;
    }

    // ==================== MESSAGING ====================

    @Data
    public static class MessagingProperties {
        /** Active provider: {@code evolution} or {@code twilio}. */
        private String provider = "evolution";
        private EvolutionProperties evolution = new EvolutionProperties();
        private TwilioProperties twilio = new TwilioProperties();
    }

    @Data
    public static class EvolutionProperties {
        private String baseUrl;
        private String apiKey;
        private String instanceId;
        private int maxMessageChars = 4096;
        private int sendDelayMs = 1200;
        private int typingDelayMs = 3000;
    }

    @Data
    public static class TwilioProperties {
        private String baseUrl = "https://api.twilio.com";
        private String accountSid;
        private String authToken;
        private String whatsappNumber;
        private int maxMessageChars = 1600;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private Duration timeout = Duration.ofSeconds(60);
        private String systemPromptPath = "classpath:prompts/system_prompt.txt";
    }

    // ==================== DIRECTORY ====================

    @Data
    public static class DirectoryProperties {
        private String path = "classpath:directory/directory.csv";
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /** Messages kept per chat after a turn is saved. */
        private int maxHistory = 20;

        /** Prior messages carried into the saved history of a new turn. */
        private int carryOver = 8;

        /** Chats kept in RAM; the eldest is evicted beyond this. */
        private int maxChats = 100;
    }

    // ==================== ACCESS ====================

    @Data
    public static class AccessProperties {
        private boolean enabled = false;
        private List<String> allowedUsers = new ArrayList<>();

        /**
         * Optional file with one allowed number per line (first CSV column),
         * merged with {@code allowed-users} and re-read after the cache TTL.
         */
        private String allowedUsersPath;
        private Duration cacheTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 10000;
        private long writeTimeout = 10000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
