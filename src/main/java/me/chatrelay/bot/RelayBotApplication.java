package me.chatrelay.bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the chat relay bot.
 *
 * <p>
 * The relay receives inbound WhatsApp events (Evolution API or Twilio),
 * coalesces bursts of messages from the same participant into one logical
 * turn, resolves a reply through an LLM with directory lookup tools, and sends
 * the reply back through the configured provider.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → EvolutionWebhookController, TwilioWebhookController
 * Domain Layer       → MessageBatcher, RelayService, ReplyGatewayService
 * Infrastructure     → LLM / Messaging / Directory / Memory adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayBotApplication.class, args);
    }

}
