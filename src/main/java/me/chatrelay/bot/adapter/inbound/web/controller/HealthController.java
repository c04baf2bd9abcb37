package me.chatrelay.bot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.chatrelay.bot.domain.service.MessageBatcher;
import me.chatrelay.bot.domain.service.MessagingService;
import me.chatrelay.bot.port.outbound.DirectoryPort;
import me.chatrelay.bot.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and configuration endpoints used by the hosting platform and
 * uptime monitors. None of them call external services.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final String SERVICE_NAME = "ChatRelay WhatsApp Bot";
    private static final String OK = "ok";
    private static final String ERROR = "error";

    private final LlmPort llmPort;
    private final DirectoryPort directoryPort;
    private final MessagingService messagingService;
    private final MessageBatcher messageBatcher;
    private final Clock clock;

    @Value("${server.port:8000}")
    private String serverPort;

    @GetMapping("/ping")
    public Mono<ResponseEntity<PingResponse>> ping() {
        return Mono.just(ResponseEntity.ok(new PingResponse("pong", clock.instant())));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<StatusResponse>> status() {
        return Mono.just(ResponseEntity.ok(new StatusResponse(SERVICE_NAME, "online", serverPort)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        Map<String, String> checks = new LinkedHashMap<>();
        checks.put("llm", llmPort.isAvailable() ? OK : ERROR);
        checks.put("directory", directoryPort.isAvailable() ? OK : ERROR);
        checks.put("whatsapp", messagingService.isAnyConfigured() ? OK : ERROR);

        String overall = checks.containsValue(ERROR) ? "degraded" : "healthy";
        return Mono.just(ResponseEntity.ok(new HealthResponse(overall, clock.instant(), checks,
                messageBatcher.pendingTurnCount())));
    }

    @GetMapping("/")
    public Mono<ResponseEntity<ServiceInfoResponse>> root() {
        String active = messagingService.getActiveProviderId();
        Map<String, ProviderInfo> providers = new LinkedHashMap<>();
        for (String provider : new String[] { MessagingService.EVOLUTION, MessagingService.TWILIO }) {
            providers.put(provider, new ProviderInfo(messagingService.isConfigured(provider),
                    provider.equals(active)));
        }
        return Mono.just(ResponseEntity.ok(new ServiceInfoResponse(SERVICE_NAME, "1.0.0", "active",
                serverPort, providers)));
    }

    public record PingResponse(String message, Instant timestamp) {
    }

    public record StatusResponse(String service, String status, String port) {
    }

    public record HealthResponse(String status, Instant timestamp, Map<String, String> checks,
            int pendingTurns) {
    }

    public record ProviderInfo(boolean configured, boolean active) {
    }

    public record ServiceInfoResponse(String service, String version, String status, String port,
            Map<String, ProviderInfo> providers) {
    }
}
