package me.chatrelay.bot.adapter.inbound.web.controller;

import me.chatrelay.bot.adapter.inbound.web.GlobalExceptionHandler;
import me.chatrelay.bot.domain.service.MessageBatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatcherControllerWebTest {

    private MessageBatcher messageBatcher;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        messageBatcher = mock(MessageBatcher.class);
        BatcherController controller = new BatcherController(messageBatcher);

        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldMapMissingTurnToNotFound() {
        when(messageBatcher.status("56900000000")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/batcher/turns/56900000000")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.message").isEqualTo("No pending turn: 56900000000");
    }

    @Test
    void shouldMapUnexpectedErrorToInternalServerError() {
        when(messageBatcher.forceFlush("56911111111")).thenThrow(new IllegalStateException("boom"));

        webTestClient.post()
                .uri("/api/batcher/turns/56911111111/flush")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.status").isEqualTo(500)
                .jsonPath("$.message").isEqualTo("Internal server error");
    }

    @Test
    void shouldFlushThroughHttp() {
        when(messageBatcher.forceFlush("56911111111")).thenReturn(true);

        webTestClient.post()
                .uri("/api/batcher/turns/56911111111/flush")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.flushed").isEqualTo(true);
    }
}
