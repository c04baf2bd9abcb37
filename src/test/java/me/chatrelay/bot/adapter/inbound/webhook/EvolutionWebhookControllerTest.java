package me.chatrelay.bot.adapter.inbound.webhook;

import me.chatrelay.bot.adapter.inbound.webhook.dto.EvolutionWebhookEvent;
import me.chatrelay.bot.adapter.inbound.webhook.dto.WebhookResponse;
import me.chatrelay.bot.domain.model.InboundMessage;
import me.chatrelay.bot.domain.model.RelayOutcome;
import me.chatrelay.bot.domain.service.RelayService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvolutionWebhookControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String REMOTE_JID = "56911111111@s.whatsapp.net";

    private RelayService relayService;
    private EvolutionWebhookController controller;

    @BeforeEach
    void setUp() {
        relayService = mock(RelayService.class);
        controller = new EvolutionWebhookController(relayService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRelayConversationText() {
        when(relayService.handleInbound(any())).thenReturn(RelayOutcome.QUEUED);

        StepVerifier.create(controller.onEvent(event("messages.upsert", false, "hola")))
                .assertNext(response -> {
                    WebhookResponse body = response.getBody();
                    assertEquals("queued", body.getStatus());
                    assertEquals("56911111111", body.getChatId());
                })
                .verifyComplete();

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(relayService).handleInbound(captor.capture());
        InboundMessage message = captor.getValue();
        assertEquals("56911111111", message.getChatId());
        assertEquals("hola", message.getText());
        assertEquals("evolution", message.getProvider());
        assertEquals("MSG1", message.getId());
        assertEquals(NOW, message.getTimestamp());
    }

    @Test
    void shouldReadExtendedTextMessage() {
        when(relayService.handleInbound(any())).thenReturn(RelayOutcome.DISPATCHED);
        EvolutionWebhookEvent event = event("MESSAGES_UPSERT", false, null);
        event.getData().getMessage().setExtendedTextMessage(
                new EvolutionWebhookEvent.ExtendedTextMessage("respondiendo a tu mensaje"));

        StepVerifier.create(controller.onEvent(event))
                .assertNext(response -> assertEquals("ok", response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldIgnoreOtherEvents() {
        StepVerifier.create(controller.onEvent(event("connection.update", false, "hola")))
                .assertNext(response -> {
                    assertEquals("ignored", response.getBody().getStatus());
                    assertNull(response.getBody().getChatId());
                })
                .verifyComplete();
        verify(relayService, never()).handleInbound(any());
    }

    @Test
    void shouldIgnoreOwnMessages() {
        StepVerifier.create(controller.onEvent(event("messages.upsert", true, "hola")))
                .assertNext(response -> assertEquals("ignored", response.getBody().getStatus()))
                .verifyComplete();
        verify(relayService, never()).handleInbound(any());
    }

    @Test
    void shouldReportNoTextForMediaMessages() {
        StepVerifier.create(controller.onEvent(event("messages.upsert", false, " ")))
                .assertNext(response -> {
                    assertEquals("no_text", response.getBody().getStatus());
                    assertEquals("56911111111", response.getBody().getChatId());
                })
                .verifyComplete();
        verify(relayService, never()).handleInbound(any());
    }

    @Test
    void shouldReportDeniedSenders() {
        when(relayService.handleInbound(any())).thenReturn(RelayOutcome.DENIED);

        StepVerifier.create(controller.onEvent(event("messages.upsert", false, "hola")))
                .assertNext(response -> assertEquals("denied", response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldAcceptJsonPayloadOverHttp() {
        when(relayService.handleInbound(any())).thenReturn(RelayOutcome.QUEUED);
        WebTestClient client = WebTestClient.bindToController(controller).build();

        client.post()
                .uri("/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"event":"messages.upsert","instance":"relay",
                         "data":{"key":{"remoteJid":"56911111111@s.whatsapp.net","fromMe":false,"id":"MSG1"},
                                 "pushName":"Ana","message":{"conversation":"hola"},"messageTimestamp":1772359200}}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("queued")
                .jsonPath("$.chatId").isEqualTo("56911111111");
    }

    @Test
    void shouldIgnoreRemoteJidWithoutNumber() {
        EvolutionWebhookEvent event = event("messages.upsert", false, "hola");
        event.getData().getKey().setRemoteJid("@s.whatsapp.net");

        StepVerifier.create(controller.onEvent(event))
                .assertNext(response -> {
                    assertEquals("ignored", response.getBody().getStatus());
                    assertNull(response.getBody().getChatId());
                })
                .verifyComplete();
        verify(relayService, never()).handleInbound(any());
    }

    @Test
    void shouldMapEveryRelayOutcomeToStatus() {
        assertEquals("queued", EvolutionWebhookController.statusOf(RelayOutcome.QUEUED));
        assertEquals("ok", EvolutionWebhookController.statusOf(RelayOutcome.DISPATCHED));
        assertEquals("denied", EvolutionWebhookController.statusOf(RelayOutcome.DENIED));
        assertEquals("no_text", EvolutionWebhookController.statusOf(RelayOutcome.NO_TEXT));
        assertEquals("ignored", EvolutionWebhookController.statusOf(RelayOutcome.IGNORED));
    }

    @Test
    void shouldStripJidSuffix() {
        assertEquals("56911111111", EvolutionWebhookController.extractChatId(REMOTE_JID));
        assertEquals("56911111111", EvolutionWebhookController.extractChatId("56911111111"));
    }

    private static EvolutionWebhookEvent event(String name, boolean fromMe, String conversation) {
        return EvolutionWebhookEvent.builder()
                .event(name)
                .instance("relay")
                .data(EvolutionWebhookEvent.EventData.builder()
                        .key(new EvolutionWebhookEvent.MessageKey(REMOTE_JID, fromMe, "MSG1"))
                        .message(EvolutionWebhookEvent.MessageContent.builder()
                                .conversation(conversation)
                                .build())
                        .build())
                .build();
    }
}
