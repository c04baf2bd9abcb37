package me.chatrelay.bot.domain.service;

import me.chatrelay.bot.domain.model.InboundMessage;
import me.chatrelay.bot.domain.model.RelayOutcome;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RelayServiceTest {

    private static final String CHAT_ID = "56911111111";

    private BotProperties properties;
    private MessageBatcher messageBatcher;
    private ReplyGatewayService replyGatewayService;
    private MessagingService messagingService;
    private AccessControlService accessControlService;
    private RelayService relayService;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        messageBatcher = mock(MessageBatcher.class);
        replyGatewayService = mock(ReplyGatewayService.class);
        messagingService = mock(MessagingService.class);
        accessControlService = mock(AccessControlService.class);
        Executor direct = Runnable::run;

        when(accessControlService.isAllowed(anyString())).thenReturn(true);
        when(messagingService.sendTyping(anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(messagingService.sendMessage(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        relayService = new RelayService(properties, messageBatcher, replyGatewayService, messagingService,
                accessControlService, direct);
    }

    private static InboundMessage message(String text) {
        return InboundMessage.builder().provider("evolution").chatId(CHAT_ID).text(text).build();
    }

    @Test
    void shouldQueueFirstFragmentAndSendTyping() {
        when(messageBatcher.hasPendingTurn(CHAT_ID)).thenReturn(false);
        when(messageBatcher.submit(eq(CHAT_ID), eq("hola"), any())).thenReturn(true);

        RelayOutcome outcome = relayService.handleInbound(message("hola"));

        assertEquals(RelayOutcome.QUEUED, outcome);
        verify(messagingService).sendTyping(CHAT_ID);
    }

    @Test
    void shouldNotSendTypingForFollowUpFragment() {
        when(messageBatcher.hasPendingTurn(CHAT_ID)).thenReturn(true);
        when(messageBatcher.submit(eq(CHAT_ID), eq("más"), any())).thenReturn(true);

        assertEquals(RelayOutcome.QUEUED, relayService.handleInbound(message("más")));
        verify(messagingService, never()).sendTyping(anyString());
    }

    @Test
    void shouldNotSendTypingWhenBatchFlushedImmediately() {
        when(messageBatcher.hasPendingTurn(CHAT_ID)).thenReturn(true);
        when(messageBatcher.submit(eq(CHAT_ID), eq("diez"), any())).thenReturn(false);

        assertEquals(RelayOutcome.DISPATCHED, relayService.handleInbound(message("diez")));
        verify(messagingService, never()).sendTyping(anyString());
    }

    @Test
    void shouldIgnoreTypingFailure() {
        when(messageBatcher.submit(eq(CHAT_ID), eq("hola"), any())).thenReturn(true);
        when(messagingService.sendTyping(CHAT_ID))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

        assertEquals(RelayOutcome.QUEUED, relayService.handleInbound(message("hola")));
    }

    @Test
    void shouldIgnoreTypingThrownSynchronously() {
        when(messageBatcher.submit(eq(CHAT_ID), eq("hola"), any())).thenReturn(true);
        when(messagingService.sendTyping(CHAT_ID)).thenThrow(new IllegalStateException("offline"));

        assertEquals(RelayOutcome.QUEUED, relayService.handleInbound(message("hola")));
    }

    @Test
    void shouldRejectDeniedSender() {
        when(accessControlService.isAllowed(CHAT_ID)).thenReturn(false);

        assertEquals(RelayOutcome.DENIED, relayService.handleInbound(message("hola")));
        verify(messageBatcher, never()).submit(anyString(), anyString(), any());
    }

    @Test
    void shouldSkipMessageWithoutText() {
        assertEquals(RelayOutcome.NO_TEXT, relayService.handleInbound(message("  ")));
        verify(messageBatcher, never()).submit(anyString(), anyString(), any());
    }

    @Test
    void shouldRunGatewayAndSendReplyWhenTurnFlushes() throws Exception {
        when(messageBatcher.submit(eq(CHAT_ID), eq("hola"), any())).thenReturn(true);
        when(replyGatewayService.process(CHAT_ID, "hola busco médico")).thenReturn("¡Hola! ¿En qué ciudad?");

        relayService.handleInbound(message("hola"));
        ArgumentCaptor<TurnHandler> handler = ArgumentCaptor.forClass(TurnHandler.class);
        verify(messageBatcher).submit(eq(CHAT_ID), eq("hola"), handler.capture());
        handler.getValue().handle("hola busco médico");

        verify(messagingService).sendMessage(CHAT_ID, "¡Hola! ¿En qué ciudad?");
    }

    @Test
    void shouldSendFallbackReplyWhenGatewayFails() {
        when(replyGatewayService.process(anyString(), anyString())).thenThrow(new IllegalStateException("LLM down"));

        relayService.processTurn(CHAT_ID, "hola");

        verify(messagingService).sendMessage(CHAT_ID, RelayService.FALLBACK_REPLY);
    }

    @Test
    void shouldSwallowSendFailureAfterLogging() {
        when(replyGatewayService.process(CHAT_ID, "hola")).thenReturn("respuesta");
        when(messagingService.sendMessage(CHAT_ID, "respuesta"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("HTTP 500")));

        relayService.processTurn(CHAT_ID, "hola");

        verify(messagingService).sendMessage(CHAT_ID, "respuesta");
    }

    @Test
    void shouldProcessImmediatelyWhenBatchingDisabled() {
        properties.getBatcher().setEnabled(false);
        when(replyGatewayService.process(CHAT_ID, "hola")).thenReturn("respuesta");

        assertEquals(RelayOutcome.DISPATCHED, relayService.handleInbound(message("hola")));

        verify(messageBatcher, never()).submit(anyString(), anyString(), any());
        verify(messagingService).sendMessage(CHAT_ID, "respuesta");
    }

    @Test
    void shouldIgnoreMessageWithoutChatId() {
        InboundMessage blank = InboundMessage.builder().provider("twilio").chatId("").text("hola").build();
        InboundMessage missing = InboundMessage.builder().provider("evolution").text("hola").build();

        assertEquals(RelayOutcome.IGNORED, relayService.handleInbound(blank));
        assertEquals(RelayOutcome.IGNORED, relayService.handleInbound(missing));

        verify(messageBatcher, never()).hasPendingTurn(any());
        verify(messageBatcher, never()).submit(any(), any(), any());
        verify(messagingService, never()).sendTyping(any());
        verify(accessControlService, never()).isAllowed(any());
    }

    @Test
    void shouldNotReplyToBlankChatIdWhenBatchingDisabled() {
        properties.getBatcher().setEnabled(false);

        assertEquals(RelayOutcome.IGNORED, relayService.handleInbound(
                InboundMessage.builder().provider("evolution").chatId("  ").text("hola").build()));

        verify(replyGatewayService, never()).process(any(), any());
        verify(messagingService, never()).sendMessage(any(), any());
    }
}
