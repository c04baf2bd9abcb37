package me.chatrelay.bot.domain.service;

import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.MessagingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MessagingServiceTest {

    private static final String CHAT_ID = "56911111111";
    private static final String TEXT = "respuesta";

    private BotProperties properties;
    private MessagingPort evolution;
    private MessagingPort twilio;
    private MessagingService messagingService;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        evolution = mock(MessagingPort.class);
        twilio = mock(MessagingPort.class);
        when(evolution.getProviderId()).thenReturn(MessagingService.EVOLUTION);
        when(twilio.getProviderId()).thenReturn(MessagingService.TWILIO);
        when(evolution.isConfigured()).thenReturn(true);
        when(twilio.isConfigured()).thenReturn(true);
        when(evolution.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(twilio.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        messagingService = new MessagingService(properties, List.of(evolution, twilio));
    }

    @Test
    void shouldSendThroughEvolutionByDefault() {
        messagingService.sendMessage(CHAT_ID, TEXT).join();

        verify(evolution).sendMessage(CHAT_ID, TEXT);
        verify(twilio, never()).sendMessage(anyString(), anyString());
        assertEquals(MessagingService.EVOLUTION, messagingService.getActiveProviderId());
    }

    @Test
    void shouldSendThroughTwilioWhenSelected() {
        properties.getMessaging().setProvider("twilio");

        messagingService.sendMessage(CHAT_ID, TEXT).join();

        verify(twilio).sendMessage(CHAT_ID, TEXT);
        verify(evolution, never()).sendMessage(anyString(), anyString());
    }

    @Test
    void shouldFallBackToEvolutionWhenTwilioFails() {
        properties.getMessaging().setProvider("twilio");
        when(twilio.sendMessage(CHAT_ID, TEXT))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("HTTP 401")));

        messagingService.sendMessage(CHAT_ID, TEXT).join();

        verify(evolution).sendMessage(CHAT_ID, TEXT);
    }

    @Test
    void shouldUseEvolutionWhenTwilioSelectedButNotConfigured() {
        properties.getMessaging().setProvider("twilio");
        when(twilio.isConfigured()).thenReturn(false);

        messagingService.sendMessage(CHAT_ID, TEXT).join();

        verify(twilio, never()).sendMessage(anyString(), anyString());
        verify(evolution).sendMessage(CHAT_ID, TEXT);
    }

    @Test
    void shouldFailWhenEvolutionSendFails() {
        when(evolution.sendMessage(CHAT_ID, TEXT))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("HTTP 500")));

        CompletableFuture<Void> result = messagingService.sendMessage(CHAT_ID, TEXT);

        assertThrows(CompletionException.class, result::join);
    }

    @Test
    void shouldSendTypingThroughActiveProvider() {
        when(evolution.sendTyping(CHAT_ID)).thenReturn(CompletableFuture.completedFuture(null));

        messagingService.sendTyping(CHAT_ID).join();

        verify(evolution).sendTyping(CHAT_ID);
    }

    @Test
    void shouldReportProviderConfiguration() {
        when(twilio.isConfigured()).thenReturn(false);

        assertTrue(messagingService.isConfigured(MessagingService.EVOLUTION));
        assertFalse(messagingService.isConfigured(MessagingService.TWILIO));
        assertFalse(messagingService.isConfigured("telegram"));
        assertTrue(messagingService.isAnyConfigured());
    }
}
