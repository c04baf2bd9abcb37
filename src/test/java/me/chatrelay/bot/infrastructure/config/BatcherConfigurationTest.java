package me.chatrelay.bot.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatcherConfigurationTest {

    @Test
    void shouldRunTimersOnSingleDaemonThread() throws Exception {
        BatcherConfiguration configuration = new BatcherConfiguration();
        ScheduledExecutorService timer = configuration.batcherTimerExecutor();

        CompletableFuture<Thread> thread = new CompletableFuture<>();
        timer.schedule(() -> thread.complete(Thread.currentThread()), 1, TimeUnit.MILLISECONDS);

        Thread worker = thread.get(5, TimeUnit.SECONDS);
        assertEquals("batcher-timer", worker.getName());
        assertTrue(worker.isDaemon());
        configuration.shutdown();
    }

    @Test
    void shouldDropCancelledTimersFromQueue() {
        BatcherConfiguration configuration = new BatcherConfiguration();
        ScheduledThreadPoolExecutor timer = (ScheduledThreadPoolExecutor) configuration.batcherTimerExecutor();

        ScheduledFuture<?> future = timer.schedule(() -> {
        }, 1, TimeUnit.HOURS);
        future.cancel(false);

        assertEquals(0, timer.getQueue().size());
        configuration.shutdown();
    }

    @Test
    void shouldNameHandlerThreadsAndStopOnShutdown() throws Exception {
        BatcherConfiguration configuration = new BatcherConfiguration();
        configuration.batcherTimerExecutor();
        ExecutorService handlers = configuration.turnHandlerExecutor();

        String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), handlers)
                .get(5, TimeUnit.SECONDS);
        assertTrue(name.startsWith("turn-handler-"));

        configuration.shutdown();
        assertTrue(handlers.isShutdown());
    }
}
