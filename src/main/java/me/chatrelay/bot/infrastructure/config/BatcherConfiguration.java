package me.chatrelay.bot.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the message batcher.
 *
 * <p>
 * The timer executor only decides when a turn is due; turn handlers (LLM calls
 * and outbound sends) run on a separate cached pool so a slow reply never
 * delays another conversation's flush.
 */
@Configuration
@Slf4j
public class BatcherConfiguration {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private ScheduledExecutorService timerExecutor;
    private ExecutorService handlerExecutor;

    @Bean(name = "batcherTimerExecutor", destroyMethod = "")
    public ScheduledExecutorService batcherTimerExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "batcher-timer");
            t.setDaemon(true);
            return t;
        });
        // cancelled timers leave the queue immediately
        executor.setRemoveOnCancelPolicy(true);
        this.timerExecutor = executor;
        return executor;
    }

    @Bean(name = "turnHandlerExecutor", destroyMethod = "")
    public ExecutorService turnHandlerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "turn-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.handlerExecutor = executor;
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        shutdownGracefully("batcher-timer", timerExecutor);
        shutdownGracefully("turn-handler", handlerExecutor);
        log.info("[Batcher] executors shut down");
    }

    private void shutdownGracefully(String name, ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Batcher] {} executor did not terminate in {}s, forcing", name, SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
