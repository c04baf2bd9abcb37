package me.chatrelay.bot.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.component.TurnCombinerComponent;
import me.chatrelay.bot.domain.model.TurnStatus;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Coalesces bursts of inbound fragments per conversation into single turns.
 *
 * <p>
 * Each conversation key owns at most one pending turn. Every fragment appended
 * to it re-arms an idle timer; the turn is flushed when the idle window elapses
 * without a new fragment, when the fragment count reaches the batch cap, or on
 * {@link #forceFlush(String)}. A flush detaches the turn from the registry,
 * combines its fragments and dispatches the handler on the turn executor
 * without waiting for it, so the next fragment for the same key starts a fresh
 * turn immediately.
 *
 * <p>
 * Per-key steps are serialized through {@link ConcurrentHashMap#compute}; each
 * armed timer captures the turn's generation and is a no-op when the live
 * generation has moved on or the turn was already detached. A turn is therefore
 * flushed at most once.
 */
@Service
@Slf4j
public class MessageBatcher {

    private final TurnCombinerComponent turnCombiner;
    private final ScheduledExecutorService timerExecutor;
    private final Executor turnHandlerExecutor;
    private final Clock clock;
    private final Duration idleWindow;
    private final int maxBatch;

    private final Map<String, PendingTurn> pendingTurns = new ConcurrentHashMap<>();

    public MessageBatcher(BotProperties properties,
            TurnCombinerComponent turnCombiner,
            @Qualifier("batcherTimerExecutor") ScheduledExecutorService timerExecutor,
            @Qualifier("turnHandlerExecutor") Executor turnHandlerExecutor,
            Clock clock) {
        BotProperties.BatcherProperties batcher = properties.getBatcher();
        if (batcher.getIdleWindow() == null || batcher.getIdleWindow().isNegative()) {
            throw new IllegalArgumentException("bot.batcher.idle-window must be a non-negative duration");
        }
        if (batcher.getMaxBatch() < 1) {
            throw new IllegalArgumentException("bot.batcher.max-batch must be at least 1");
        }
        this.turnCombiner = turnCombiner;
        this.timerExecutor = timerExecutor;
        this.turnHandlerExecutor = turnHandlerExecutor;
        this.clock = clock;
        this.idleWindow = batcher.getIdleWindow();
        this.maxBatch = batcher.getMaxBatch();
        log.info("[Batcher] initialized: idleWindow={}, maxBatch={}", idleWindow, maxBatch);
    }

    /**
     * Adds a fragment to the conversation's pending turn, creating the turn if
     * none is pending.
     *
     * @param key
     *            conversation key
     * @param fragment
     *            non-blank message text
     * @param handler
     *            receives the combined turn; only the first fragment's handler
     *            is kept
     * @return {@code true} if the fragment was absorbed and the turn is still
     *         accumulating; {@code false} if it filled the batch and the turn
     *         was flushed immediately
     */
    public boolean submit(String key, String fragment, TurnHandler handler) {
        if (key == null || fragment == null || handler == null) {
            throw new IllegalArgumentException("key, fragment and handler are required");
        }

        Instant now = clock.instant();
        AtomicReference<PendingTurn> overflowed = new AtomicReference<>();

        pendingTurns.compute(key, (k, existing) -> {
            if (existing == null) {
                PendingTurn turn = new PendingTurn(k, handler);
                turn.append(fragment, now);
                arm(turn);
                log.debug("[Batcher] new turn: key={}", k);
                return turn;
            }

            int size = existing.append(fragment, now);
            existing.cancelTimer();
            if (size >= maxBatch) {
                overflowed.set(existing);
                return null;
            }
            arm(existing);
            log.debug("[Batcher] fragment appended: key={}, pending={}", k, size);
            return existing;
        });

        PendingTurn flushed = overflowed.get();
        if (flushed != null) {
            dispatch(flushed, "max-batch");
            return false;
        }
        return true;
    }

    /**
     * Flushes the conversation's pending turn now.
     *
     * @return {@code true} if a turn was pending and has been flushed;
     *         {@code false} (with no side effects) otherwise
     */
    public boolean forceFlush(String key) {
        if (key == null) {
            return false;
        }
        AtomicReference<PendingTurn> detached = new AtomicReference<>();
        pendingTurns.computeIfPresent(key, (k, live) -> {
            live.cancelTimer();
            detached.set(live);
            return null;
        });

        PendingTurn turn = detached.get();
        if (turn == null) {
            log.debug("[Batcher] force flush ignored, nothing pending: key={}", key);
            return false;
        }
        dispatch(turn, "forced");
        return true;
    }

    /**
     * Returns a snapshot of the conversation's pending turn without changing
     * it.
     */
    public Optional<TurnStatus> status(String key) {
        if (key == null) {
            return Optional.empty();
        }
        PendingTurn turn = pendingTurns.get(key);
        return turn != null ? Optional.of(turn.snapshot(clock.instant())) : Optional.empty();
    }

    /**
     * Returns snapshots of all pending turns, keyed by conversation key.
     */
    public Map<String, TurnStatus> activeTurns() {
        Instant now = clock.instant();
        Map<String, TurnStatus> result = new TreeMap<>();
        pendingTurns.forEach((key, turn) -> result.put(key, turn.snapshot(now)));
        return result;
    }

    public boolean hasPendingTurn(String key) {
        return key != null && pendingTurns.containsKey(key);
    }

    public int pendingTurnCount() {
        return pendingTurns.size();
    }

    @PreDestroy
    public void shutdown() {
        int dropped = 0;
        for (String key : new ArrayList<>(pendingTurns.keySet())) {
            PendingTurn turn = pendingTurns.remove(key);
            if (turn != null) {
                turn.cancelTimer();
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("[Batcher] shutdown dropped {} pending turn(s)", dropped);
        }
    }

    // Runs inside compute() for the turn's key.
    private void arm(PendingTurn turn) {
        long generation = turn.nextGeneration();
        ScheduledFuture<?> timer = timerExecutor.schedule(
                () -> onIdleWindowElapsed(turn, generation),
                idleWindow.toMillis(),
                TimeUnit.MILLISECONDS);
        turn.setTimer(timer);
    }

    private void onIdleWindowElapsed(PendingTurn turn, long generation) {
        AtomicReference<PendingTurn> detached = new AtomicReference<>();
        pendingTurns.computeIfPresent(turn.key, (k, live) -> {
            if (live != turn || !live.isGeneration(generation)) {
                return live;
            }
            detached.set(live);
            return null;
        });

        PendingTurn flushed = detached.get();
        if (flushed == null) {
            log.debug("[Batcher] superseded timer ignored: key={}, generation={}", turn.key, generation);
            return;
        }
        dispatch(flushed, "idle");
    }

    private void dispatch(PendingTurn turn, String reason) {
        List<String> fragments = turn.fragments();
        String combined = turnCombiner.combine(fragments);
        log.info("[Batcher] flushing turn: key={}, fragments={}, reason={}", turn.key, fragments.size(), reason);

        try {
            turnHandlerExecutor.execute(() -> runHandler(turn.key, turn.handler, combined));
        } catch (RejectedExecutionException e) {
            log.error("[Batcher] handler dispatch rejected, turn lost: key={}", turn.key, e);
        }
    }

    private void runHandler(String key, TurnHandler handler, String combined) {
        try {
            handler.handle(combined);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Batcher] turn handler interrupted: key={}", key);
        } catch (Exception e) { // NOSONAR - must not kill executor thread
            log.error("[Batcher] turn handler failed: key={}: {}", key, e.getMessage(), e);
        }
    }

    private static final class PendingTurn {

        private final String key;
        private final TurnHandler handler;
        private final List<String> fragments = new ArrayList<>();
        private Instant lastUpdate;
        private ScheduledFuture<?> timer;
        private long generation;

        private PendingTurn(String key, TurnHandler handler) {
            this.key = key;
            this.handler = handler;
        }

        synchronized int append(String fragment, Instant now) {
            fragments.add(fragment);
            lastUpdate = now;
            return fragments.size();
        }

        synchronized long nextGeneration() {
            return ++generation;
        }

        synchronized boolean isGeneration(long candidate) {
            return generation == candidate;
        }

        synchronized void setTimer(ScheduledFuture<?> timer) {
            this.timer = timer;
        }

        synchronized void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }

        synchronized List<String> fragments() {
            return List.copyOf(fragments);
        }

        synchronized TurnStatus snapshot(Instant now) {
            long ageSeconds = Math.max(0, Duration.between(lastUpdate, now).getSeconds());
            return new TurnStatus(key, fragments.size(), ageSeconds, lastUpdate, fragments);
        }
    }
}
