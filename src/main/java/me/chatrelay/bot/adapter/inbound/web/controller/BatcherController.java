package me.chatrelay.bot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.model.TurnStatus;
import me.chatrelay.bot.domain.service.MessageBatcher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inspection and manual flush of pending message turns.
 */
@RestController
@RequestMapping("/api/batcher/turns")
@RequiredArgsConstructor
@Slf4j
public class BatcherController {

    private final MessageBatcher messageBatcher;

    @GetMapping
    public Mono<ResponseEntity<Map<String, TurnSummary>>> listTurns() {
        Map<String, TurnSummary> turns = new LinkedHashMap<>();
        messageBatcher.activeTurns().forEach((key, status) -> turns.put(key, TurnSummary.from(status)));
        return Mono.just(ResponseEntity.ok(turns));
    }

    @GetMapping("/{key}")
    public Mono<ResponseEntity<TurnDetail>> getTurn(@PathVariable String key) {
        TurnStatus status = messageBatcher.status(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No pending turn: " + key));
        return Mono.just(ResponseEntity.ok(TurnDetail.from(status)));
    }

    @PostMapping("/{key}/flush")
    public Mono<ResponseEntity<FlushResponse>> flush(@PathVariable String key) {
        boolean flushed = messageBatcher.forceFlush(key);
        log.info("[API] manual flush for {}: {}", key, flushed);
        return Mono.just(ResponseEntity.ok(new FlushResponse(flushed)));
    }

    public record TurnSummary(int pendingCount, long secondsSinceLastFragment) {
        static TurnSummary from(TurnStatus status) {
            return new TurnSummary(status.pendingCount(), status.secondsSinceLastFragment());
        }
    }

    public record TurnDetail(String conversationKey, int pendingCount, long secondsSinceLastFragment,
            Instant lastUpdate, List<String> fragments) {
        static TurnDetail from(TurnStatus status) {
            return new TurnDetail(status.conversationKey(), status.pendingCount(),
                    status.secondsSinceLastFragment(), status.lastUpdate(), status.fragments());
        }
    }

    public record FlushResponse(boolean flushed) {
    }
}
