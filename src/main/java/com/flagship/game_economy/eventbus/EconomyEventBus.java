package com.flagship.game_economy.eventbus;

import com.flagship.game_economy.event.EconomyEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-process outbox for economy events.
 *
 * Producers append after their state change completes; nothing is delivered
 * here. The {@link EventDispatcher} drains the queue in FIFO order on the
 * background tick.
 */
@Component
@Slf4j
public class EconomyEventBus {

    private final ConcurrentLinkedDeque<EventEnvelope> pending = new ConcurrentLinkedDeque<>();
    private final List<EventEnvelope> deadLetters = Collections.synchronizedList(new ArrayList<>());
    private final Clock clock;

    public EconomyEventBus(Clock clock) {
        this.clock = clock;
    }

    public void publish(EconomyEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        pending.addLast(new EventEnvelope(event, clock.instant()));
        log.trace("Queued event: type={}, eventId={}", event.getEventType(), event.getEventId());
    }

    /**
     * Removes up to {@code limit} events from the head of the queue.
     */
    List<EventEnvelope> takeBatch(int limit) {
        List<EventEnvelope> batch = new ArrayList<>(Math.min(limit, 64));
        while (batch.size() < limit) {
            EventEnvelope next = pending.pollFirst();
            if (next == null) {
                break;
            }
            batch.add(next);
        }
        return batch;
    }

    /**
     * Puts failed envelopes back at the head, keeping their relative order.
     */
    void requeue(List<EventEnvelope> failed) {
        for (int i = failed.size() - 1; i >= 0; i--) {
            pending.addFirst(failed.get(i));
        }
    }

    void deadLetter(EventEnvelope envelope) {
        deadLetters.add(envelope);
    }

    public int pendingCount() {
        return pending.size();
    }

    public int deadLetterCount() {
        return deadLetters.size();
    }

    public List<EventEnvelope> deadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    public Optional<Instant> oldestPendingAt() {
        EventEnvelope head = pending.peekFirst();
        return head == null ? Optional.empty() : Optional.of(head.getEnqueuedAt());
    }
}
