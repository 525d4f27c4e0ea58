package com.flagship.game_economy.eventbus;

import com.flagship.game_economy.event.EconomyEvent;
import lombok.Getter;

import java.time.Instant;

/**
 * Queue entry wrapping an event with its delivery bookkeeping.
 *
 * The wrapped event is immutable; only the retry counters change, and only
 * from the dispatcher thread.
 */
@Getter
public class EventEnvelope {

    private final EconomyEvent event;
    private final Instant enqueuedAt;
    private int retryCount;
    private String lastError;

    EventEnvelope(EconomyEvent event, Instant enqueuedAt) {
        this.event = event;
        this.enqueuedAt = enqueuedAt;
    }

    void recordFailure(String error) {
        this.retryCount++;
        this.lastError = error;
    }

    public String getEventType() {
        return event.getEventType();
    }
}
