package com.flagship.game_economy.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for economy events.
 *
 * Events are facts: they are created after the state change they describe has
 * completed and are never mutated. Consumers de-duplicate on {@link #getEventId()}.
 */
public interface EconomyEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * Player the event is about, or null for economy-wide events (discount windows).
     */
    String getPlayerId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
