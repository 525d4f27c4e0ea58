package com.flagship.game_economy.consumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ensures each event is handled at most once per consumer group, so that
 * at-least-once redelivery never double-counts.
 *
 * Processed ids are kept in a bounded, insertion-ordered set per group; the
 * oldest ids are forgotten first.
 */
@Service
@Slf4j
public class IdempotentEventProcessor {

    static final int MAX_REMEMBERED_PER_GROUP = 50_000;

    private final Map<String, Set<UUID>> processedByGroup = new ConcurrentHashMap<>();

    /**
     * Runs the handler unless this consumer group already processed the event.
     *
     * A failing handler is not recorded, so the event stays eligible for retry.
     *
     * @return true if the handler ran, false if the event was a duplicate
     */
    public boolean processEvent(UUID eventId, String eventType, String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.debug("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} ({}) by consumer group {}: {}",
                    eventId, eventType, consumerGroup, e.getMessage());
            throw e;
        }

        processed(consumerGroup).add(eventId);
        return true;
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return processed(consumerGroup).contains(eventId);
    }

    private Set<UUID> processed(String consumerGroup) {
        return processedByGroup.computeIfAbsent(consumerGroup, group -> Collections.synchronizedSet(
            Collections.newSetFromMap(new LinkedHashMap<>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<UUID, Boolean> eldest) {
                    return size() > MAX_REMEMBERED_PER_GROUP;
                }
            })));
    }
}
