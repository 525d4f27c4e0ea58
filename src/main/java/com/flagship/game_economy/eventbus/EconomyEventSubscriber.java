package com.flagship.game_economy.eventbus;

import com.flagship.game_economy.event.EconomyEvent;

/**
 * Receives economy events from the {@link EventDispatcher}.
 *
 * Delivery is at-least-once; the dispatcher de-duplicates per consumer group,
 * so implementations do not track event ids themselves. Throwing leaves the
 * event queued for redelivery.
 */
public interface EconomyEventSubscriber {

    /**
     * Stable name used for de-duplication.
     */
    String consumerGroup();

    void onEvent(EconomyEvent event);
}
