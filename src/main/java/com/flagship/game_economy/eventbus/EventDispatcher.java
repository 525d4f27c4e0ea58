package com.flagship.game_economy.eventbus;

import com.flagship.game_economy.consumer.IdempotentEventProcessor;
import com.flagship.game_economy.event.EconomyEvent;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains the {@link EconomyEventBus} and delivers each event to every subscriber.
 *
 * Subscribers are called in their registration order. A subscriber that throws
 * causes the envelope to be requeued with an incremented retry count;
 * subscribers that already handled it are skipped on redelivery through the
 * {@link IdempotentEventProcessor}. After {@code maxRetries} failed attempts the
 * envelope is parked as a dead letter.
 */
@Component
@Slf4j
public class EventDispatcher {

    private final EconomyEventBus eventBus;
    private final List<EconomyEventSubscriber> subscribers;
    private final IdempotentEventProcessor processor;
    private final EconomyMetrics metrics;
    private final int batchSize;
    private final int maxRetries;

    public EventDispatcher(EconomyEventBus eventBus,
                           List<EconomyEventSubscriber> subscribers,
                           IdempotentEventProcessor processor,
                           EconomyMetrics metrics,
                           @Value("${economy.dispatch.batch-size:500}") int batchSize,
                           @Value("${economy.dispatch.max-retries:5}") int maxRetries) {
        this.eventBus = eventBus;
        this.subscribers = List.copyOf(subscribers);
        this.processor = processor;
        this.metrics = metrics;
        this.batchSize = Math.max(1, batchSize);
        this.maxRetries = Math.max(1, maxRetries);
        metrics.registerEventBacklogGauge(eventBus::pendingCount, eventBus::deadLetterCount);
        log.info("Event dispatcher registered {} subscribers: {}", this.subscribers.size(),
                this.subscribers.stream().map(EconomyEventSubscriber::consumerGroup).toList());
    }

    /**
     * Delivers one bounded batch.
     *
     * @return number of envelopes fully delivered
     */
    public synchronized int dispatchPending() {
        List<EventEnvelope> batch = eventBus.takeBatch(batchSize);
        if (batch.isEmpty()) {
            return 0;
        }

        List<EventEnvelope> retry = new ArrayList<>();
        int delivered = 0;

        for (EventEnvelope envelope : batch) {
            if (deliver(envelope)) {
                delivered++;
                continue;
            }
            if (envelope.getRetryCount() >= maxRetries) {
                log.warn("Event {} exceeded max retries ({}), moving to dead letter. eventType={}, lastError={}",
                        envelope.getEvent().getEventId(), maxRetries, envelope.getEventType(), envelope.getLastError());
                eventBus.deadLetter(envelope);
                metrics.recordEventDeadLettered();
            } else {
                retry.add(envelope);
            }
        }

        eventBus.requeue(retry);
        log.debug("Dispatched {} of {} events, {} requeued", delivered, batch.size(), retry.size());
        return delivered;
    }

    /**
     * Drains until the queue is empty or only failing events remain.
     * Used at shutdown and by tests.
     */
    public int dispatchAll() {
        int total = 0;
        while (eventBus.pendingCount() > 0) {
            int delivered = dispatchPending();
            if (delivered == 0) {
                break;
            }
            total += delivered;
        }
        return total;
    }

    private boolean deliver(EventEnvelope envelope) {
        EconomyEvent event = envelope.getEvent();
        boolean allDelivered = true;

        for (EconomyEventSubscriber subscriber : subscribers) {
            try {
                boolean ran = processor.processEvent(event.getEventId(), event.getEventType(),
                        subscriber.consumerGroup(), () -> subscriber.onEvent(event));
                if (ran) {
                    metrics.recordEventDelivered();
                }
            } catch (RuntimeException e) {
                allDelivered = false;
                envelope.recordFailure(subscriber.consumerGroup() + ": " + e.getMessage());
                metrics.recordEventDeliveryFailure(event.getEventType());
            }
        }
        return allDelivered;
    }
}
