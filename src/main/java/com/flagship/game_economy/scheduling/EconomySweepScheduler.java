package com.flagship.game_economy.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link EconomyTicker} on a fixed rate.
 *
 * Disabled with {@code economy.scheduler.enabled=false}; tests tick manually.
 */
@Component
@ConditionalOnProperty(name = "economy.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EconomySweepScheduler {

    private final EconomyTicker ticker;
    private final AtomicBoolean paused = new AtomicBoolean(false);

    @Scheduled(fixedRateString = "${economy.scheduler.tick-interval-ms:1000}")
    public void run() {
        if (paused.get()) {
            return;
        }
        try {
            ticker.tick();
        } catch (RuntimeException e) {
            log.error("Economy tick failed: {}", e.getMessage(), e);
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Economy scheduler paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Economy scheduler resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }
}
