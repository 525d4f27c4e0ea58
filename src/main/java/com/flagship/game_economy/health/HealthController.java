package com.flagship.game_economy.health;

import com.flagship.game_economy.eventbus.EconomyEventBus;
import com.flagship.game_economy.inflation.InflationController;
import com.flagship.game_economy.scheduling.EconomySweepScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoint.
 * Reports DEGRADED once events land in the dead-letter store or the oldest
 * pending event has waited longer than the backlog threshold.
 */
@RestController
public class HealthController {

    static final Duration MAX_BACKLOG_AGE = Duration.ofMinutes(5);

    private final EconomyEventBus eventBus;
    private final InflationController inflation;
    private final ObjectProvider<EconomySweepScheduler> scheduler;
    private final Clock clock;

    public HealthController(EconomyEventBus eventBus,
                            InflationController inflation,
                            ObjectProvider<EconomySweepScheduler> scheduler,
                            Clock clock) {
        this.eventBus = eventBus;
        this.inflation = inflation;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Instant now = clock.instant();
        Map<String, Object> health = new LinkedHashMap<>();

        int deadLetters = eventBus.deadLetterCount();
        boolean backlogStale = eventBus.oldestPendingAt()
            .map(oldest -> Duration.between(oldest, now).compareTo(MAX_BACKLOG_AGE) > 0)
            .orElse(false);
        boolean healthy = deadLetters == 0 && !backlogStale;

        health.put("status", healthy ? "UP" : "DEGRADED");
        health.put("timestamp", now.toString());
        health.put("pendingEvents", eventBus.pendingCount());
        health.put("deadLetterEvents", deadLetters);
        health.put("inflationCycle", inflation.currentCycle());
        EconomySweepScheduler sweeper = scheduler.getIfAvailable();
        health.put("scheduler", sweeper == null ? "DISABLED" : sweeper.isPaused() ? "PAUSED" : "RUNNING");

        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
