package com.flagship.game_economy.api;

import com.flagship.game_economy.api.dto.EconomyReportResponse;
import com.flagship.game_economy.consumer.EconomyAnalyticsConsumer;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.currency.ExchangeRateBook;
import com.flagship.game_economy.eventbus.EconomyEventBus;
import com.flagship.game_economy.inflation.InflationController;
import com.flagship.game_economy.profile.PlayerProfileStore;
import com.flagship.game_economy.scheduling.EconomyTicker;
import com.flagship.game_economy.scheduling.TickResult;
import com.flagship.game_economy.snapshot.EconomySnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator endpoints: economy report, exchange rates, manual ticks and
 * snapshot save/load.
 */
@RestController
@RequestMapping("/api/economy")
@RequiredArgsConstructor
@Slf4j
public class EconomyReportController {

    private final EconomyAnalyticsConsumer analytics;
    private final PlayerProfileStore profiles;
    private final InflationController inflation;
    private final ExchangeRateBook rates;
    private final EconomyEventBus eventBus;
    private final EconomyTicker ticker;
    private final EconomySnapshotService snapshots;

    @GetMapping("/report")
    public ResponseEntity<EconomyReportResponse> getReport() {
        return ResponseEntity.ok(EconomyReportResponse.builder()
            .currencies(analytics.currencyStats())
            .items(analytics.itemStats())
            .segments(profiles.segmentDistribution())
            .multipliers(inflation.allMultipliers())
            .lastInflationCycle(inflation.lastReport().orElse(null))
            .pendingEvents(eventBus.pendingCount())
            .deadLetterEvents(eventBus.deadLetterCount())
            .summary(analytics.generateReport())
            .build());
    }

    @GetMapping("/rates")
    public ResponseEntity<List<ExchangeRate>> getRates() {
        return ResponseEntity.ok(rates.all());
    }

    @PostMapping("/tick")
    public ResponseEntity<TickResult> tick() {
        return ResponseEntity.ok(ticker.tick());
    }

    @GetMapping(value = "/snapshot", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> saveSnapshot() {
        return ResponseEntity.ok(snapshots.serialize());
    }

    @PutMapping(value = "/snapshot", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> loadSnapshot(@RequestBody String json) {
        log.info("Restoring economy snapshot ({} chars)", json.length());
        snapshots.deserialize(json);
        return ResponseEntity.noContent().build();
    }
}
