package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.consumer.EconomyAnalyticsConsumer;
import com.flagship.game_economy.inflation.InflationReport;
import com.flagship.game_economy.inflation.MultiplierState;
import com.flagship.game_economy.profile.PlayerSegment;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class EconomyReportResponse {

    @JsonProperty("currencies")
    List<EconomyAnalyticsConsumer.CurrencyStats> currencies;

    @JsonProperty("items")
    List<EconomyAnalyticsConsumer.ItemStats> items;

    @JsonProperty("segments")
    Map<PlayerSegment, Long> segments;

    @JsonProperty("multipliers")
    Map<String, MultiplierState> multipliers;

    @JsonProperty("last_inflation_cycle")
    InflationReport lastInflationCycle;

    @JsonProperty("pending_events")
    int pendingEvents;

    @JsonProperty("dead_letter_events")
    int deadLetterEvents;

    @JsonProperty("summary")
    String summary;
}
