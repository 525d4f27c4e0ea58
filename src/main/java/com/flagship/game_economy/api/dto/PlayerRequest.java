package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Identifies the acting player for shop operations.
 */
@Value
public class PlayerRequest {

    @NotBlank(message = "Player ID is required")
    @JsonProperty("player_id")
    String playerId;

    @JsonCreator
    public PlayerRequest(@JsonProperty("player_id") String playerId) {
        this.playerId = playerId;
    }
}
