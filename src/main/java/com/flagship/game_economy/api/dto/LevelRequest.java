package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Player level reported by the game session, used for level-gated shop items.
 */
@Value
public class LevelRequest {

    @NotNull(message = "Level is required")
    @PositiveOrZero(message = "Level cannot be negative")
    @JsonProperty("level")
    Integer level;

    @JsonCreator
    public LevelRequest(@JsonProperty("level") Integer level) {
        this.level = level;
    }
}
