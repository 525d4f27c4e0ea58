package com.flagship.game_economy.personalization;

import com.flagship.game_economy.profile.PlayerSegment;
import lombok.Value;

/**
 * Read-only context sent to the personalization service.
 */
@Value
public class PersonalizationRequest {
    String playerId;
    PlayerSegment segment;
    double engagementScore;
    double churnRisk;
    long recentSpend;
    String itemId;
    String requestedAction;
}
