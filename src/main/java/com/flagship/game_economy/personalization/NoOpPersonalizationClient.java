package com.flagship.game_economy.personalization;

import java.util.Optional;

/**
 * Used when no personalization service is configured: never suggests anything.
 */
public class NoOpPersonalizationClient implements PersonalizationClient {

    @Override
    public Optional<PersonalizationResponse> suggest(PersonalizationRequest request) {
        return Optional.empty();
    }
}
