package com.flagship.game_economy.personalization;

import java.util.Optional;

/**
 * Remote personalization collaborator. Implementations may block and may throw;
 * callers bound the call with a timeout.
 */
public interface PersonalizationClient {

    Optional<PersonalizationResponse> suggest(PersonalizationRequest request);
}
