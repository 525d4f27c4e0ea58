package com.flagship.game_economy.personalization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.UUID;

/**
 * Calls a personalization service over HTTP: {@code POST {baseUrl}/offers}.
 */
@Slf4j
public class RestPersonalizationClient implements PersonalizationClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestPersonalizationClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Optional<PersonalizationResponse> suggest(PersonalizationRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Request-ID", UUID.randomUUID().toString());

        log.debug("Requesting personalization for player {} and item {}", request.getPlayerId(), request.getItemId());
        PersonalizationResponse response = restTemplate.postForObject(baseUrl + "/offers",
            new HttpEntity<>(request, headers), PersonalizationResponse.class);
        return Optional.ofNullable(response);
    }
}
