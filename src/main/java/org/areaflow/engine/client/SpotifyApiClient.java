package org.areaflow.engine.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.areaflow.engine.provider.SpotifyProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Spotify Web API.
 */
@Component
public class SpotifyApiClient extends ProviderApiClient {

    public SpotifyApiClient(RestClient.Builder restClientBuilder,
                            @Value("${area.engine.providers.spotify.api-base-url:https://api.spotify.com}") String baseUrl) {
        super(SpotifyProvider.KEY, restClientBuilder, baseUrl);
    }

    /**
     * The user's most recently saved track, as the raw {@code /v1/me/tracks} page of size one.
     */
    public JsonNode latestSavedTrack(String accessToken) {
        return call("saved tracks", () -> restClient.get()
                .uri("/v1/me/tracks?limit=1")
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .retrieve()
                .body(JsonNode.class));
    }
}
