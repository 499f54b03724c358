package org.areaflow.engine.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.areaflow.engine.provider.GoogleProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Gmail REST API, {@code users/me} scope.
 */
@Component
public class GmailApiClient extends ProviderApiClient {

    public GmailApiClient(RestClient.Builder restClientBuilder,
                          @Value("${area.engine.providers.google.api-base-url:https://gmail.googleapis.com}") String baseUrl) {
        super(GoogleProvider.KEY, restClientBuilder, baseUrl);
    }

    /**
     * List at most one message, newest first.
     *
     * @param labelId label filter, or null for all mail
     */
    public JsonNode latestMessage(String accessToken, String labelId) {
        return call("messages.list", () -> restClient.get()
                .uri(builder -> {
                    builder.path("/gmail/v1/users/me/messages").queryParam("maxResults", 1);
                    if (labelId != null) {
                        builder.queryParam("labelIds", labelId);
                    }
                    return builder.build();
                })
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .retrieve()
                .body(JsonNode.class));
    }

    public JsonNode messageMetadata(String accessToken, String messageId) {
        return call("messages.get", () -> restClient.get()
                .uri(builder -> builder.path("/gmail/v1/users/me/messages/{id}")
                        .queryParam("format", "metadata")
                        .queryParam("metadataHeaders", "Subject", "From", "Date")
                        .build(messageId))
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .retrieve()
                .body(JsonNode.class));
    }

    /**
     * Send an already encoded RFC 2822 message.
     *
     * @param raw base64url encoded message without padding
     * @return the id of the sent message
     */
    public String send(String accessToken, String raw) {
        JsonNode response = call("messages.send", () -> restClient.post()
                .uri("/gmail/v1/users/me/messages/send")
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("raw", raw))
                .retrieve()
                .body(JsonNode.class));
        return response == null ? null : response.path("id").asText(null);
    }
}
