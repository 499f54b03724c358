package org.areaflow.engine.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Discord REST API authenticated as the engine's bot rather than as a user.
 */
@Component
public class DiscordBotClient extends ProviderApiClient {

    public static final String PROVIDER_KEY = "discord";

    private final String botToken;

    public DiscordBotClient(RestClient.Builder restClientBuilder,
                            @Value("${area.engine.providers.discord.api-base-url:https://discord.com/api/v10}") String baseUrl,
                            @Value("${area.engine.providers.discord.bot-token:}") String botToken) {
        super(PROVIDER_KEY, restClientBuilder, baseUrl);
        this.botToken = botToken;
    }

    public boolean isConfigured() {
        return botToken != null && !botToken.isBlank();
    }

    /**
     * Latest message of a channel, as the raw array of size zero or one.
     */
    public JsonNode latestMessage(String channelId) {
        return call("channel messages", () -> restClient.get()
                .uri("/channels/{channelId}/messages?limit=1", channelId)
                .header(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
                .retrieve()
                .body(JsonNode.class));
    }

    public String sendMessage(String channelId, String content) {
        JsonNode response = call("create message", () -> restClient.post()
                .uri("/channels/{channelId}/messages", channelId)
                .header(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("content", content))
                .retrieve()
                .body(JsonNode.class));
        return response == null ? null : response.path("id").asText(null);
    }
}
