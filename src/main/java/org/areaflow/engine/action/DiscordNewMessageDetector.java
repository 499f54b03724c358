package org.areaflow.engine.action;

import com.fasterxml.jackson.databind.JsonNode;
import org.areaflow.engine.api.exception.NoLinkedAccountException;
import org.areaflow.engine.catalog.ActionDefinition;
import org.areaflow.engine.catalog.ConfigField;
import org.areaflow.engine.catalog.Placeholder;
import org.areaflow.engine.client.DiscordBotClient;
import org.areaflow.engine.detection.DetectionCache;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fires when a new message is posted in a Discord channel the bot can read.
 * Detection state is kept per channel.
 */
@Component
public class DiscordNewMessageDetector extends LatestItemDetector<JsonNode> {

    public static final String NAME = "discord_new_message";
    static final String CHANNEL_ID = "channelId";

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            NAME,
            DiscordBotClient.PROVIDER_KEY,
            "Triggers when a new message is posted in a Discord channel",
            List.of(ConfigField.required(CHANNEL_ID, ConfigField.STRING, "Channel ID", "123456789012345678")),
            List.of(
                    new Placeholder("DISCORD_MESSAGE_ID", "Message id", "1234567890"),
                    new Placeholder("DISCORD_MESSAGE_CONTENT", "Message text", "Hello world"),
                    new Placeholder("DISCORD_MESSAGE_AUTHOR_USERNAME", "Author username", "jane"),
                    new Placeholder("DISCORD_MESSAGE_AUTHOR_ID", "Author id", "987654321"),
                    new Placeholder("DISCORD_MESSAGE_TIMESTAMP", "When the message was posted", "2024-05-01T10:15:30.000000+00:00"),
                    new Placeholder("DISCORD_MESSAGE_CHANNEL_ID", "Channel id", "123456789012345678")));

    private final DiscordBotClient discordBotClient;

    public DiscordNewMessageDetector(DetectionCache detectionCache, DiscordBotClient discordBotClient) {
        super(detectionCache);
        this.discordBotClient = discordBotClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionDefinition definition() {
        return DEFINITION;
    }

    @Override
    protected String scope(Map<String, Object> actionConfig) {
        return text(actionConfig.get(CHANNEL_ID));
    }

    @Override
    protected Optional<LatestItem<JsonNode>> fetchLatest(String userId, Map<String, Object> actionConfig) {
        if (!discordBotClient.isConfigured()) {
            throw new NoLinkedAccountException(userId, DiscordBotClient.PROVIDER_KEY);
        }
        JsonNode messages = discordBotClient.latestMessage(text(actionConfig.get(CHANNEL_ID)));
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            return Optional.empty();
        }
        JsonNode message = messages.get(0);
        return Optional.of(new LatestItem<>(message.path("id").asText(null), message));
    }

    @Override
    protected Map<String, String> payload(String userId, Map<String, Object> actionConfig, LatestItem<JsonNode> latest) {
        JsonNode message = latest.item();
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("DISCORD_MESSAGE_ID", latest.id());
        payload.put("DISCORD_MESSAGE_CONTENT", message.path("content").asText(""));
        payload.put("DISCORD_MESSAGE_AUTHOR_USERNAME", message.path("author").path("username").asText(""));
        payload.put("DISCORD_MESSAGE_AUTHOR_ID", message.path("author").path("id").asText(""));
        payload.put("DISCORD_MESSAGE_TIMESTAMP", message.path("timestamp").asText(""));
        payload.put("DISCORD_MESSAGE_CHANNEL_ID", message.path("channel_id").asText(text(actionConfig.get(CHANNEL_ID))));
        return payload;
    }
}
