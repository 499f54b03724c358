package org.areaflow.engine.reaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.exception.NoLinkedAccountException;
import org.areaflow.engine.catalog.ConfigField;
import org.areaflow.engine.catalog.ReactionDefinition;
import org.areaflow.engine.client.DiscordBotClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Posts a message to a Discord channel as the engine's bot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscordSendMessageReaction implements ReactionExecutor {

    public static final String NAME = "discord_send_message";

    private static final ReactionDefinition DEFINITION = new ReactionDefinition(
            NAME,
            DiscordBotClient.PROVIDER_KEY,
            "Send a message to a Discord channel",
            List.of(
                    ConfigField.required("channelId", ConfigField.STRING, "Channel ID", "123456789012345678"),
                    ConfigField.required("message", ConfigField.STRING, "Message", "New email: {{GMAIL_EMAIL_SUBJECT}}")));

    private final DiscordBotClient discordBotClient;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ReactionDefinition definition() {
        return DEFINITION;
    }

    @Override
    public void execute(String userId, Map<String, Object> reactionConfig, TriggerEvent event) {
        if (!discordBotClient.isConfigured()) {
            throw new NoLinkedAccountException(userId, DiscordBotClient.PROVIDER_KEY);
        }
        String channelId = String.valueOf(reactionConfig.get("channelId"));
        String messageId = discordBotClient.sendMessage(channelId, String.valueOf(reactionConfig.get("message")));
        log.info("Discord message sent: areaId={}, channelId={}, messageId={}", event.areaId(), channelId, messageId);
    }
}
