package org.areaflow.engine.reaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.exception.ReactionExecutionFailedException;
import org.areaflow.engine.catalog.ConfigField;
import org.areaflow.engine.catalog.ConfigSchemaValidator;
import org.areaflow.engine.catalog.ReactionDefinition;
import org.areaflow.engine.client.GmailApiClient;
import org.areaflow.engine.credential.CredentialResolver;
import org.areaflow.engine.provider.GoogleProvider;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Sends a plain text email from the user's Gmail account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendEmailReaction implements ReactionExecutor {

    public static final String NAME = "send_email";

    private static final ReactionDefinition DEFINITION = new ReactionDefinition(
            NAME,
            GoogleProvider.KEY,
            "Send an email from your Gmail account",
            List.of(
                    ConfigField.required("to", ConfigField.EMAIL, "Recipient", "someone@example.com"),
                    ConfigField.required("subject", ConfigField.STRING, "Subject", "New like: {{SPOTIFY_LIKED_SONG_NAME}}"),
                    ConfigField.required("body", ConfigField.STRING, "Body", "You liked {{SPOTIFY_LIKED_SONG_NAME}}")));

    private final CredentialResolver credentialResolver;
    private final GmailApiClient gmailApiClient;

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
        // substituted placeholders were not validated at bind time
        String to = String.valueOf(reactionConfig.get("to"));
        if (!ConfigSchemaValidator.isEmailAddress(to)) {
            throw new ReactionExecutionFailedException(NAME,
                    "Recipient is not a single email address for areaId=" + event.areaId(), null);
        }
        String raw = encode(
                to,
                String.valueOf(reactionConfig.get("subject")),
                String.valueOf(reactionConfig.get("body")));
        String messageId = credentialResolver.withAccessToken(userId, GoogleProvider.KEY,
                token -> gmailApiClient.send(token, raw));
        log.info("Email sent: areaId={}, userId={}, messageId={}", event.areaId(), userId, messageId);
    }

    /**
     * RFC 2822 message, base64url encoded without padding as the Gmail API expects.
     */
    static String encode(String to, String subject, String body) {
        String encodedSubject = "=?UTF-8?B?"
                + Base64.getEncoder().encodeToString(subject.getBytes(StandardCharsets.UTF_8)) + "?=";
        String message = "To: " + to + "\r\n"
                + "Subject: " + encodedSubject + "\r\n"
                + "MIME-Version: 1.0\r\n"
                + "Content-Type: text/plain; charset=UTF-8\r\n"
                + "\r\n"
                + body;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(message.getBytes(StandardCharsets.UTF_8));
    }
}
