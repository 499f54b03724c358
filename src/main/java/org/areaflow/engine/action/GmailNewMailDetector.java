package org.areaflow.engine.action;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.catalog.ActionDefinition;
import org.areaflow.engine.catalog.Placeholder;
import org.areaflow.engine.client.GmailApiClient;
import org.areaflow.engine.credential.CredentialResolver;
import org.areaflow.engine.detection.DetectionCache;
import org.areaflow.engine.provider.GoogleProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fires when a new message lands in the user's Gmail inbox (or anywhere, with scope {@code ALL}).
 */
@Component
@Slf4j
public class GmailNewMailDetector extends LatestItemDetector<JsonNode> {

    public static final String NAME = "gmail_new_email";

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            NAME,
            GoogleProvider.KEY,
            "Triggers when you receive a new email on Gmail",
            List.of(),
            List.of(
                    new Placeholder("GMAIL_EMAIL_ID", "Gmail message id", "18c1f2a3b4c5d6e7"),
                    new Placeholder("GMAIL_EMAIL_THREAD_ID", "Gmail thread id", "18c1f2a3b4c5d6e7"),
                    new Placeholder("GMAIL_EMAIL_SUBJECT", "Subject line", "Weekly report"),
                    new Placeholder("GMAIL_EMAIL_FROM", "Sender", "Jane Doe <jane@example.com>"),
                    new Placeholder("GMAIL_EMAIL_DATE", "Date header", "Mon, 6 May 2024 09:12:00 +0000"),
                    new Placeholder("GMAIL_EMAIL_SNIPPET", "Short preview of the body", "Hi team, here is...")));

    private final CredentialResolver credentialResolver;
    private final GmailApiClient gmailApiClient;
    private final String labelFilter;

    public GmailNewMailDetector(DetectionCache detectionCache, CredentialResolver credentialResolver,
                                GmailApiClient gmailApiClient,
                                @Value("${area.engine.providers.google.gmail.scope:INBOX}") String scope) {
        super(detectionCache);
        this.credentialResolver = credentialResolver;
        this.gmailApiClient = gmailApiClient;
        this.labelFilter = "ALL".equalsIgnoreCase(scope) ? null : "INBOX";
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
    protected Optional<LatestItem<JsonNode>> fetchLatest(String userId, Map<String, Object> actionConfig) {
        JsonNode page = credentialResolver.withAccessToken(userId, GoogleProvider.KEY,
                token -> gmailApiClient.latestMessage(token, labelFilter));
        JsonNode messages = page == null ? null : page.path("messages");
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            return Optional.empty();
        }
        JsonNode message = messages.get(0);
        return Optional.of(new LatestItem<>(message.path("id").asText(null), message));
    }

    @Override
    protected Map<String, String> payload(String userId, Map<String, Object> actionConfig, LatestItem<JsonNode> latest) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("GMAIL_EMAIL_ID", latest.id());
        payload.put("GMAIL_EMAIL_THREAD_ID", latest.item().path("threadId").asText(""));

        JsonNode metadata;
        try {
            metadata = credentialResolver.withAccessToken(userId, GoogleProvider.KEY,
                    token -> gmailApiClient.messageMetadata(token, latest.id()));
        } catch (RuntimeException e) {
            log.warn("Gmail metadata unavailable, using id only: userId={}, messageId={}, reason={}",
                    userId, latest.id(), e.getMessage());
            return payload;
        }
        if (metadata == null) {
            return payload;
        }
        if (metadata.hasNonNull("threadId")) {
            payload.put("GMAIL_EMAIL_THREAD_ID", metadata.get("threadId").asText());
        }
        payload.put("GMAIL_EMAIL_SNIPPET", metadata.path("snippet").asText(""));
        for (JsonNode header : metadata.path("payload").path("headers")) {
            String value = header.path("value").asText("");
            switch (header.path("name").asText("").toLowerCase()) {
                case "subject" -> payload.put("GMAIL_EMAIL_SUBJECT", value);
                case "from" -> payload.put("GMAIL_EMAIL_FROM", value);
                case "date" -> payload.put("GMAIL_EMAIL_DATE", value);
                default -> {
                }
            }
        }
        return payload;
    }
}
