package org.areaflow.engine.reaction;

import org.areaflow.engine.api.exception.ReactionExecutionFailedException;
import org.areaflow.engine.client.GmailApiClient;
import org.areaflow.engine.credential.CredentialResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SendEmailReactionTest {

    @Mock
    private CredentialResolver credentialResolver;

    @Mock
    private GmailApiClient gmailApiClient;

    @InjectMocks
    private SendEmailReaction reaction;

    @Test
    void shouldEncodeRfc2822MessageAsUnpaddedBase64Url() {
        String raw = SendEmailReaction.encode("jane@example.com", "Héllo", "Body text");

        assertThat(raw).doesNotContain("=", "+", "/");
        String message = new String(Base64.getUrlDecoder().decode(raw), StandardCharsets.UTF_8);
        assertThat(message)
                .startsWith("To: jane@example.com\r\n")
                .contains("Subject: =?UTF-8?B?")
                .contains("Content-Type: text/plain; charset=UTF-8")
                .endsWith("\r\n\r\nBody text");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendThroughGmailWithResolvedToken() {
        when(credentialResolver.withAccessToken(eq("u1"), eq("google"), any()))
                .thenAnswer(invocation -> ((Function<String, Object>) invocation.getArgument(2)).apply("token"));
        when(gmailApiClient.send(eq("token"), anyString())).thenReturn("sent-1");

        reaction.execute("u1", Map.of("to", "jane@example.com", "subject", "S", "body", "B"),
                new TriggerEvent(UUID.randomUUID(), "spotify_has_likes", "t1", Map.of()));

        verify(gmailApiClient).send(eq("token"), anyString());
    }

    @Test
    void shouldRejectRecipientCarryingExtraHeaders() {
        Map<String, Object> config = Map.of(
                "to", "jane@example.com\r\nBcc: attacker@example.com",
                "subject", "S",
                "body", "B");

        assertThatThrownBy(() -> reaction.execute("u1", config,
                new TriggerEvent(UUID.randomUUID(), "discord_new_message", "m1", Map.of())))
                .isInstanceOf(ReactionExecutionFailedException.class)
                .hasMessageContaining("Recipient");

        verifyNoInteractions(credentialResolver, gmailApiClient);
    }

    @Test
    void shouldRejectRecipientEndingWithLineBreak() {
        assertThatThrownBy(() -> reaction.execute("u1", Map.of("to", "jane@example.com\n", "subject", "S", "body", "B"),
                new TriggerEvent(UUID.randomUUID(), "discord_new_message", "m1", Map.of())))
                .isInstanceOf(ReactionExecutionFailedException.class);

        verifyNoInteractions(gmailApiClient);
    }
}
