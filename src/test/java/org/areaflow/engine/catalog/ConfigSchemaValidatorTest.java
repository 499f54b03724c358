package org.areaflow.engine.catalog;

import org.areaflow.engine.api.exception.InvalidAreaConfigException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigSchemaValidatorTest {

    private final ConfigSchemaValidator validator = new ConfigSchemaValidator();

    private final List<ConfigField> schema = List.of(
            ConfigField.required("to", ConfigField.EMAIL, "Recipient", "a@b.c"),
            ConfigField.required("subject", ConfigField.STRING, "Subject", ""),
            ConfigField.optional("limit", ConfigField.NUMBER, "Limit", "10"),
            ConfigField.optional("urgent", ConfigField.BOOLEAN, "Urgent", "false"));

    @Test
    void shouldAcceptValidConfig() {
        assertDoesNotThrow(() -> validator.validate("send_email", schema,
                Map.of("to", "jane@example.com", "subject", "Hi", "limit", 5, "urgent", "true", "extra", "ignored")));
    }

    @Test
    void shouldRejectMissingRequiredField() {
        InvalidAreaConfigException ex = assertThrows(InvalidAreaConfigException.class,
                () -> validator.validate("send_email", schema, Map.of("to", "jane@example.com", "subject", " ")));

        assertEquals("subject", ex.getField());
        assertEquals("send_email", ex.getItemName());
    }

    @Test
    void shouldRejectNullConfigWhenFieldsAreRequired() {
        assertThrows(InvalidAreaConfigException.class, () -> validator.validate("send_email", schema, null));
    }

    @Test
    void shouldRejectWrongTypes() {
        InvalidAreaConfigException email = assertThrows(InvalidAreaConfigException.class,
                () -> validator.validate("send_email", schema, Map.of("to", "not-an-email", "subject", "Hi")));
        assertEquals("to", email.getField());

        InvalidAreaConfigException number = assertThrows(InvalidAreaConfigException.class,
                () -> validator.validate("send_email", schema,
                        Map.of("to", "jane@example.com", "subject", "Hi", "limit", "ten")));
        assertEquals("limit", number.getField());

        InvalidAreaConfigException flag = assertThrows(InvalidAreaConfigException.class,
                () -> validator.validate("send_email", schema,
                        Map.of("to", "jane@example.com", "subject", "Hi", "urgent", "maybe")));
        assertEquals("urgent", flag.getField());
    }

    @Test
    void shouldAcceptPlaceholderWhereTypedValueIsExpected() {
        assertDoesNotThrow(() -> validator.validate("send_email", schema,
                Map.of("to", "{{GMAIL_EMAIL_FROM}}", "subject", "Re: {{GMAIL_EMAIL_SUBJECT}}")));
    }

    @Test
    void shouldAcceptEmptySchema() {
        assertDoesNotThrow(() -> validator.validate("log_event", List.of(), Map.of()));
    }
}
