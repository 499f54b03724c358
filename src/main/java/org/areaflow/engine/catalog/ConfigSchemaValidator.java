package org.areaflow.engine.catalog;

import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.exception.InvalidAreaConfigException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates one config section of an area against the schema of its action or reaction.
 * Fields outside the schema are ignored. Values containing a {{KEY}} placeholder skip the type
 * check since they are only resolved at dispatch time.
 */
@Component
@Slf4j
public class ConfigSchemaValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{[A-Z0-9_]+}}");

    /**
     * Throws InvalidAreaConfigException on the first violation.
     */
    public void validate(String itemName, List<ConfigField> schema, Map<String, Object> config) {
        for (ConfigField field : schema) {
            Object value = config == null ? null : config.get(field.name());

            if (isMissing(value)) {
                if (field.required()) {
                    throw new InvalidAreaConfigException(
                            "Missing required config field '" + field.name() + "' for " + itemName, itemName, field.name());
                }
                continue;
            }
            if (value instanceof String text && PLACEHOLDER.matcher(text).find()) {
                continue;
            }
            if (!matchesType(field.type(), value)) {
                throw new InvalidAreaConfigException(
                        "Config field '" + field.name() + "' of " + itemName + " must be of type " + field.type(),
                        itemName, field.name());
            }
        }
        log.debug("Config validation passed for {}", itemName);
    }

    private boolean isMissing(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }

    private boolean matchesType(String type, Object value) {
        return switch (type) {
            case ConfigField.NUMBER -> value instanceof Number || isNumeric(value.toString());
            case ConfigField.BOOLEAN -> value instanceof Boolean
                    || "true".equalsIgnoreCase(value.toString()) || "false".equalsIgnoreCase(value.toString());
            case ConfigField.EMAIL -> value instanceof String text && isEmailAddress(text.trim());
            default -> value instanceof String;
        };
    }

    /**
     * A single mailbox address with no whitespace, line breaks included.
     */
    public static boolean isEmailAddress(String text) {
        return text != null && EMAIL.matcher(text).matches();
    }

    private boolean isNumeric(String text) {
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
