package org.areaflow.engine.reaction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{KEY}}} tokens in config values with trigger payload values.
 * Walks nested maps and lists; unknown keys are left as written.
 */
@Component
public class PlaceholderResolver {

    private static final Pattern TOKEN = Pattern.compile("\\{\\{([A-Z0-9_]+)}}");

    public Map<String, Object> resolve(Map<String, Object> config, Map<String, String> values) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        config.forEach((key, value) -> resolved.put(key, resolveValue(value, values)));
        return resolved;
    }

    public String resolve(String text, Map<String, String> values) {
        Matcher matcher = TOKEN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object value, Map<String, String> values) {
        if (value instanceof String text) {
            return resolve(text, values);
        }
        if (value instanceof Map<?, ?> map) {
            return resolve((Map<String, Object>) map, values);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(resolveValue(item, values)));
            return resolved;
        }
        return value;
    }
}
