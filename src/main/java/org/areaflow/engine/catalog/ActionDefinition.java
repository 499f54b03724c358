package org.areaflow.engine.catalog;

import java.util.List;

public record ActionDefinition(String name, String provider, String description,
                               List<ConfigField> configSchema, List<Placeholder> placeholders) {

    public ActionDefinition {
        configSchema = List.copyOf(configSchema);
        placeholders = List.copyOf(placeholders);
    }
}
