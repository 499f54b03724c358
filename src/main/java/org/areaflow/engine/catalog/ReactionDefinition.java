package org.areaflow.engine.catalog;

import java.util.List;

public record ReactionDefinition(String name, String provider, String description, List<ConfigField> configSchema) {

    public ReactionDefinition {
        configSchema = List.copyOf(configSchema);
    }
}
