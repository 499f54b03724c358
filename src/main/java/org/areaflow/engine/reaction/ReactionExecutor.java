package org.areaflow.engine.reaction;

import org.areaflow.engine.catalog.ReactionDefinition;

import java.util.Map;

/**
 * Performs one kind of side effect. Implementations are discovered as beans and registered
 * in the catalog under {@link #name()}.
 */
public interface ReactionExecutor {

    String name();

    ReactionDefinition definition();

    /**
     * @param reactionConfig the area's reaction config with placeholders already substituted
     */
    void execute(String userId, Map<String, Object> reactionConfig, TriggerEvent event);
}
