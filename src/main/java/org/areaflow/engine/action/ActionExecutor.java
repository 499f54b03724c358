package org.areaflow.engine.action;

import org.areaflow.engine.catalog.ActionDefinition;

import java.util.Map;

/**
 * Detects one kind of upstream event for a user. Implementations are discovered as beans
 * and registered in the catalog under {@link #name()}.
 */
public interface ActionExecutor {

    String name();

    ActionDefinition definition();

    /**
     * Poll the upstream service once.
     *
     * @param actionConfig the area's action config section, never null
     */
    Signal detect(String userId, Map<String, Object> actionConfig);
}
