package org.areaflow.engine.reaction;

import java.util.Map;
import java.util.UUID;

/**
 * What a reaction receives when its action fires.
 *
 * @param payload placeholder values produced by the action
 */
public record TriggerEvent(UUID areaId, String actionName, String signalId, Map<String, String> payload) {
}
