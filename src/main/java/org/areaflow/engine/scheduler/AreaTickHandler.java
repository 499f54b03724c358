package org.areaflow.engine.scheduler;

import java.util.UUID;

/**
 * Receives each scheduled tick of an area: one detect and, if triggered, one dispatch.
 */
@FunctionalInterface
public interface AreaTickHandler {

    void onTick(UUID areaId);
}
