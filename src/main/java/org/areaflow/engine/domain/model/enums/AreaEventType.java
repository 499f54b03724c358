package org.areaflow.engine.domain.model.enums;

public enum AreaEventType {
    AREA_EXECUTED,
    REACTION_FAILED,
    AUTH_FAILED,
    AREA_TRIGGERED
}
