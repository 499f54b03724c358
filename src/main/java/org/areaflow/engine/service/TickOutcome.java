package org.areaflow.engine.service;

/**
 * Result of one detect and dispatch pass over a single area.
 */
public enum TickOutcome {
    SKIPPED,
    NO_ACCOUNT,
    UNCHANGED,
    TRIGGERED,
    REACTION_FAILED,
    DETECTION_FAILED,
    AUTH_FAILED
}
