package org.areaflow.engine.action;

import java.util.Map;

/**
 * Outcome of one detection poll.
 *
 * @param signalId the new upstream id, only for {@link Kind#TRIGGERED}
 * @param payload  placeholder values for the bound reaction, only for {@link Kind#TRIGGERED}
 */
public record Signal(Kind kind, String signalId, Map<String, String> payload) {

    public enum Kind {
        NO_ACCOUNT,
        UNCHANGED,
        TRIGGERED
    }

    private static final Signal NO_ACCOUNT = new Signal(Kind.NO_ACCOUNT, null, Map.of());
    private static final Signal UNCHANGED = new Signal(Kind.UNCHANGED, null, Map.of());

    public Signal {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static Signal noAccount() {
        return NO_ACCOUNT;
    }

    public static Signal unchanged() {
        return UNCHANGED;
    }

    public static Signal triggered(String signalId, Map<String, String> payload) {
        return new Signal(Kind.TRIGGERED, signalId, payload);
    }

    public boolean isTriggered() {
        return kind == Kind.TRIGGERED;
    }
}
