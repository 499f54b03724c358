package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when an action name does not resolve in the catalog.
 */
@Getter
public class UnknownActionException extends RuntimeException {

    private final String actionName;

    public UnknownActionException(String actionName) {
        super("Unknown action: " + actionName);
        this.actionName = actionName;
    }
}
