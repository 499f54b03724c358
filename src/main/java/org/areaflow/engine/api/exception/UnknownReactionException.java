package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a reaction name does not resolve in the catalog.
 */
@Getter
public class UnknownReactionException extends RuntimeException {

    private final String reactionName;

    public UnknownReactionException(String reactionName) {
        super("Unknown reaction: " + reactionName);
        this.reactionName = reactionName;
    }
}
