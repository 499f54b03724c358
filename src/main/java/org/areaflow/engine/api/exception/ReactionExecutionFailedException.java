package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a reaction executor fails; the upstream cause is attached.
 */
@Getter
public class ReactionExecutionFailedException extends RuntimeException {

    private final String reactionName;

    public ReactionExecutionFailedException(String reactionName, String message, Throwable cause) {
        super(message, cause);
        this.reactionName = reactionName;
    }
}
