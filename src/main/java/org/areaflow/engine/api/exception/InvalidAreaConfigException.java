package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when an area config section does not satisfy the schema of its definition.
 */
@Getter
public class InvalidAreaConfigException extends RuntimeException {

    private final String itemName;
    private final String field;

    public InvalidAreaConfigException(String message, String itemName, String field) {
        super(message);
        this.itemName = itemName;
        this.field = field;
    }
}
