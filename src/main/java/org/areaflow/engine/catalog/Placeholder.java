package org.areaflow.engine.catalog;

/**
 * A {@code {{KEY}}} value an action's trigger payload offers to reaction configs.
 */
public record Placeholder(String key, String description, String example) {
}
