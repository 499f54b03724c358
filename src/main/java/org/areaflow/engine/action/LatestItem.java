package org.areaflow.engine.action;

/**
 * The newest upstream item as seen by one poll.
 *
 * @param id   upstream identity, null when the item carries none
 * @param item raw provider representation, used to build the trigger payload
 */
public record LatestItem<T>(String id, T item) {
}
