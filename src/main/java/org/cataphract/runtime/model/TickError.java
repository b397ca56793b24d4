package org.cataphract.runtime.model;

/**
 * A per-entity failure recorded during upkeep instead of aborting the tick.
 *
 * @param tick      The tick in which the failure occurred.
 * @param entity    Entity descriptor, e.g. {@code "army:12"}.
 * @param errorType Machine readable error category.
 * @param message   Human readable description.
 */
public record TickError(Tick tick, String entity, String errorType, String message) {
}
