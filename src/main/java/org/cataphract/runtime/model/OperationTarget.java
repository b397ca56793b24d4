package org.cataphract.runtime.model;

import java.util.Locale;

/**
 * What a covert operation is aimed at.
 *
 * @param kind Kind of entity.
 * @param id   Id of the entity in its arena.
 */
public record OperationTarget(Kind kind, long id) {

    public enum Kind {
        ARMY,
        STRONGHOLD,
        COMMANDER
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + id;
    }
}
