package org.cataphract.runtime.model;

import java.util.Locale;

/**
 * Allegiance of the ground a courier or agent has to cross.
 */
public enum TerritoryType {
    FRIENDLY,
    NEUTRAL,
    HOSTILE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
