package org.cataphract.runtime.model;

import java.util.Locale;

/**
 * The four parts of a simulated day, in the order they are played.
 */
public enum DayPart {
    MORNING,
    MIDDAY,
    EVENING,
    NIGHT;

    private static final DayPart[] VALUES = values();

    /**
     * @return the part following this one, wrapping from NIGHT to MORNING.
     */
    public DayPart next() {
        return VALUES[(ordinal() + 1) % VALUES.length];
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a lower or upper case part name.
     *
     * @param name the part name, e.g. {@code "midday"}.
     * @return the matching part.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static DayPart fromWireName(String name) {
        return DayPart.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
