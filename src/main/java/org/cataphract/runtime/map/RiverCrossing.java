package org.cataphract.runtime.map;

/**
 * A point where a river between two hexes can be crossed.
 *
 * @param fromHexId One bank.
 * @param toHexId   Other bank.
 * @param kind      How the river is crossed.
 */
public record RiverCrossing(long fromHexId, long toHexId, Kind kind) {

    public enum Kind {
        FORD,
        BRIDGE
    }

    public boolean connects(long a, long b) {
        return (fromHexId == a && toHexId == b) || (fromHexId == b && toHexId == a);
    }
}
