package org.cataphract.runtime.map;

/**
 * An undirected road between two hexes.
 *
 * @param fromHexId    One end.
 * @param toHexId      Other end.
 * @param costModifier Speed multiplier for marches along this road; 1.0 is an ordinary road.
 */
public record Road(long fromHexId, long toHexId, double costModifier) {

    public boolean connects(long a, long b) {
        return (fromHexId == a && toHexId == b) || (fromHexId == b && toHexId == a);
    }
}
