package org.cataphract.runtime.map;

public enum Terrain {
    FLATLAND,
    HILLS,
    FOREST,
    MOUNTAIN,
    WATER,
    COAST;

    /**
     * @return true if ships may enter hexes of this terrain.
     */
    public boolean isNavigable() {
        return this == WATER || this == COAST;
    }

    public boolean isLand() {
        return this != WATER;
    }
}
