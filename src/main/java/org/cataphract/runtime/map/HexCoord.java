package org.cataphract.runtime.map;

import java.util.ArrayList;
import java.util.List;

/**
 * Axial hex coordinates.
 *
 * @param q Column axis.
 * @param r Row axis.
 */
public record HexCoord(int q, int r) {

    private static final int[][] DIRECTIONS = {
        {1, 0}, {1, -1}, {0, -1}, {-1, 0}, {-1, 1}, {0, 1}
    };

    /**
     * @param other Another coordinate.
     * @return the number of hex steps between the two coordinates.
     */
    public int distanceTo(HexCoord other) {
        int dq = q - other.q;
        int dr = r - other.r;
        return (Math.abs(dq) + Math.abs(dr) + Math.abs(dq + dr)) / 2;
    }

    public List<HexCoord> neighbors() {
        List<HexCoord> result = new ArrayList<>(DIRECTIONS.length);
        for (int[] d : DIRECTIONS) {
            result.add(new HexCoord(q + d[0], r + d[1]));
        }
        return result;
    }
}
