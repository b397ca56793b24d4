package org.cataphract.runtime.map;

/**
 * One map hex. Topology fields are fixed; the foraging fields change as armies
 * live off the land.
 */
public class Hex {

    private final long id;
    private final HexCoord coord;
    private final Terrain terrain;
    private final int settlement;
    private int foragingUsesRemaining;
    private Integer torchedUntilDay;

    public Hex(long id, HexCoord coord, Terrain terrain, int settlement, int foragingUsesRemaining) {
        this.id = id;
        this.coord = coord;
        this.terrain = terrain;
        this.settlement = settlement;
        this.foragingUsesRemaining = foragingUsesRemaining;
    }

    public Hex copy() {
        Hex copy = new Hex(id, coord, terrain, settlement, foragingUsesRemaining);
        copy.torchedUntilDay = torchedUntilDay;
        return copy;
    }

    public long getId() {
        return id;
    }

    public HexCoord getCoord() {
        return coord;
    }

    public Terrain getTerrain() {
        return terrain;
    }

    public int getSettlement() {
        return settlement;
    }

    public int getForagingUsesRemaining() {
        return foragingUsesRemaining;
    }

    public void setForagingUsesRemaining(int foragingUsesRemaining) {
        this.foragingUsesRemaining = Math.max(0, foragingUsesRemaining);
    }

    public Integer getTorchedUntilDay() {
        return torchedUntilDay;
    }

    public void setTorchedUntilDay(Integer torchedUntilDay) {
        this.torchedUntilDay = torchedUntilDay;
    }

    /**
     * @param day The current day.
     * @return true while the countryside is still burnt out.
     */
    public boolean isTorchedOn(int day) {
        return torchedUntilDay != null && day < torchedUntilDay;
    }
}
