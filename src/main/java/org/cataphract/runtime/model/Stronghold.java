package org.cataphract.runtime.model;

/**
 * A fortified settlement bound to a hex. Its threshold is the defensive capacity
 * that a siege wears down; capture happens when it reaches zero.
 */
public class Stronghold {

    private final long id;
    private final String name;
    private final long hexId;
    private final StrongholdType type;
    private Long controllingFactionId;
    private final int baseThreshold;
    private int currentThreshold;
    private final int defensiveBonus;
    private Long garrisonArmyId;
    private int suppliesHeld;
    private int lootHeld;

    public Stronghold(long id, String name, long hexId, StrongholdType type, Long controllingFactionId,
                      int baseThreshold, int defensiveBonus) {
        this.id = id;
        this.name = name;
        this.hexId = hexId;
        this.type = type;
        this.controllingFactionId = controllingFactionId;
        this.baseThreshold = baseThreshold;
        this.currentThreshold = baseThreshold;
        this.defensiveBonus = defensiveBonus;
    }

    public Stronghold copy() {
        Stronghold copy = new Stronghold(id, name, hexId, type, controllingFactionId, baseThreshold, defensiveBonus);
        copy.currentThreshold = currentThreshold;
        copy.garrisonArmyId = garrisonArmyId;
        copy.suppliesHeld = suppliesHeld;
        copy.lootHeld = lootHeld;
        return copy;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getHexId() {
        return hexId;
    }

    public StrongholdType getType() {
        return type;
    }

    public Long getControllingFactionId() {
        return controllingFactionId;
    }

    public void setControllingFactionId(Long controllingFactionId) {
        this.controllingFactionId = controllingFactionId;
    }

    public boolean isControlledBy(long factionId) {
        return controllingFactionId != null && controllingFactionId == factionId;
    }

    public int getBaseThreshold() {
        return baseThreshold;
    }

    public int getCurrentThreshold() {
        return currentThreshold;
    }

    public void setCurrentThreshold(int currentThreshold) {
        this.currentThreshold = currentThreshold;
    }

    public int getDefensiveBonus() {
        return defensiveBonus;
    }

    public Long getGarrisonArmyId() {
        return garrisonArmyId;
    }

    public void setGarrisonArmyId(Long garrisonArmyId) {
        this.garrisonArmyId = garrisonArmyId;
    }

    public int getSuppliesHeld() {
        return suppliesHeld;
    }

    public void setSuppliesHeld(int suppliesHeld) {
        this.suppliesHeld = suppliesHeld;
    }

    public int getLootHeld() {
        return lootHeld;
    }

    public void setLootHeld(int lootHeld) {
        this.lootHeld = lootHeld;
    }
}
