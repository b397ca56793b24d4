package org.cataphract.runtime.model;

/**
 * A sub-unit of an army. Detachments can be tasked on their own for harrying
 * and may be bound to a mercenary contract.
 */
public class Detachment {

    private final long id;
    private final long unitTypeId;
    private int soldiers;
    private int wagons;
    private Long mercenaryContractId;

    public Detachment(long id, long unitTypeId, int soldiers, int wagons) {
        this.id = id;
        this.unitTypeId = unitTypeId;
        this.soldiers = soldiers;
        this.wagons = wagons;
    }

    public Detachment copy() {
        Detachment copy = new Detachment(id, unitTypeId, soldiers, wagons);
        copy.mercenaryContractId = mercenaryContractId;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getUnitTypeId() {
        return unitTypeId;
    }

    public int getSoldiers() {
        return soldiers;
    }

    public void setSoldiers(int soldiers) {
        this.soldiers = Math.max(0, soldiers);
    }

    public int getWagons() {
        return wagons;
    }

    public void setWagons(int wagons) {
        this.wagons = Math.max(0, wagons);
    }

    public Long getMercenaryContractId() {
        return mercenaryContractId;
    }

    public void setMercenaryContractId(Long mercenaryContractId) {
        this.mercenaryContractId = mercenaryContractId;
    }
}
