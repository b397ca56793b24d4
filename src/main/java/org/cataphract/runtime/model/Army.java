package org.cataphract.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A field army: a set of detachments under one commander, with its supply
 * train, morale and the queue of orders it has yet to carry out.
 */
public class Army {

    public enum Status {
        IDLE,
        MARCHING,
        RESTING,
        FORAGING,
        TORCHING,
        BESIEGING,
        HARRYING,
        EMBARKED,
        ROUTED
    }

    private final long id;
    private Long commanderId;
    private long locationHexId;
    private final List<Detachment> detachments = new ArrayList<>();
    private Status status = Status.IDLE;
    private int suppliesCurrent;
    private int suppliesCapacity;
    private int moraleCurrent;
    private int moraleResting;
    private int moraleMax;
    private double movementPointsRemaining;
    private int noncombatants;
    private int lootCarried;
    private Long embarkedShipId;
    private Integer restUntilDay;
    private Integer harriedOnDay;
    private int daysWithoutSupplies;
    private final List<Detachment> departedDetachments = new ArrayList<>();
    private Integer departedReturnDay;
    private final List<Long> pendingOrderIds = new ArrayList<>();

    public Army(long id, Long commanderId, long locationHexId) {
        this.id = id;
        this.commanderId = commanderId;
        this.locationHexId = locationHexId;
    }

    public Army copy() {
        Army copy = new Army(id, commanderId, locationHexId);
        for (Detachment detachment : detachments) {
            copy.detachments.add(detachment.copy());
        }
        copy.status = status;
        copy.suppliesCurrent = suppliesCurrent;
        copy.suppliesCapacity = suppliesCapacity;
        copy.moraleCurrent = moraleCurrent;
        copy.moraleResting = moraleResting;
        copy.moraleMax = moraleMax;
        copy.movementPointsRemaining = movementPointsRemaining;
        copy.noncombatants = noncombatants;
        copy.lootCarried = lootCarried;
        copy.embarkedShipId = embarkedShipId;
        copy.restUntilDay = restUntilDay;
        copy.harriedOnDay = harriedOnDay;
        copy.daysWithoutSupplies = daysWithoutSupplies;
        for (Detachment detachment : departedDetachments) {
            copy.departedDetachments.add(detachment.copy());
        }
        copy.departedReturnDay = departedReturnDay;
        copy.pendingOrderIds.addAll(pendingOrderIds);
        return copy;
    }

    public long getId() {
        return id;
    }

    public Long getCommanderId() {
        return commanderId;
    }

    public void setCommanderId(Long commanderId) {
        this.commanderId = commanderId;
    }

    public long getLocationHexId() {
        return locationHexId;
    }

    public void setLocationHexId(long locationHexId) {
        this.locationHexId = locationHexId;
    }

    public List<Detachment> getDetachments() {
        return detachments;
    }

    public Optional<Detachment> findDetachment(long detachmentId) {
        return detachments.stream().filter(d -> d.getId() == detachmentId).findFirst();
    }

    public int getSoldiers() {
        return detachments.stream().mapToInt(Detachment::getSoldiers).sum();
    }

    public int getWagons() {
        return detachments.stream().mapToInt(Detachment::getWagons).sum();
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public boolean isRouted() {
        return status == Status.ROUTED;
    }

    public boolean isEmbarked() {
        return embarkedShipId != null;
    }

    public int getSuppliesCurrent() {
        return suppliesCurrent;
    }

    public void setSuppliesCurrent(int suppliesCurrent) {
        this.suppliesCurrent = suppliesCurrent;
    }

    public int getSuppliesCapacity() {
        return suppliesCapacity;
    }

    public void setSuppliesCapacity(int suppliesCapacity) {
        this.suppliesCapacity = suppliesCapacity;
    }

    /**
     * Adds supplies up to the capacity of the train.
     *
     * @param amount Supplies offered, not negative.
     * @return the amount actually taken on.
     */
    public int addSupplies(int amount) {
        int taken = Math.max(0, Math.min(amount, suppliesCapacity - suppliesCurrent));
        suppliesCurrent += taken;
        return taken;
    }

    public int getMoraleCurrent() {
        return moraleCurrent;
    }

    /**
     * Sets morale, clamped to [0, morale max].
     */
    public void setMoraleCurrent(int moraleCurrent) {
        this.moraleCurrent = Math.max(0, Math.min(moraleMax, moraleCurrent));
    }

    public int getMoraleResting() {
        return moraleResting;
    }

    public void setMoraleResting(int moraleResting) {
        this.moraleResting = moraleResting;
    }

    public int getMoraleMax() {
        return moraleMax;
    }

    public void setMoraleMax(int moraleMax) {
        this.moraleMax = moraleMax;
    }

    public double getMovementPointsRemaining() {
        return movementPointsRemaining;
    }

    public void setMovementPointsRemaining(double movementPointsRemaining) {
        this.movementPointsRemaining = Math.max(0.0, movementPointsRemaining);
    }

    public int getNoncombatants() {
        return noncombatants;
    }

    public void setNoncombatants(int noncombatants) {
        this.noncombatants = Math.max(0, noncombatants);
    }

    public int getLootCarried() {
        return lootCarried;
    }

    public void setLootCarried(int lootCarried) {
        this.lootCarried = lootCarried;
    }

    public Long getEmbarkedShipId() {
        return embarkedShipId;
    }

    public void setEmbarkedShipId(Long embarkedShipId) {
        this.embarkedShipId = embarkedShipId;
    }

    public Integer getRestUntilDay() {
        return restUntilDay;
    }

    public void setRestUntilDay(Integer restUntilDay) {
        this.restUntilDay = restUntilDay;
    }

    public Integer getHarriedOnDay() {
        return harriedOnDay;
    }

    public void setHarriedOnDay(Integer harriedOnDay) {
        this.harriedOnDay = harriedOnDay;
    }

    public int getDaysWithoutSupplies() {
        return daysWithoutSupplies;
    }

    public void setDaysWithoutSupplies(int daysWithoutSupplies) {
        this.daysWithoutSupplies = daysWithoutSupplies;
    }

    /**
     * Detachments away from the army after a failed morale check. They do not
     * count for strength, supply or column length until they come back.
     */
    public List<Detachment> getDepartedDetachments() {
        return departedDetachments;
    }

    public Integer getDepartedReturnDay() {
        return departedReturnDay;
    }

    public void setDepartedReturnDay(Integer departedReturnDay) {
        this.departedReturnDay = departedReturnDay;
    }

    public List<Long> getPendingOrderIds() {
        return pendingOrderIds;
    }
}
