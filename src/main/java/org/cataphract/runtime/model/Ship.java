package org.cataphract.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A transport that carries at most one army along sea lanes.
 */
public class Ship {

    public enum Status {
        AVAILABLE,
        SAILING
    }

    private final long id;
    private final long factionId;
    private long hexId;
    private final int troopCapacity;
    private Long embarkedArmyId;
    private final List<Long> route = new ArrayList<>();
    private Tick arrivalTick;
    private Status status = Status.AVAILABLE;

    public Ship(long id, long factionId, long hexId, int troopCapacity) {
        this.id = id;
        this.factionId = factionId;
        this.hexId = hexId;
        this.troopCapacity = troopCapacity;
    }

    public Ship copy() {
        Ship copy = new Ship(id, factionId, hexId, troopCapacity);
        copy.embarkedArmyId = embarkedArmyId;
        copy.route.addAll(route);
        copy.arrivalTick = arrivalTick;
        copy.status = status;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getFactionId() {
        return factionId;
    }

    public long getHexId() {
        return hexId;
    }

    public void setHexId(long hexId) {
        this.hexId = hexId;
    }

    public int getTroopCapacity() {
        return troopCapacity;
    }

    public Long getEmbarkedArmyId() {
        return embarkedArmyId;
    }

    public void setEmbarkedArmyId(Long embarkedArmyId) {
        this.embarkedArmyId = embarkedArmyId;
    }

    public List<Long> getRoute() {
        return route;
    }

    public Tick getArrivalTick() {
        return arrivalTick;
    }

    public void setArrivalTick(Tick arrivalTick) {
        this.arrivalTick = arrivalTick;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public boolean isSailing() {
        return status == Status.SAILING;
    }
}
