package org.cataphract.runtime.model;

import java.util.ArrayList;
import java.util.List;

public class Siege {

    public enum Status {
        ACTIVE,
        CAPTURED,
        LIFTED
    }

    private final long id;
    private final long strongholdId;
    private final List<Long> besiegingArmyIds = new ArrayList<>();
    private int siegeEngines;
    private int reductionPerPart;
    private final Tick startedAt;
    private Status status = Status.ACTIVE;

    public Siege(long id, long strongholdId, Tick startedAt) {
        this.id = id;
        this.strongholdId = strongholdId;
        this.startedAt = startedAt;
    }

    public Siege copy() {
        Siege copy = new Siege(id, strongholdId, startedAt);
        copy.besiegingArmyIds.addAll(besiegingArmyIds);
        copy.siegeEngines = siegeEngines;
        copy.reductionPerPart = reductionPerPart;
        copy.status = status;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getStrongholdId() {
        return strongholdId;
    }

    public List<Long> getBesiegingArmyIds() {
        return besiegingArmyIds;
    }

    public int getSiegeEngines() {
        return siegeEngines;
    }

    public void setSiegeEngines(int siegeEngines) {
        this.siegeEngines = siegeEngines;
    }

    public int getReductionPerPart() {
        return reductionPerPart;
    }

    public void setReductionPerPart(int reductionPerPart) {
        this.reductionPerPart = reductionPerPart;
    }

    public Tick getStartedAt() {
        return startedAt;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }
}
