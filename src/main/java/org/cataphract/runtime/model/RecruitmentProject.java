package org.cataphract.runtime.model;

import java.util.Map;
import java.util.TreeMap;

/**
 * A multi-tick levy at a stronghold. Progress accrues every day-part until the
 * project spawns its army at the rally hex.
 */
public class RecruitmentProject {

    public enum Status {
        ACTIVE,
        COMPLETED,
        ABANDONED
    }

    private final long id;
    private final long strongholdId;
    private final long issuingCommanderId;
    private final long commanderToBeId;
    private final Map<Long, Integer> composition;
    private final int wagons;
    private final long rallyHexId;
    private final long orderId;
    private int progress;
    private final int requiredProgress;
    private Status status = Status.ACTIVE;
    private Long spawnedArmyId;

    public RecruitmentProject(long id, long strongholdId, long issuingCommanderId, long commanderToBeId,
                              Map<Long, Integer> composition, int wagons, long rallyHexId, long orderId,
                              int requiredProgress) {
        this.id = id;
        this.strongholdId = strongholdId;
        this.issuingCommanderId = issuingCommanderId;
        this.commanderToBeId = commanderToBeId;
        this.composition = new TreeMap<>(composition);
        this.wagons = wagons;
        this.rallyHexId = rallyHexId;
        this.orderId = orderId;
        this.requiredProgress = requiredProgress;
    }

    public RecruitmentProject copy() {
        RecruitmentProject copy = new RecruitmentProject(id, strongholdId, issuingCommanderId, commanderToBeId,
                composition, wagons, rallyHexId, orderId, requiredProgress);
        copy.progress = progress;
        copy.status = status;
        copy.spawnedArmyId = spawnedArmyId;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getStrongholdId() {
        return strongholdId;
    }

    public long getIssuingCommanderId() {
        return issuingCommanderId;
    }

    public long getCommanderToBeId() {
        return commanderToBeId;
    }

    /**
     * @return soldiers to raise, keyed by unit type id.
     */
    public Map<Long, Integer> getComposition() {
        return composition;
    }

    public int getWagons() {
        return wagons;
    }

    public long getRallyHexId() {
        return rallyHexId;
    }

    /**
     * @return the raise_army order that opened this project.
     */
    public long getOrderId() {
        return orderId;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public int getRequiredProgress() {
        return requiredProgress;
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

    public Long getSpawnedArmyId() {
        return spawnedArmyId;
    }

    public void setSpawnedArmyId(Long spawnedArmyId) {
        this.spawnedArmyId = spawnedArmyId;
    }
}
