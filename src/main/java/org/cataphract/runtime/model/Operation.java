package org.cataphract.runtime.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A covert mission. Complex operations span several stages; the operation id
 * doubles as the continuation id a later order quotes to resume it.
 */
public class Operation {

    public enum Type {
        INTELLIGENCE,
        SABOTAGE,
        ASSASSINATION
    }

    public enum Complexity {
        SIMPLE,
        STANDARD,
        COMPLEX
    }

    public enum Status {
        IN_PROGRESS,
        SUCCEEDED,
        FAILED
    }

    private final long id;
    private final long commanderId;
    private final long armyId;
    private final Type type;
    private final OperationTarget target;
    private final Complexity complexity;
    private final TerritoryType territoryType;
    private final int difficultyModifier;
    private final int lootCost;
    private final int stagesRequired;
    private int stagesCompleted;
    private Status status = Status.IN_PROGRESS;
    private double successProbability;
    private final Map<String, Object> outcome = new LinkedHashMap<>();

    public Operation(long id, long commanderId, long armyId, Type type, OperationTarget target, Complexity complexity,
                     TerritoryType territoryType, int difficultyModifier, int lootCost, int stagesRequired) {
        this.id = id;
        this.commanderId = commanderId;
        this.armyId = armyId;
        this.type = type;
        this.target = target;
        this.complexity = complexity;
        this.territoryType = territoryType;
        this.difficultyModifier = difficultyModifier;
        this.lootCost = lootCost;
        this.stagesRequired = stagesRequired;
    }

    public Operation copy() {
        Operation copy = new Operation(id, commanderId, armyId, type, target, complexity, territoryType,
                difficultyModifier, lootCost, stagesRequired);
        copy.stagesCompleted = stagesCompleted;
        copy.status = status;
        copy.successProbability = successProbability;
        copy.outcome.putAll(outcome);
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getCommanderId() {
        return commanderId;
    }

    public long getArmyId() {
        return armyId;
    }

    public Type getType() {
        return type;
    }

    public OperationTarget getTarget() {
        return target;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public TerritoryType getTerritoryType() {
        return territoryType;
    }

    public int getDifficultyModifier() {
        return difficultyModifier;
    }

    public int getLootCost() {
        return lootCost;
    }

    public int getStagesRequired() {
        return stagesRequired;
    }

    public int getStagesCompleted() {
        return stagesCompleted;
    }

    public void setStagesCompleted(int stagesCompleted) {
        this.stagesCompleted = stagesCompleted;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public boolean isInProgress() {
        return status == Status.IN_PROGRESS;
    }

    public double getSuccessProbability() {
        return successProbability;
    }

    public void setSuccessProbability(double successProbability) {
        this.successProbability = successProbability;
    }

    public Map<String, Object> getOutcome() {
        return outcome;
    }
}
