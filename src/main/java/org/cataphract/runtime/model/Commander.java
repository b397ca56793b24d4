package org.cataphract.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A player-controlled leader. Owns at most one army at a time and holds a queue
 * of commander-level orders (messages, naval moves, recruitment).
 */
public class Commander {

    public enum Status {
        ACTIVE,
        CAPTURED,
        KILLED
    }

    private final long id;
    private final String name;
    private final long factionId;
    private Long currentHexId;
    private Status status = Status.ACTIVE;
    private final List<Long> pendingOrderIds = new ArrayList<>();

    public Commander(long id, String name, long factionId, Long currentHexId) {
        this.id = id;
        this.name = name;
        this.factionId = factionId;
        this.currentHexId = currentHexId;
    }

    private Commander(Commander other) {
        this(other.id, other.name, other.factionId, other.currentHexId);
        this.status = other.status;
        this.pendingOrderIds.addAll(other.pendingOrderIds);
    }

    public Commander copy() {
        return new Commander(this);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getFactionId() {
        return factionId;
    }

    public Long getCurrentHexId() {
        return currentHexId;
    }

    public void setCurrentHexId(Long currentHexId) {
        this.currentHexId = currentHexId;
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

    public List<Long> getPendingOrderIds() {
        return pendingOrderIds;
    }
}
