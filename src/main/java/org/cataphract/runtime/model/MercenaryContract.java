package org.cataphract.runtime.model;

/**
 * Hire of mercenary detachments, paid daily out of the army's loot.
 */
public class MercenaryContract {

    public enum Status {
        ACTIVE,
        UNPAID,
        TERMINATED
    }

    private final long id;
    private final long armyId;
    private int lastPaidDay;
    private int daysUnpaid;
    private Status status = Status.ACTIVE;

    public MercenaryContract(long id, long armyId, int lastPaidDay) {
        this.id = id;
        this.armyId = armyId;
        this.lastPaidDay = lastPaidDay;
    }

    public MercenaryContract copy() {
        MercenaryContract copy = new MercenaryContract(id, armyId, lastPaidDay);
        copy.daysUnpaid = daysUnpaid;
        copy.status = status;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getArmyId() {
        return armyId;
    }

    public int getLastPaidDay() {
        return lastPaidDay;
    }

    public void setLastPaidDay(int lastPaidDay) {
        this.lastPaidDay = lastPaidDay;
    }

    public int getDaysUnpaid() {
        return daysUnpaid;
    }

    public void setDaysUnpaid(int daysUnpaid) {
        this.daysUnpaid = daysUnpaid;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public boolean isTerminated() {
        return status == Status.TERMINATED;
    }
}
