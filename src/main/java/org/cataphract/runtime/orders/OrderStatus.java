package org.cataphract.runtime.orders;

/**
 * Order lifecycle. PENDING and EXECUTING are live; the others are final.
 */
public enum OrderStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * @param target The requested next status.
     * @return whether the lifecycle allows moving from this status to the target.
     */
    public boolean canTransitionTo(OrderStatus target) {
        switch (this) {
            case PENDING:
                return target == EXECUTING || target == CANCELLED;
            case EXECUTING:
                return target == COMPLETED || target == FAILED || target == CANCELLED;
            default:
                return false;
        }
    }
}
