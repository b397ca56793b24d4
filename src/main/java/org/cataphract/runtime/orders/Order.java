package org.cataphract.runtime.orders;

import org.cataphract.runtime.api.InvariantViolationException;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Tick;

import java.util.Comparator;

/**
 * An instruction from a commander, queued on an army or on the commander and
 * carried out when its tick comes up.
 */
public class Order {

    /**
     * Dispatch key: due tick, then priority (higher first), then submission order.
     */
    public static final Comparator<Order> DISPATCH_ORDER = Comparator
            .comparing(Order::getDueTick)
            .thenComparing(Comparator.comparingInt(Order::getPriority).reversed())
            .thenComparingLong(Order::getSequence);

    private final long id;
    private final long sequence;
    private final long commanderId;
    private final Long armyId;
    private final OrderParameters parameters;
    private final Integer executeDay;
    private final DayPart executePart;
    private final int priority;
    private final Tick submittedAt;
    private OrderStatus status = OrderStatus.PENDING;
    private OrderResult result;

    public Order(long id, long sequence, long commanderId, Long armyId, OrderParameters parameters,
                 Integer executeDay, DayPart executePart, int priority, Tick submittedAt) {
        this.id = id;
        this.sequence = sequence;
        this.commanderId = commanderId;
        this.armyId = armyId;
        this.parameters = parameters;
        this.executeDay = executeDay;
        this.executePart = executePart;
        this.priority = priority;
        this.submittedAt = submittedAt;
    }

    public Order copy() {
        Order copy = new Order(id, sequence, commanderId, armyId, parameters, executeDay, executePart, priority,
                submittedAt);
        copy.status = status;
        copy.result = result;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getSequence() {
        return sequence;
    }

    public long getCommanderId() {
        return commanderId;
    }

    public Long getArmyId() {
        return armyId;
    }

    public OrderType getType() {
        return parameters.type();
    }

    public OrderParameters getParameters() {
        return parameters;
    }

    public Integer getExecuteDay() {
        return executeDay;
    }

    public DayPart getExecutePart() {
        return executePart;
    }

    public int getPriority() {
        return priority;
    }

    public Tick getSubmittedAt() {
        return submittedAt;
    }

    /**
     * @return the scheduled tick, or the submission tick for unscheduled orders.
     */
    public Tick getDueTick() {
        if (executeDay == null) {
            return submittedAt;
        }
        return Tick.of(executeDay, executePart == null ? DayPart.MORNING : executePart);
    }

    public boolean isDue(Tick now) {
        return getDueTick().compareTo(now) <= 0;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public OrderResult getResult() {
        return result;
    }

    public void setResult(OrderResult result) {
        this.result = result;
    }

    /**
     * Moves the order along its lifecycle.
     *
     * @throws InvariantViolationException if the lifecycle forbids the transition.
     */
    public void transitionTo(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvariantViolationException(
                    "Order " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    /**
     * @return the queue owner descriptor used in logs and audit entries.
     */
    public String subject() {
        return "order:" + id;
    }
}
