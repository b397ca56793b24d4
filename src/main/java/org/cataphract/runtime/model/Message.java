package org.cataphract.runtime.model;

/**
 * A courier message between two commanders.
 */
public class Message {

    public enum Status {
        IN_TRANSIT,
        DELIVERED,
        LOST
    }

    private final long id;
    private final long senderId;
    private final long recipientId;
    private final String content;
    private final TerritoryType territoryType;
    private final Tick dispatchTick;
    private Tick deliveryTick;
    private double interceptionProbability;
    private Status status = Status.IN_TRANSIT;
    private boolean delivered;

    public Message(long id, long senderId, long recipientId, String content, TerritoryType territoryType,
                   Tick dispatchTick) {
        this.id = id;
        this.senderId = senderId;
        this.recipientId = recipientId;
        this.content = content;
        this.territoryType = territoryType;
        this.dispatchTick = dispatchTick;
    }

    public Message copy() {
        Message copy = new Message(id, senderId, recipientId, content, territoryType, dispatchTick);
        copy.deliveryTick = deliveryTick;
        copy.interceptionProbability = interceptionProbability;
        copy.status = status;
        copy.delivered = delivered;
        return copy;
    }

    public long getId() {
        return id;
    }

    public long getSenderId() {
        return senderId;
    }

    public long getRecipientId() {
        return recipientId;
    }

    public String getContent() {
        return content;
    }

    public TerritoryType getTerritoryType() {
        return territoryType;
    }

    public Tick getDispatchTick() {
        return dispatchTick;
    }

    public Tick getDeliveryTick() {
        return deliveryTick;
    }

    public void setDeliveryTick(Tick deliveryTick) {
        this.deliveryTick = deliveryTick;
    }

    public double getInterceptionProbability() {
        return interceptionProbability;
    }

    public void setInterceptionProbability(double interceptionProbability) {
        this.interceptionProbability = interceptionProbability;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isDelivered() {
        return delivered;
    }

    /**
     * Marks the message as delivered.
     */
    public void markDelivered() {
        this.status = Status.DELIVERED;
        this.delivered = true;
    }

    /**
     * Marks the message as intercepted. A lost message is never delivered.
     */
    public void markLost() {
        this.status = Status.LOST;
        this.delivered = false;
    }
}
