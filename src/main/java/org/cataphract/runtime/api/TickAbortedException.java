package org.cataphract.runtime.api;

import org.cataphract.runtime.model.Tick;

/**
 * Raised by {@code advance} when a day-part was rolled back, either because an
 * invariant broke or because its commit failed. Parts committed before the
 * aborted one stay committed.
 */
public class TickAbortedException extends Exception {

    private final Tick tick;

    public TickAbortedException(Tick tick, Throwable cause) {
        super("Tick " + tick + " aborted and rolled back: " + cause.getMessage(), cause);
        this.tick = tick;
    }

    /**
     * @return the part that was rolled back.
     */
    public Tick getTick() {
        return tick;
    }
}
