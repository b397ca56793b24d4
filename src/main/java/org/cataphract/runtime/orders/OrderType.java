package org.cataphract.runtime.orders;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of orders a commander can issue.
 */
public enum OrderType {
    MOVE(true),
    REST(true),
    FORAGE(true),
    TORCH(true),
    SUPPLY_TRANSFER(true),
    BESIEGE(true),
    ASSAULT(true),
    EMBARK(true),
    DISEMBARK(true),
    NAVAL_MOVE(false),
    SEND_MESSAGE(false),
    LAUNCH_OPERATION(true),
    RAISE_ARMY(false),
    HARRY(true);

    private final boolean requiresArmy;

    OrderType(boolean requiresArmy) {
        this.requiresArmy = requiresArmy;
    }

    /**
     * @return true if the order must name an acting army; otherwise it is queued on the commander.
     */
    public boolean requiresArmy() {
        return requiresArmy;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<OrderType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
    }
}
