package org.cataphract.runtime.api;

import org.cataphract.runtime.model.DayPart;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An order as the host hands it in, before validation.
 *
 * @param commanderId Issuing commander.
 * @param armyId      Acting army, or null for commander-level orders.
 * @param orderType   Order type name, e.g. {@code "move"}.
 * @param parameters  Open, order-type-keyed parameter map.
 * @param executeDay  Day to execute on, or null for as soon as possible.
 * @param executePart Part of {@code executeDay} to execute in; null means morning.
 * @param priority    Tie-break between orders due together; higher goes first.
 */
public record OrderRequest(long commanderId, Long armyId, String orderType, Map<String, Object> parameters,
                           Integer executeDay, DayPart executePart, int priority) {

    public OrderRequest {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Creates an unscheduled request with default priority.
     */
    public static OrderRequest of(long commanderId, Long armyId, String orderType, Map<String, Object> parameters) {
        return new OrderRequest(commanderId, armyId, orderType, parameters, null, null, 0);
    }
}
