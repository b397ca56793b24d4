package org.cataphract.runtime.orders;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What came of an order.
 *
 * @param success   False only for orders that failed with a rule violation or error.
 * @param partial   True when the order was carried out only in part, e.g. a march cut short.
 * @param summary   Human readable outcome.
 * @param details   Structured outcome values, e.g. the final hex or a continuation id.
 * @param errorType Error category for failed orders, otherwise null.
 */
public record OrderResult(boolean success, boolean partial, String summary, Map<String, Object> details,
                          String errorType) {

    public OrderResult {
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static OrderResult completed(String summary, Map<String, Object> details) {
        return new OrderResult(true, false, summary, details, null);
    }

    public static OrderResult partial(String summary, Map<String, Object> details) {
        return new OrderResult(true, true, summary, details, null);
    }

    public static OrderResult failed(String errorType, String message) {
        return new OrderResult(false, false, message, Map.of(), errorType);
    }
}
