package org.cataphract.runtime.api;

/**
 * A route, leg, position or capacity requirement of an order cannot be met.
 */
public class InvalidRouteException extends CampaignRuleException {

    public InvalidRouteException(String message) {
        super(message);
    }

    public InvalidRouteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "invalid_route";
    }
}
