package org.cataphract.runtime.api;

/**
 * The entity is in a state that does not admit the requested transition.
 */
public class InvalidStateException extends CampaignRuleException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "invalid_state";
    }
}
