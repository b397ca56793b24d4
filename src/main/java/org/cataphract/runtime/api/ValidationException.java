package org.cataphract.runtime.api;

/**
 * Malformed or missing order parameters. The order never enters a queue.
 */
public class ValidationException extends CampaignRuleException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "validation";
    }
}
