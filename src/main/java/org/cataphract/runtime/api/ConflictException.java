package org.cataphract.runtime.api;

/**
 * The request clashes with work already underway for the same entities.
 */
public class ConflictException extends CampaignRuleException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "conflict";
    }
}
