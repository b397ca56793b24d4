package org.cataphract.runtime.api;

/**
 * Base of every rule violation the engine reports to its host or records on a
 * failed order.
 * <p>
 * It is part of the public API and hides which resolver raised the violation.
 */
public class CampaignRuleException extends Exception {

    /**
     * Constructs a new rule exception with the specified detail message.
     * @param message The detail message.
     */
    public CampaignRuleException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new rule exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CampaignRuleException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return a stable, machine readable name of the violation, e.g. {@code "invalid_route"}.
     */
    public String errorType() {
        return "rule_violation";
    }
}
