package org.cataphract.runtime.api;

/**
 * The issuing commander does not control the entity the order acts on.
 */
public class AuthorizationException extends CampaignRuleException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "authorization";
    }
}
