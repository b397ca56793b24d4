package org.cataphract.runtime.api;

/**
 * An entity referenced by id does not exist in the campaign.
 */
public class NotFoundException extends CampaignRuleException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "not_found";
    }
}
