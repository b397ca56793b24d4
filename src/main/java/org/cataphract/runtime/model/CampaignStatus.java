package org.cataphract.runtime.model;

public enum CampaignStatus {
    ACTIVE,
    PAUSED,
    FINISHED
}
