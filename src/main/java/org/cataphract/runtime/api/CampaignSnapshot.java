package org.cataphract.runtime.api;

import org.cataphract.runtime.audit.AuditEntry;
import org.cataphract.runtime.model.CampaignStatus;
import org.cataphract.runtime.model.Tick;

import java.util.List;

/**
 * The outcome of one resolved day-part, as handed to the host.
 *
 * @param campaignId   Campaign the snapshot belongs to.
 * @param resolvedTick The part that was resolved.
 * @param currentTick  The part the campaign clock now stands at.
 * @param status       Campaign status after the part.
 * @param auditEntries Entries the part appended to the audit log, in order.
 * @param stateJson    Canonical JSON of the whole campaign state, keys sorted.
 */
public record CampaignSnapshot(long campaignId, Tick resolvedTick, Tick currentTick, CampaignStatus status,
                               List<AuditEntry> auditEntries, String stateJson) {

    public CampaignSnapshot {
        auditEntries = List.copyOf(auditEntries);
    }
}
