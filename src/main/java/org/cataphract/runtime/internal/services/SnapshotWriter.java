package org.cataphract.runtime.internal.services;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.cataphract.runtime.api.CampaignSnapshot;
import org.cataphract.runtime.audit.AuditEntry;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Tick;

import java.util.List;

/**
 * Renders campaign state and audit entries as canonical JSON: fields only,
 * properties and map keys sorted, so equal states always give equal text.
 */
public class SnapshotWriter {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .visibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
            .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String stateJson(Campaign campaign) {
        return write(campaign);
    }

    public String auditJson(List<AuditEntry> entries) {
        return write(entries);
    }

    /**
     * @param campaign     The campaign after the part.
     * @param resolvedTick The part just resolved.
     * @param partEntries  Audit entries appended during the part.
     */
    public CampaignSnapshot snapshot(Campaign campaign, Tick resolvedTick, List<AuditEntry> partEntries) {
        return new CampaignSnapshot(campaign.getId(), resolvedTick, campaign.getCurrentTick(), campaign.getStatus(),
                partEntries, stateJson(campaign));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
