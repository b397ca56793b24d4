package org.cataphract.runtime.audit;

import org.cataphract.runtime.model.Tick;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of every resolution in a campaign. Entries are never mutated
 * or removed; a rolled back part restores an earlier copy of the log instead.
 */
public class AuditLog {

    private final List<AuditEntry> entries = new ArrayList<>();

    public AuditLog copy() {
        AuditLog copy = new AuditLog();
        copy.entries.addAll(entries);
        return copy;
    }

    /**
     * Appends a new entry, assigning the next sequence number.
     *
     * @return the appended entry.
     */
    public AuditEntry append(Tick tick, AuditSubsystem subsystem, String subject, List<Roll> rolls,
                             Map<String, Object> inputs, String effect) {
        AuditEntry entry = new AuditEntry(entries.size(), tick, subsystem, subject, rolls, inputs, effect);
        entries.add(entry);
        return entry;
    }

    public List<AuditEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @param since Earliest tick of interest, inclusive.
     * @return entries produced at or after the given tick, in log order.
     */
    public List<AuditEntry> entriesSince(Tick since) {
        List<AuditEntry> result = new ArrayList<>();
        for (AuditEntry entry : entries) {
            if (entry.tick().compareTo(since) >= 0) {
                result.add(entry);
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }
}
