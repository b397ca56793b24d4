package org.cataphract.runtime.audit;

import org.cataphract.runtime.model.Tick;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable record of one resolution: the rolls drawn, the inputs and
 * modifiers that went into the computation and the effect it had.
 *
 * @param sequence  Position in the campaign audit log, starting at 0.
 * @param tick      Tick in which the resolution happened.
 * @param subsystem Rule module that produced the entry.
 * @param subject   Entity or order the entry is about, e.g. {@code "order:14"}.
 * @param rolls     Rolls in the order they were drawn.
 * @param inputs    Named inputs and modifiers, in insertion order.
 * @param effect    Human readable outcome.
 */
public record AuditEntry(long sequence, Tick tick, AuditSubsystem subsystem, String subject, List<Roll> rolls,
                         Map<String, Object> inputs, String effect) {

    public AuditEntry {
        rolls = List.copyOf(rolls);
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }
}
