package org.cataphract.runtime.internal.services;

import org.cataphract.runtime.audit.AuditEntry;
import org.cataphract.runtime.audit.AuditLog;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.spi.IRollSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dice and audit capability handed to every resolver for one day-part.
 * <p>
 * Each draw gets its own source derived from the campaign source, the tick, the
 * draw context and how often that context was already drawn in this part. Rolls
 * collect until the resolver records an audit entry, which takes all of them,
 * so no stochastic outcome reaches the state without an explaining entry.
 * <p>
 * Not thread-safe; one instance serves one campaign for one part.
 */
public class RollService {

    private final IRollSource campaignSource;
    private final IRollSource tickSource;
    private final AuditLog auditLog;
    private final Tick tick;
    private final Map<String, Long> occurrences = new HashMap<>();
    private final List<Roll> pending = new ArrayList<>();

    public RollService(IRollSource campaignSource, AuditLog auditLog, Tick tick) {
        this.campaignSource = campaignSource;
        this.tickSource = campaignSource.deriveFor("tick", tick.index());
        this.auditLog = auditLog;
        this.tick = tick;
    }

    public Tick tick() {
        return tick;
    }

    public IRollSource campaignSource() {
        return campaignSource;
    }

    /**
     * Rolls {@code dice} dice with {@code faces} faces each, or uses the fixed total.
     *
     * @param context Stable name of the draw.
     * @param dice    Number of dice, at least 1.
     * @param faces   Faces per die, at least 2.
     * @param fixed   Caller override replacing the dice, or null.
     * @return the roll, also queued for the next audit entry.
     */
    public Roll roll(String context, int dice, int faces, Integer fixed) {
        if (dice < 1 || faces < 2) {
            throw new IllegalArgumentException("Invalid dice " + dice + "d" + faces + " for " + context);
        }
        long occurrence = occurrences.merge(context, 1L, Long::sum) - 1;
        IRollSource source = tickSource.deriveFor(context, occurrence);
        String notation = dice + "d" + faces;
        Roll roll;
        if (fixed != null) {
            roll = new Roll(context, source.seed(), notation, List.of(), fixed, fixed);
        } else {
            List<Integer> values = new ArrayList<>(dice);
            int total = 0;
            for (int i = 0; i < dice; i++) {
                int face = source.nextInt(faces) + 1;
                values.add(face);
                total += face;
            }
            roll = new Roll(context, source.seed(), notation, values, null, total);
        }
        pending.add(roll);
        return roll;
    }

    public Roll d6(String context, Integer fixed) {
        return roll(context, 1, 6, fixed);
    }

    public Roll twoD6(String context, Integer fixed) {
        return roll(context, 2, 6, fixed);
    }

    /**
     * Appends an audit entry carrying every roll drawn since the previous entry.
     */
    public AuditEntry audit(AuditSubsystem subsystem, String subject, Map<String, Object> inputs, String effect) {
        List<Roll> rolls = new ArrayList<>(pending);
        pending.clear();
        return auditLog.append(tick, subsystem, subject, rolls, inputs, effect);
    }

    /**
     * Records rolls that a failed resolution drew before it gave up.
     */
    public void flushUnaudited(AuditSubsystem subsystem, String subject, String effect) {
        if (!pending.isEmpty()) {
            audit(subsystem, subject, Map.of(), effect);
        }
    }

    public boolean hasUnauditedRolls() {
        return !pending.isEmpty();
    }
}
