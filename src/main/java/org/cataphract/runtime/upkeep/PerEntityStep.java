package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.api.InvariantViolationException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.TickError;
import org.cataphract.runtime.rules.RuleSet;
import org.cataphract.runtime.spi.IUpkeepStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Base of the upkeep steps that visit one kind of entity. A failure on one
 * entity is logged and recorded as a tick error, and the step moves on.
 *
 * @param <T> The entity type visited.
 */
abstract class PerEntityStep<T> implements IUpkeepStep {

    private static final Logger LOG = LoggerFactory.getLogger(PerEntityStep.class);

    /**
     * @return the entities to visit this part, in a stable order.
     */
    protected abstract Collection<T> entities(Campaign campaign, RollService rolls);

    protected abstract String describe(T entity);

    protected abstract AuditSubsystem subsystem();

    protected abstract void applyTo(Campaign campaign, RuleSet rules, T entity, RollService rolls);

    @Override
    public final void apply(Campaign campaign, RuleSet rules, RollService rolls) {
        List<T> visited = new ArrayList<>(entities(campaign, rolls));
        for (T entity : visited) {
            try {
                applyTo(campaign, rules, entity, rolls);
            } catch (InvariantViolationException e) {
                throw e;
            } catch (RuntimeException e) {
                String subject = describe(entity);
                LOG.warn("Upkeep step {} failed for {} on {}", name(), subject, rolls.tick(), e);
                rolls.flushUnaudited(subsystem(), subject, name() + " failed: " + e.getMessage());
                campaign.recordTickError(new TickError(rolls.tick(), subject, "internal", e.toString()));
            }
        }
    }
}
