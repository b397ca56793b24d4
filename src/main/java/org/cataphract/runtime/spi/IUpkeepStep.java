package org.cataphract.runtime.spi;

import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.rules.RuleSet;

/**
 * A piece of per-part bookkeeping run by the tick engine after due orders have
 * been dispatched, such as eating supplies or delivering messages. Steps run in
 * the order configured under {@code cataphract.tick.upkeep-steps}.
 */
public interface IUpkeepStep {

    /**
     * @return the configuration name of the step, e.g. {@code "supply-drain"}.
     */
    String name();

    /**
     * Applies the step to the campaign for the tick of the given roll service.
     * A failure affecting one entity must not stop the step for the others.
     *
     * @param campaign The working copy of the campaign.
     * @param rules    Resolvers of the campaign's rules configuration.
     * @param rolls    Dice and audit for the current part.
     */
    void apply(Campaign campaign, RuleSet rules, RollService rolls);
}
