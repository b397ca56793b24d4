package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.rules.RuleSet;

import java.util.Collection;

/**
 * Every army eats its share of the day's supplies; starving armies lose morale at night.
 */
public class SupplyDrainStep extends PerEntityStep<Army> {

    public static final String NAME = "supply-drain";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Collection<Army> entities(Campaign campaign, RollService rolls) {
        return campaign.getArmies().values();
    }

    @Override
    protected String describe(Army army) {
        return "army:" + army.getId();
    }

    @Override
    protected AuditSubsystem subsystem() {
        return AuditSubsystem.SUPPLY;
    }

    @Override
    protected void applyTo(Campaign campaign, RuleSet rules, Army army, RollService rolls) {
        rules.logistics().drainSupplies(campaign, army, rolls);
    }
}
