package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Siege;
import org.cataphract.runtime.rules.RuleSet;

import java.util.Collection;
import java.util.stream.Collectors;

public class SiegeAdvanceStep extends PerEntityStep<Siege> {

    public static final String NAME = "siege-advance";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Collection<Siege> entities(Campaign campaign, RollService rolls) {
        return campaign.getSieges().values().stream().filter(Siege::isActive).collect(Collectors.toList());
    }

    @Override
    protected String describe(Siege siege) {
        return "siege:" + siege.getId();
    }

    @Override
    protected AuditSubsystem subsystem() {
        return AuditSubsystem.SIEGE;
    }

    @Override
    protected void applyTo(Campaign campaign, RuleSet rules, Siege siege, RollService rolls) {
        // A siege captured earlier in this part by an assault is already over.
        if (siege.isActive()) {
            rules.combat().advanceSiege(campaign, siege, rolls);
        }
    }
}
