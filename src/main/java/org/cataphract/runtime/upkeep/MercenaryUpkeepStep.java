package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.MercenaryContract;
import org.cataphract.runtime.rules.RuleSet;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pays mercenary wages once a day, at night.
 */
public class MercenaryUpkeepStep extends PerEntityStep<MercenaryContract> {

    public static final String NAME = "mercenary-upkeep";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Collection<MercenaryContract> entities(Campaign campaign, RollService rolls) {
        if (rolls.tick().part() != DayPart.NIGHT) {
            return List.of();
        }
        return campaign.getContracts().values().stream()
                .filter(contract -> !contract.isTerminated())
                .collect(Collectors.toList());
    }

    @Override
    protected String describe(MercenaryContract contract) {
        return "contract:" + contract.getId();
    }

    @Override
    protected AuditSubsystem subsystem() {
        return AuditSubsystem.MERCENARY;
    }

    @Override
    protected void applyTo(Campaign campaign, RuleSet rules, MercenaryContract contract, RollService rolls) {
        rules.mercenaries().settle(campaign, contract, rolls);
    }
}
