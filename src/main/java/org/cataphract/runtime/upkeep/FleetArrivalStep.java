package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Ship;
import org.cataphract.runtime.rules.RuleSet;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Lands ships whose voyage ends this part.
 */
public class FleetArrivalStep extends PerEntityStep<Ship> {

    public static final String NAME = "fleet-arrival";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Collection<Ship> entities(Campaign campaign, RollService rolls) {
        return campaign.getShips().values().stream().filter(Ship::isSailing).collect(Collectors.toList());
    }

    @Override
    protected String describe(Ship ship) {
        return "ship:" + ship.getId();
    }

    @Override
    protected AuditSubsystem subsystem() {
        return AuditSubsystem.NAVAL;
    }

    @Override
    protected void applyTo(Campaign campaign, RuleSet rules, Ship ship, RollService rolls) {
        rules.naval().arrive(campaign, ship, rolls);
    }
}
