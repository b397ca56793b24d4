package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Detachment;
import org.cataphract.runtime.model.UnitType;

import java.util.Collection;
import java.util.List;

/**
 * Derived army figures shared by the resolvers: supply capacity and consumption,
 * column length and fighting strength.
 */
public final class ArmyMath {

    private final RulesConfig rules;

    public ArmyMath(RulesConfig rules) {
        this.rules = rules;
    }

    public int infantry(Campaign campaign, Collection<Detachment> detachments) {
        int total = 0;
        for (Detachment detachment : detachments) {
            if (!isCavalry(campaign, detachment)) {
                total += detachment.getSoldiers();
            }
        }
        return total;
    }

    public int cavalry(Campaign campaign, Collection<Detachment> detachments) {
        int total = 0;
        for (Detachment detachment : detachments) {
            if (isCavalry(campaign, detachment)) {
                total += detachment.getSoldiers();
            }
        }
        return total;
    }

    public boolean isCavalry(Campaign campaign, Detachment detachment) {
        UnitType type = campaign.getUnitTypes().get(detachment.getUnitTypeId());
        return type != null && type.isCavalry();
    }

    public boolean isSkirmisher(Campaign campaign, Detachment detachment) {
        UnitType type = campaign.getUnitTypes().get(detachment.getUnitTypeId());
        return type != null && type.skirmisher();
    }

    public boolean hasCavalry(Campaign campaign, Army army) {
        return cavalry(campaign, army.getDetachments()) > 0;
    }

    /**
     * Supply capacity: what infantry and camp followers carry, plus cavalry and wagons.
     */
    public int capacity(Campaign campaign, Army army) {
        RulesConfig.Supply supply = rules.supply();
        int infantry = infantry(campaign, army.getDetachments()) + army.getNoncombatants();
        return infantry * supply.infantryCapacity()
                + cavalry(campaign, army.getDetachments()) * supply.cavalryCapacity()
                + army.getWagons() * supply.wagonCapacity();
    }

    /**
     * @return supplies eaten per day.
     */
    public int dailyConsumption(Campaign campaign, Army army) {
        RulesConfig.Supply supply = rules.supply();
        int infantry = infantry(campaign, army.getDetachments()) + army.getNoncombatants();
        return infantry * supply.infantryConsumption()
                + cavalry(campaign, army.getDetachments()) * supply.cavalryConsumption()
                + army.getWagons() * supply.wagonConsumption();
    }

    /**
     * Column length in miles: the longest of the infantry, cavalry and wagon columns.
     */
    public double columnLengthMiles(Campaign campaign, Army army) {
        RulesConfig.Movement movement = rules.movement();
        double infantryMiles = (double) (infantry(campaign, army.getDetachments()) + army.getNoncombatants())
                / movement.infantryPerColumnMile();
        double cavalryMiles = (double) cavalry(campaign, army.getDetachments()) / movement.cavalryPerColumnMile();
        double wagonMiles = (double) army.getWagons() / movement.wagonsPerColumnMile();
        return Math.max(infantryMiles, Math.max(cavalryMiles, wagonMiles));
    }

    /**
     * @return everyone marching in the column, soldiers and camp followers alike.
     */
    public int columnHeadcount(Army army) {
        return army.getSoldiers() + army.getNoncombatants();
    }

    /**
     * Fighting strength, with cavalry counting more than infantry.
     */
    public int strength(Campaign campaign, Army army) {
        return infantry(campaign, army.getDetachments())
                + cavalry(campaign, army.getDetachments()) * rules.combat().cavalryStrengthMultiplier();
    }

    /**
     * Removes a percentage of soldiers, spread over the detachments in order.
     *
     * @return soldiers actually lost.
     */
    public int applyPercentLosses(List<Detachment> detachments, int percent) {
        int total = detachments.stream().mapToInt(Detachment::getSoldiers).sum();
        return applyLosses(detachments, (total * percent) / 100);
    }

    /**
     * Removes soldiers from the detachments in order until the losses are covered.
     *
     * @return soldiers actually lost.
     */
    public int applyLosses(List<Detachment> detachments, int losses) {
        int remaining = losses;
        for (Detachment detachment : detachments) {
            if (remaining <= 0) {
                break;
            }
            int taken = Math.min(remaining, detachment.getSoldiers());
            detachment.setSoldiers(detachment.getSoldiers() - taken);
            remaining -= taken;
        }
        return losses - remaining;
    }

    /**
     * Recomputes capacity after a change in composition and sheds supplies the train can no longer carry.
     */
    public void refreshCapacity(Campaign campaign, Army army) {
        army.setSuppliesCapacity(capacity(campaign, army));
        if (army.getSuppliesCurrent() > army.getSuppliesCapacity()) {
            army.setSuppliesCurrent(army.getSuppliesCapacity());
        }
    }
}
