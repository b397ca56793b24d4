package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidRouteException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Detachment;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detachments sent to harass an enemy army: killing stragglers, burning its
 * supplies or stealing its loot. Success is a 1d6 at or under the harrying chance.
 */
public class HarryingResolver {

    private final RulesConfig rules;
    private final ArmyMath math;

    public HarryingResolver(RulesConfig rules, ArmyMath math) {
        this.rules = rules;
        this.math = math;
    }

    public OrderResult resolveHarry(Campaign campaign, Army army, OrderParameters.Harry harry, RollService rolls,
                                    String subject) throws InvalidRouteException, InvalidStateException, NotFoundException {
        RulesConfig.Harry config = rules.harry();
        Army target = campaign.requireArmy(harry.targetArmyId());
        if (target.getId() == army.getId()) {
            throw new InvalidStateException("Army " + army.getId() + " cannot harry itself");
        }
        if (army.isEmbarked() || target.isEmbarked()) {
            throw new InvalidStateException("Embarked armies cannot harry or be harried");
        }
        if (campaign.getMap().distance(army.getLocationHexId(), target.getLocationHexId()) > config.maxDistance()) {
            throw new InvalidRouteException("Army " + target.getId() + " is out of reach of army " + army.getId());
        }
        List<Detachment> detached = new ArrayList<>();
        for (long detachmentId : harry.detachmentIds()) {
            Detachment detachment = army.findDetachment(detachmentId).orElseThrow(() -> new NotFoundException(
                    "Detachment " + detachmentId + " is not part of army " + army.getId()));
            detached.add(detachment);
        }
        int soldiers = detached.stream().mapToInt(Detachment::getSoldiers).sum();
        if (soldiers == 0) {
            throw new InvalidStateException("Detachments " + harry.detachmentIds() + " have no soldiers left");
        }

        boolean skirmisher = detached.stream().anyMatch(d -> math.isSkirmisher(campaign, d));
        boolean cavalry = detached.stream().anyMatch(d -> math.isCavalry(campaign, d));
        int modifier = (skirmisher ? config.skirmisherBonus() : 0) + (cavalry ? config.cavalryBonus() : 0);
        int chance = Math.min(6, config.baseChance() + modifier);
        Roll roll = rolls.d6("harry:" + army.getId() + ":" + target.getId(), harry.fixedRoll());
        boolean success = roll.total() <= chance;

        army.setStatus(Army.Status.HARRYING);
        army.setMovementPointsRemaining(0);
        target.setHarriedOnDay(campaign.getCurrentDay());
        if (target.getStatus() == Army.Status.RESTING) {
            target.setStatus(Army.Status.IDLE);
            target.setRestUntilDay(null);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("success", success);
        details.put("objective", harry.objective().name().toLowerCase(Locale.ROOT));
        String effect;
        if (success) {
            effect = applySuccess(campaign, army, target, harry.objective(), soldiers, modifier, rolls, details);
        } else {
            int losses = Math.max(1, soldiers * config.failureLossPercent() / 100);
            losses = math.applyLosses(detached, losses);
            math.refreshCapacity(campaign, army);
            details.put("attacker_losses", losses);
            effect = "harrying failed, detachments lost " + losses + " soldiers";
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("soldiers", soldiers);
        inputs.put("skirmisher", skirmisher);
        inputs.put("cavalry", cavalry);
        inputs.put("chance", chance);
        rolls.audit(AuditSubsystem.HARRYING, subject, inputs, effect);
        return OrderResult.completed(effect, details);
    }

    private String applySuccess(Campaign campaign, Army army, Army target, OrderParameters.HarryObjective objective,
                                int soldiers, int modifier, RollService rolls, Map<String, Object> details) {
        String context = "harry:" + army.getId() + ":" + target.getId();
        switch (objective) {
            case KILL: {
                int casualties = Math.max(1, soldiers * rules.harry().killPercent() / 100);
                casualties = math.applyLosses(target.getDetachments(), casualties);
                math.refreshCapacity(campaign, target);
                details.put("inflicted_casualties", casualties);
                return "harrying inflicted " + casualties + " casualties on army " + target.getId();
            }
            case TORCH: {
                int burnRoll = Math.max(1, rolls.twoD6(context + ":torch", null).total() + modifier);
                int burned = Math.min(soldiers * burnRoll, target.getSuppliesCurrent());
                target.setSuppliesCurrent(target.getSuppliesCurrent() - burned);
                details.put("supplies_burned", burned);
                return "harrying burned " + burned + " supplies of army " + target.getId();
            }
            case STEAL: {
                int stealRoll = Math.max(1, rolls.d6(context + ":steal", null).total() + modifier);
                int haul = soldiers * stealRoll;
                int loot = Math.min(haul, target.getLootCarried());
                target.setLootCarried(target.getLootCarried() - loot);
                army.setLootCarried(army.getLootCarried() + loot);
                int supplies = 0;
                if (haul > loot) {
                    supplies = army.addSupplies(Math.min(haul - loot, target.getSuppliesCurrent()));
                    target.setSuppliesCurrent(target.getSuppliesCurrent() - supplies);
                }
                details.put("loot_stolen", loot);
                details.put("supplies_stolen", supplies);
                return "harrying stole " + loot + " loot and " + supplies + " supplies from army " + target.getId();
            }
            default:
                throw new IllegalStateException("Unknown harrying objective " + objective);
        }
    }
}
