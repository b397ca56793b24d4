package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Detachment;
import org.cataphract.runtime.model.MercenaryContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Nightly wages of hired detachments, paid out of the army's loot. Unpaid
 * mercenaries grumble; once the grace period is over they may walk off.
 */
public class MercenaryUpkeep {

    private static final Logger LOG = LoggerFactory.getLogger(MercenaryUpkeep.class);

    private final RulesConfig rules;
    private final ArmyMath math;

    public MercenaryUpkeep(RulesConfig rules, ArmyMath math) {
        this.rules = rules;
        this.math = math;
    }

    /**
     * @return the nightly wage of the detachments hired under the contract.
     */
    public int wage(Campaign campaign, List<Detachment> hired) {
        RulesConfig.Mercenary config = rules.mercenary();
        int wage = 0;
        for (Detachment detachment : hired) {
            int rate = math.isCavalry(campaign, detachment) ? config.cavalryRate() : config.infantryRate();
            wage += detachment.getSoldiers() * rate;
        }
        return wage;
    }

    public void settle(Campaign campaign, MercenaryContract contract, RollService rolls) {
        if (contract.isTerminated()) {
            return;
        }
        String subject = "contract:" + contract.getId();
        Army army = campaign.getArmies().get(contract.getArmyId());
        List<Detachment> hired = army == null ? List.of() : army.getDetachments().stream()
                .filter(d -> d.getMercenaryContractId() != null && d.getMercenaryContractId() == contract.getId())
                .collect(Collectors.toList());
        int soldiers = hired.stream().mapToInt(Detachment::getSoldiers).sum();
        if (soldiers == 0) {
            contract.setStatus(MercenaryContract.Status.TERMINATED);
            rolls.audit(AuditSubsystem.MERCENARY, subject, Map.of(), "contract ended, no hired soldiers remain");
            return;
        }

        RulesConfig.Mercenary config = rules.mercenary();
        int wage = wage(campaign, hired);
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("soldiers", soldiers);
        inputs.put("wage", wage);
        inputs.put("loot", army.getLootCarried());

        if (army.getLootCarried() >= wage) {
            army.setLootCarried(army.getLootCarried() - wage);
            contract.setLastPaidDay(rolls.tick().day());
            contract.setDaysUnpaid(0);
            contract.setStatus(MercenaryContract.Status.ACTIVE);
            rolls.audit(AuditSubsystem.MERCENARY, subject, inputs, "army " + army.getId() + " paid " + wage + " loot");
            return;
        }

        contract.setDaysUnpaid(contract.getDaysUnpaid() + 1);
        contract.setStatus(MercenaryContract.Status.UNPAID);
        army.setMoraleCurrent(army.getMoraleCurrent() - config.unpaidMoraleLoss());
        inputs.put("days_unpaid", contract.getDaysUnpaid());
        String effect = "mercenaries of army " + army.getId() + " unpaid for " + contract.getDaysUnpaid() + " days";
        if (contract.getDaysUnpaid() > config.graceDays()) {
            Roll roll = rolls.d6("mercenary:" + contract.getId() + ":desertion", null);
            if (roll.total() <= config.desertionChance()) {
                army.getDetachments().removeAll(hired);
                math.refreshCapacity(campaign, army);
                contract.setStatus(MercenaryContract.Status.TERMINATED);
                effect += ", " + soldiers + " deserted";
                LOG.info("Mercenaries under contract {} deserted army {} on {}", contract.getId(), army.getId(),
                        rolls.tick());
            }
        }
        rolls.audit(AuditSubsystem.MERCENARY, subject, inputs, effect);
    }
}
