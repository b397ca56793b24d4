package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Detachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Morale checks: 2d6 against the army's current morale, passed at or below it.
 * A failed check applies the consequence its roll selects, from mutiny on a 2
 * to nothing at all on a 12.
 * <p>
 * Each check writes its own audit entry, so callers audit their own rolls first.
 */
public class MoraleCheckResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MoraleCheckResolver.class);

    /**
     * Result of one check.
     *
     * @param consequence What the failure brought, or null when the check passed.
     * @param details     Figures of the consequence, snake_case keys.
     */
    public record Outcome(boolean passed, int roll, MoraleConsequence consequence, Map<String, Object> details) {
    }

    private final RulesConfig rules;
    private final ArmyMath math;

    public MoraleCheckResolver(RulesConfig rules, ArmyMath math) {
        this.rules = rules;
        this.math = math;
    }

    /**
     * Checks the army's morale and applies the consequence of a failure.
     *
     * @param reason Why the check is taken, e.g. {@code starvation}; part of the roll context.
     */
    public Outcome check(Campaign campaign, Army army, String reason, RollService rolls) {
        String context = "morale:" + army.getId() + ":" + reason;
        String subject = "army:" + army.getId();
        int morale = army.getMoraleCurrent();
        Roll roll = rolls.twoD6(context, null);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("reason", reason);
        inputs.put("morale", morale);
        if (roll.total() <= morale) {
            rolls.audit(AuditSubsystem.MORALE, subject, inputs,
                    "army " + army.getId() + " held on " + reason + ", rolled " + roll.total() + " against " + morale);
            return new Outcome(true, roll.total(), null, Map.of());
        }

        MoraleConsequence consequence = MoraleConsequence.forRoll(roll.total());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("consequence", consequence.wireName());
        apply(campaign, army, consequence, context, rolls, details);
        math.refreshCapacity(campaign, army);
        if (army.getSoldiers() == 0 && !army.isRouted()) {
            army.setStatus(Army.Status.ROUTED);
            details.put("routed", true);
        }

        String effect = "army " + army.getId() + " failed morale on " + reason + ", rolled " + roll.total()
                + " against " + morale + ": " + consequence.wireName() + " " + details;
        rolls.audit(AuditSubsystem.MORALE, subject, inputs, effect);
        if (consequence != MoraleConsequence.NO_CONSEQUENCE) {
            LOG.info("Army {} failed a morale check ({}) on {}: {}", army.getId(), reason, rolls.tick(),
                    consequence.wireName());
        }
        return new Outcome(false, roll.total(), consequence, details);
    }

    private void apply(Campaign campaign, Army army, MoraleConsequence consequence, String context,
                       RollService rolls, Map<String, Object> details) {
        RulesConfig.MoraleCheck config = rules.morale().check();
        List<Detachment> detachments = army.getDetachments();
        switch (consequence) {
            case MUTINY: {
                List<Detachment> defecting = new ArrayList<>();
                for (Detachment detachment : detachments) {
                    if (rolls.roll(context + ":mutiny:" + detachment.getId(), 1, 20, null).total()
                            <= config.mutinyDefectChance()) {
                        defecting.add(detachment);
                    }
                }
                detachments.removeAll(defecting);
                details.put("defected_detachment_ids", ids(defecting));
                break;
            }
            case MASS_DESERTION:
                desert(army, config.massDesertionPercent(), details);
                break;
            case DETACHMENTS_DEFECT: {
                int count = rolls.d6(context + ":defect-count", null).total();
                List<Detachment> defecting = pick(detachments, Math.min(count, detachments.size() - 1),
                        context + ":defect", rolls);
                detachments.removeAll(defecting);
                details.put("defected_detachment_ids", ids(defecting));
                break;
            }
            case MAJOR_DESERTION:
                desert(army, config.majorDesertionPercent(), details);
                break;
            case ARMY_SPLITS:
                split(campaign, army, context, rolls, details);
                break;
            case DETACHMENT_DEFECTS: {
                List<Detachment> defecting = pick(detachments, detachments.size() > 1 ? 1 : 0,
                        context + ":defect", rolls);
                detachments.removeAll(defecting);
                details.put("defected_detachment_ids", ids(defecting));
                break;
            }
            case DESERTION:
                desert(army, config.desertionPercent(), details);
                break;
            case DETACHMENTS_DEPART: {
                int count = rolls.d6(context + ":depart-count", null).total();
                int days = rolls.twoD6(context + ":depart-days", null).total();
                depart(army, pick(detachments, Math.min(count, detachments.size() - 1), context + ":depart", rolls),
                        days, rolls, details);
                break;
            }
            case CAMP_FOLLOWERS: {
                int increase = army.getNoncombatants() * config.campFollowerPercent() / 100;
                army.setNoncombatants(army.getNoncombatants() + increase);
                details.put("noncombatant_increase", increase);
                break;
            }
            case DETACHMENT_DEPARTS: {
                int days = rolls.twoD6(context + ":depart-days", null).total();
                depart(army, pick(detachments, detachments.size() > 1 ? 1 : 0, context + ":depart", rolls),
                        days, rolls, details);
                break;
            }
            case NO_CONSEQUENCE:
            default:
                break;
        }
    }

    private void desert(Army army, int percent, Map<String, Object> details) {
        int lost = 0;
        for (Detachment detachment : army.getDetachments()) {
            int before = detachment.getSoldiers();
            if (before == 0) {
                continue;
            }
            int after = Math.max(1, before * (100 - percent) / 100);
            detachment.setSoldiers(after);
            lost += before - after;
        }
        int supplies = army.getSuppliesCurrent();
        army.setSuppliesCurrent(supplies * (100 - percent) / 100);
        details.put("soldiers_lost", lost);
        details.put("supplies_lost", supplies - army.getSuppliesCurrent());
    }

    /**
     * Detachments that throw a low enough d6 follow a new leader; at least one stays.
     * The leaderless splinter army takes its share of the supplies.
     */
    private void split(Campaign campaign, Army army, String context, RollService rolls, Map<String, Object> details) {
        List<Detachment> splitting = new ArrayList<>();
        for (Detachment detachment : army.getDetachments()) {
            Roll roll = rolls.d6(context + ":split:" + detachment.getId(), null);
            if (roll.total() <= rules.morale().check().splitChance()) {
                splitting.add(detachment);
            }
        }
        if (!splitting.isEmpty() && splitting.size() >= army.getDetachments().size()) {
            splitting.remove(splitting.size() - 1);
        }
        if (splitting.isEmpty() || army.isEmbarked()) {
            details.put("split_detachment_ids", List.of());
            return;
        }
        int soldiers = army.getSoldiers();
        int splitSoldiers = splitting.stream().mapToInt(Detachment::getSoldiers).sum();
        army.getDetachments().removeAll(splitting);

        Army splinter = new Army(campaign.allocateId(), null, army.getLocationHexId());
        splinter.getDetachments().addAll(splitting);
        splinter.setMoraleMax(army.getMoraleMax());
        splinter.setMoraleResting(army.getMoraleResting());
        splinter.setMoraleCurrent(army.getMoraleCurrent());
        splinter.setMovementPointsRemaining(army.getMovementPointsRemaining());
        splinter.setSuppliesCapacity(math.capacity(campaign, splinter));
        int share = soldiers == 0 ? 0 : (int) ((long) army.getSuppliesCurrent() * splitSoldiers / soldiers);
        int taken = splinter.addSupplies(share);
        army.setSuppliesCurrent(army.getSuppliesCurrent() - taken);
        campaign.addArmy(splinter);

        details.put("split_detachment_ids", ids(splitting));
        details.put("splinter_army_id", splinter.getId());
    }

    private void depart(Army army, List<Detachment> departing, int days, RollService rolls,
                        Map<String, Object> details) {
        details.put("departed_detachment_ids", ids(departing));
        if (departing.isEmpty()) {
            return;
        }
        int returnDay = rolls.tick().day() + days;
        army.getDetachments().removeAll(departing);
        army.getDepartedDetachments().addAll(departing);
        Integer current = army.getDepartedReturnDay();
        army.setDepartedReturnDay(current == null ? returnDay : Math.max(current, returnDay));
        details.put("return_day", army.getDepartedReturnDay());
    }

    /**
     * Draws {@code count} distinct detachments, one die per draw sized to what is left.
     */
    private static List<Detachment> pick(List<Detachment> detachments, int count, String context, RollService rolls) {
        List<Detachment> pool = new ArrayList<>(detachments);
        List<Detachment> chosen = new ArrayList<>();
        for (int i = 0; i < count && !pool.isEmpty(); i++) {
            int index = pool.size() == 1 ? 0 : rolls.roll(context, 1, pool.size(), null).total() - 1;
            chosen.add(pool.remove(index));
        }
        return chosen;
    }

    private static List<Long> ids(List<Detachment> detachments) {
        return detachments.stream().map(Detachment::getId).collect(Collectors.toList());
    }

    /**
     * Brings departed detachments back once their return day has come.
     *
     * @return the number of detachments that returned.
     */
    public int returnDeparted(Campaign campaign, Army army, int day) {
        Integer returnDay = army.getDepartedReturnDay();
        if (returnDay == null || day < returnDay) {
            return 0;
        }
        int returned = army.getDepartedDetachments().size();
        army.getDetachments().addAll(army.getDepartedDetachments());
        army.getDepartedDetachments().clear();
        army.setDepartedReturnDay(null);
        math.refreshCapacity(campaign, army);
        LOG.debug("{} departed detachments rejoined army {} on day {}", returned, army.getId(), day);
        return returned;
    }
}
