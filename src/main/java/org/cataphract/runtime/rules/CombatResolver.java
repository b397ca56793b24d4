package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidRouteException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.map.MapGraph;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.Siege;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sieges and assaults on strongholds.
 * <p>
 * A siege wears the stronghold's threshold down every day-part; the stronghold
 * falls when the threshold reaches zero. An assault settles the matter at once
 * with one 2d6 roll per side. Ties go to the defender. Both sides of an assault
 * pay in soldiers and morale by the winning margin, read off the battle table.
 */
public class CombatResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CombatResolver.class);

    private final RulesConfig rules;
    private final ArmyMath math;
    private final MoraleCheckResolver morale;

    public CombatResolver(RulesConfig rules, ArmyMath math) {
        this(rules, math, new MoraleCheckResolver(rules, math));
    }

    public CombatResolver(RulesConfig rules, ArmyMath math, MoraleCheckResolver morale) {
        this.rules = rules;
        this.math = math;
        this.morale = morale;
    }

    /**
     * Starts a siege of the stronghold, or joins the one already under way.
     */
    public OrderResult resolveBesiege(Campaign campaign, Army army, OrderParameters.Besiege besiege, RollService rolls,
                                      String subject) throws InvalidRouteException, InvalidStateException {
        Stronghold stronghold = campaign.getStrongholds().get(besiege.strongholdId());
        if (stronghold == null) {
            throw new InvalidStateException("Stronghold " + besiege.strongholdId() + " no longer exists");
        }
        requireHostileAndAdjacent(campaign, army, stronghold);

        Optional<Siege> existing = campaign.findActiveSiege(stronghold.getId());
        Siege siege;
        if (existing.isPresent()) {
            siege = existing.get();
        } else {
            siege = new Siege(campaign.allocateId(), stronghold.getId(), rolls.tick());
            campaign.addSiege(siege);
        }
        if (!siege.getBesiegingArmyIds().contains(army.getId())) {
            siege.getBesiegingArmyIds().add(army.getId());
        }
        long engines = (long) siege.getSiegeEngines() + Math.max(0, besiege.siegeEngines());
        siege.setSiegeEngines((int) Math.min(rules.siege().maxSiegeEngines(), engines));
        siege.setReductionPerPart(reductionPerPart(campaign, siege));
        army.setStatus(Army.Status.BESIEGING);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("siege_engines", siege.getSiegeEngines());
        inputs.put("besieging_armies", List.copyOf(siege.getBesiegingArmyIds()));
        inputs.put("threshold", stronghold.getCurrentThreshold());
        String effect = (existing.isPresent() ? "army " + army.getId() + " joined siege " : "army " + army.getId()
                + " began siege ") + siege.getId() + " of stronghold " + stronghold.getId()
                + ", reduction " + siege.getReductionPerPart() + " per part";
        rolls.audit(AuditSubsystem.SIEGE, subject, inputs, effect);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("siege_id", siege.getId());
        details.put("reduction_per_part", siege.getReductionPerPart());
        details.put("threshold", stronghold.getCurrentThreshold());
        return OrderResult.completed(effect, details);
    }

    /**
     * Threshold lost per day-part: a base amount, plus the engines, plus the weight
     * of the besiegers. Never less than 1.
     */
    int reductionPerPart(Campaign campaign, Siege siege) {
        RulesConfig.Siege config = rules.siege();
        long soldiers = 0;
        for (Army army : besiegers(campaign, siege)) {
            soldiers += army.getSoldiers();
        }
        long reduction = config.baseReduction()
                + (long) siege.getSiegeEngines() * config.reductionPerEngine()
                + soldiers / config.soldiersPerReductionPoint();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, reduction));
    }

    private List<Army> besiegers(Campaign campaign, Siege siege) {
        Stronghold stronghold = campaign.getStrongholds().get(siege.getStrongholdId());
        List<Army> result = new ArrayList<>();
        for (long armyId : siege.getBesiegingArmyIds()) {
            Army army = campaign.getArmies().get(armyId);
            if (army != null && !army.isRouted() && !army.isEmbarked() && stronghold != null
                    && army.getLocationHexId() == stronghold.getHexId() && army.getSoldiers() > 0) {
                result.add(army);
            }
        }
        return result;
    }

    /**
     * Advances one active siege by a day-part. A siege with no besieger left on
     * the hex is lifted and the threshold restored; otherwise the threshold drops
     * and the stronghold falls at zero.
     */
    public void advanceSiege(Campaign campaign, Siege siege, RollService rolls) {
        Stronghold stronghold = campaign.getStrongholds().get(siege.getStrongholdId());
        String subject = "siege:" + siege.getId();
        List<Army> besiegers = besiegers(campaign, siege);
        if (besiegers.isEmpty()) {
            siege.setStatus(Siege.Status.LIFTED);
            stronghold.setCurrentThreshold(stronghold.getBaseThreshold());
            rolls.audit(AuditSubsystem.SIEGE, subject, Map.of(), "siege lifted, threshold restored to "
                    + stronghold.getBaseThreshold());
            LOG.debug("Siege {} of stronghold {} lifted", siege.getId(), stronghold.getId());
            return;
        }
        int before = stronghold.getCurrentThreshold();
        int reduction = reductionPerPart(campaign, siege);
        siege.setReductionPerPart(reduction);
        int after = Math.max(0, before - reduction);
        stronghold.setCurrentThreshold(after);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("threshold_before", before);
        inputs.put("reduction", reduction);
        inputs.put("siege_engines", siege.getSiegeEngines());
        String effect = "threshold " + before + " -> " + after;
        Army leader = besiegers.get(0);
        if (after == 0) {
            effect += ", " + captureStronghold(campaign, stronghold, leader, Optional.of(siege), false, false, rolls);
        }
        rolls.audit(AuditSubsystem.SIEGE, subject, inputs, effect);
        if (after == 0) {
            morale.check(campaign, leader, "discipline", rolls);
        }
    }

    /**
     * Storms a stronghold. One roll per side (or the fixed rolls) plus the
     * modifier and the base strength of each side decide the outcome.
     */
    public OrderResult resolveAssault(Campaign campaign, Army army, OrderParameters.Assault assault, RollService rolls,
                                      String subject) throws InvalidRouteException, InvalidStateException {
        Stronghold stronghold = campaign.getStrongholds().get(assault.strongholdId());
        if (stronghold == null) {
            throw new InvalidStateException("Stronghold " + assault.strongholdId() + " no longer exists");
        }
        requireHostileAndAdjacent(campaign, army, stronghold);
        RulesConfig.Combat combat = rules.combat();
        Optional<Siege> siege = campaign.findActiveSiege(stronghold.getId());
        Army garrison = stronghold.getGarrisonArmyId() == null
                ? null : campaign.getArmies().get(stronghold.getGarrisonArmyId());

        int attackerStrength = math.strength(campaign, army);
        int defenderStrength = garrison == null ? 0 : math.strength(campaign, garrison);
        int attackerNumbers = numericAdvantage(attackerStrength, defenderStrength);
        int defenderNumbers = numericAdvantage(defenderStrength, attackerStrength);
        int attackerMorale = moraleBonus(army);
        int defenderMorale = garrison == null ? 0 : moraleBonus(garrison);
        int engines = siege.map(Siege::getSiegeEngines).orElse(0);
        int fortification = Math.max(0, stronghold.getDefensiveBonus() - engines);

        int attackerBase = attackerNumbers + attackerMorale - combat.assaultPenalty();
        int defenderBase = defenderNumbers + defenderMorale + fortification;

        Roll attackerRoll = rolls.twoD6("assault:" + stronghold.getId() + ":attacker", assault.attackerFixedRoll());
        Roll defenderRoll = rolls.twoD6("assault:" + stronghold.getId() + ":defender", assault.defenderFixedRoll());
        int attackerTotal = attackerRoll.total() + assault.attackerModifier() + attackerBase;
        int defenderTotal = defenderRoll.total() + assault.defenderModifier() + defenderBase;
        boolean captured = attackerTotal > defenderTotal;
        int difference = Math.abs(attackerTotal - defenderTotal);
        RulesConfig.CasualtyBand band = combat.bandFor(difference);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("attacker_strength", attackerStrength);
        inputs.put("defender_strength", defenderStrength);
        inputs.put("attacker_numeric_advantage", attackerNumbers);
        inputs.put("defender_numeric_advantage", defenderNumbers);
        inputs.put("attacker_morale_bonus", attackerMorale);
        inputs.put("defender_morale_bonus", defenderMorale);
        inputs.put("assault_penalty", combat.assaultPenalty());
        inputs.put("defensive_bonus", stronghold.getDefensiveBonus());
        inputs.put("siege_engines", engines);
        inputs.put("attacker_modifier", assault.attackerModifier());
        inputs.put("defender_modifier", assault.defenderModifier());
        inputs.put("attacker_total", attackerTotal);
        inputs.put("defender_total", defenderTotal);
        inputs.put("difference", difference);
        inputs.put("pillage", assault.pillage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attacker_total", attackerTotal);
        details.put("defender_total", defenderTotal);
        details.put("difference", difference);
        details.put("captured", captured);
        long battleHex = stronghold.getHexId();
        StringBuilder effect = new StringBuilder(captured ? "assault succeeded " : "assault repulsed ")
                .append(attackerTotal).append(" vs ").append(defenderTotal);
        fight(campaign, army, "attacker", captured, false, band, difference, battleHex, rolls, details, effect);
        if (garrison != null) {
            fight(campaign, garrison, "defender", !captured, captured, band, difference, battleHex, rolls, details,
                    effect);
        }
        if (captured) {
            effect.append("; ").append(captureStronghold(campaign, stronghold, army, siege, assault.pillage(), true,
                    rolls));
            details.put("controlling_faction_id", stronghold.getControllingFactionId());
        }
        rolls.audit(AuditSubsystem.COMBAT, subject, inputs, effect.toString());
        LOG.debug("Assault on stronghold {} by army {}: {}", stronghold.getId(), army.getId(), effect);
        if (captured && !assault.pillage() && !army.isRouted()) {
            MoraleCheckResolver.Outcome discipline = morale.check(campaign, army, "discipline", rolls);
            details.put("discipline_held", discipline.passed());
        }
        return OrderResult.completed(effect.toString(), details);
    }

    /**
     * Applies one side's share of the battle table: casualties and lost supplies,
     * the morale swing, a rout below the threshold and, for the loser, the chance
     * of losing its commander and a retreat away from the battle.
     *
     * @param forceRout Whether the side breaks whatever its morale, as an overrun garrison does.
     */
    private void fight(Campaign campaign, Army army, String side, boolean won, boolean forceRout,
                       RulesConfig.CasualtyBand band, int difference, long battleHex, RollService rolls,
                       Map<String, Object> details, StringBuilder effect) {
        RulesConfig.Combat combat = rules.combat();
        int percent = won ? band.winnerCasualtyPercent() : band.loserCasualtyPercent();
        int losses = math.applyPercentLosses(army.getDetachments(), percent);
        army.setSuppliesCurrent(army.getSuppliesCurrent() * (100 - percent) / 100);
        math.refreshCapacity(campaign, army);
        int moraleChange = won ? band.winnerMoraleChange() : band.loserMoraleChange();
        army.setMoraleCurrent(army.getMoraleCurrent() + moraleChange);
        details.put(side + "_losses", losses);
        details.put(side + "_morale", army.getMoraleCurrent());
        effect.append(", ").append(side).append(" lost ").append(losses).append(" soldiers, morale ")
                .append(army.getMoraleCurrent());
        if (won) {
            return;
        }

        if (!army.isRouted() && (forceRout || army.getMoraleCurrent() <= rules.morale().routThreshold())) {
            army.setStatus(Army.Status.ROUTED);
            effect.append(", ").append(side).append(" routed");
        }
        Commander commander = army.getCommanderId() == null ? null : campaign.getCommanders().get(army.getCommanderId());
        if (commander != null && commander.isActive() && band.commanderCaptureChance() > 0) {
            Roll capture = rolls.d6("battle:" + army.getId() + ":commander-capture", null);
            if (capture.total() <= band.commanderCaptureChance()) {
                commander.setStatus(Commander.Status.CAPTURED);
                army.setCommanderId(null);
                details.put(side + "_commander_captured", commander.getId());
                effect.append(", commander ").append(commander.getId()).append(" captured");
            }
        }

        int hexes = 0;
        if (army.isRouted()) {
            hexes = Math.max(1, rolls.roll("battle:" + army.getId() + ":retreat", 1, combat.retreatHexesMax(), null)
                    .total());
            int lossPercent = rolls.roll("battle:" + army.getId() + ":retreat-supplies", 1,
                    combat.retreatSupplyLossDie(), null).total() * combat.retreatSupplyLossMultiplier();
            army.setSuppliesCurrent(army.getSuppliesCurrent() * Math.max(0, 100 - lossPercent) / 100);
        } else if (difference > 0 && rolls.roll("battle:" + army.getId() + ":fallback", 1, 2, null).total() == 1) {
            hexes = 1;
        }
        if (hexes > 0) {
            long from = army.getLocationHexId();
            retreat(campaign, army, hexes, battleHex);
            if (army.getLocationHexId() != from) {
                details.put(side + "_retreat_hex_id", army.getLocationHexId());
                effect.append(", ").append(side).append(" fell back to hex ").append(army.getLocationHexId());
            }
        }
    }

    /**
     * Steps the army away from the battle, one land hex at a time, each step to the
     * neighbour farthest from the battle (lowest id on ties). Stops where no step gains distance.
     */
    private void retreat(Campaign campaign, Army army, int hexes, long battleHex) {
        if (army.isEmbarked()) {
            return;
        }
        MapGraph map = campaign.getMap();
        long current = army.getLocationHexId();
        for (int step = 0; step < hexes; step++) {
            long best = current;
            int bestDistance = map.distance(battleHex, current);
            for (long neighbor : map.neighbors(current)) {
                int distance = map.distance(battleHex, neighbor);
                if (map.getHex(neighbor).getTerrain().isLand() && distance > bestDistance) {
                    best = neighbor;
                    bestDistance = distance;
                }
            }
            if (best == current) {
                break;
            }
            current = best;
        }
        army.setLocationHexId(current);
        if (army.getCommanderId() != null) {
            Commander commander = campaign.getCommanders().get(army.getCommanderId());
            if (commander != null) {
                commander.setCurrentHexId(current);
            }
        }
    }

    private int numericAdvantage(int own, int other) {
        int cap = rules.combat().numericAdvantageCap();
        if (other <= 0) {
            return own > 0 ? cap : 0;
        }
        if (own >= 2 * other) {
            return cap;
        }
        if (2 * own >= 3 * other) {
            return Math.min(1, cap);
        }
        return 0;
    }

    private int moraleBonus(Army army) {
        RulesConfig.Combat combat = rules.combat();
        int bonus = army.getMoraleCurrent() - combat.moraleNeutral();
        return Math.max(-combat.moraleBonusCap(), Math.min(combat.moraleBonusCap(), bonus));
    }

    /**
     * Hands the stronghold to the conqueror's faction: threshold to zero, siege
     * closed, garrison broken and its commander escaping or taken, and the
     * stronghold's stores seized.
     *
     * @param garrisonFought Whether the garrison already took its losses in an assault.
     * @return a description of what happened.
     */
    String captureStronghold(Campaign campaign, Stronghold stronghold, Army conqueror, Optional<Siege> siege,
                             boolean pillage, boolean garrisonFought, RollService rolls) {
        RulesConfig.Combat combat = rules.combat();
        Long newFaction = campaign.factionOf(conqueror).orElse(null);
        stronghold.setCurrentThreshold(0);
        stronghold.setControllingFactionId(newFaction);
        siege.ifPresent(s -> s.setStatus(Siege.Status.CAPTURED));
        StringBuilder effect = new StringBuilder("stronghold " + stronghold.getId() + " captured by faction " + newFaction);

        Army garrison = stronghold.getGarrisonArmyId() == null
                ? null : campaign.getArmies().get(stronghold.getGarrisonArmyId());
        stronghold.setGarrisonArmyId(null);
        if (garrison != null && !garrisonFought) {
            int losses = math.applyPercentLosses(garrison.getDetachments(), combat.loserCasualtyPercent());
            math.refreshCapacity(campaign, garrison);
            garrison.setStatus(Army.Status.ROUTED);
            effect.append(", garrison lost ").append(losses).append(" and routed");
            Commander defender = garrison.getCommanderId() == null
                    ? null : campaign.getCommanders().get(garrison.getCommanderId());
            if (defender != null && defender.isActive()) {
                Roll escape = rolls.d6("capture:" + stronghold.getId() + ":escape", null);
                if (escape.total() <= combat.commanderEscapeChance()) {
                    effect.append(", commander ").append(defender.getId()).append(" escaped");
                } else {
                    defender.setStatus(Commander.Status.CAPTURED);
                    garrison.setCommanderId(null);
                    effect.append(", commander ").append(defender.getId()).append(" captured");
                }
            }
        }

        int seized = conqueror.addSupplies(stronghold.getSuppliesHeld());
        stronghold.setSuppliesHeld(stronghold.getSuppliesHeld() - seized);
        effect.append(", seized ").append(seized).append(" supplies");
        if (pillage) {
            int loot = stronghold.getLootHeld() / 2;
            stronghold.setLootHeld(stronghold.getLootHeld() - loot);
            conqueror.setLootCarried(conqueror.getLootCarried() + loot);
            int supplies = conqueror.addSupplies(stronghold.getSuppliesHeld() / 2);
            stronghold.setSuppliesHeld(stronghold.getSuppliesHeld() - supplies);
            conqueror.setMoraleCurrent(conqueror.getMoraleCurrent() + combat.pillageMoraleGain());
            effect.append(", pillaged ").append(loot).append(" loot");
        }
        LOG.info("Stronghold {} captured by army {} on {}", stronghold.getId(), conqueror.getId(), rolls.tick());
        return effect.toString();
    }

    private void requireHostileAndAdjacent(Campaign campaign, Army army, Stronghold stronghold)
            throws InvalidRouteException, InvalidStateException {
        Optional<Long> faction = campaign.factionOf(army);
        if (faction.isPresent() && stronghold.isControlledBy(faction.get())) {
            throw new InvalidStateException("Stronghold " + stronghold.getId() + " is held by the army's own faction");
        }
        if (army.isEmbarked() || army.getLocationHexId() != stronghold.getHexId()) {
            throw new InvalidRouteException("Army " + army.getId() + " is not at stronghold " + stronghold.getId());
        }
        if (army.isRouted()) {
            throw new InvalidStateException("Army " + army.getId() + " is routed");
        }
    }
}
