package org.cataphract.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.cataphract.runtime.model.Operation;
import org.cataphract.runtime.model.StrongholdType;
import org.cataphract.runtime.model.TerritoryType;
import org.cataphract.runtime.model.Weather;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the rule constants under {@code cataphract.rules} and the tick
 * settings under {@code cataphract.tick}.
 * <p>
 * All numeric balancing lives here; the resolvers hold no magic numbers of their own.
 */
public final class RulesConfig {

    public record Movement(double pointsPerDay, double offRoadFactor, double nightFactor, double forcedMarchFactor,
                           int forcedMarchMoraleLoss, double longColumnFactor, double longColumnMiles,
                           int infantryPerColumnMile, int cavalryPerColumnMile, int wagonsPerColumnMile,
                           double fordDaysPerColumnMile, double minFordDays, double supplyPerMilePerThousand,
                           int forkBaseChance, int forkOffRoadBonus, int forkNightBonus,
                           Map<Weather, Double> weatherFactors) {

        public double weatherFactor(Weather weather) {
            return weatherFactors.getOrDefault(weather, 1.0);
        }
    }

    public record Supply(int infantryCapacity, int cavalryCapacity, int wagonCapacity, int infantryConsumption,
                         int cavalryConsumption, int wagonConsumption, double noncombatantRatio,
                         int forageYieldPerSettlement, int forageUsesPerSeason, int forageRadius,
                         int cavalryRadiusBonus, int torchDurationDays, int startingSupplyDays) {
    }

    public record Morale(int resting, int max, int routThreshold, int starvationLoss,
                         int starvationDissolutionDays, int restRecoveryPerDay, MoraleCheck check) {
    }

    /**
     * Consequences of a failed 2d6 morale check.
     *
     * @param mutinyDefectChance     Each detachment of a mutinous army defects on a d20 at or below this.
     * @param massDesertionPercent   Soldiers and supplies lost to mass desertion.
     * @param majorDesertionPercent  Soldiers and supplies lost to major desertion.
     * @param desertionPercent       Soldiers and supplies lost to desertion.
     * @param splitChance            Each detachment follows a split on a d6 at or below this.
     * @param campFollowerPercent    Growth of the camp followers.
     */
    public record MoraleCheck(int mutinyDefectChance, int massDesertionPercent, int majorDesertionPercent,
                              int desertionPercent, int splitChance, int campFollowerPercent) {
    }

    /**
     * One row of the battle table, used when the winning margin is at least {@code minDifference}.
     */
    public record CasualtyBand(int minDifference, int winnerCasualtyPercent, int loserCasualtyPercent,
                               int winnerMoraleChange, int loserMoraleChange, int commanderCaptureChance) {
    }

    public record Combat(int assaultPenalty, int numericAdvantageCap, int moraleBonusCap, int moraleNeutral,
                         int loserCasualtyPercent, int pillageMoraleGain, int commanderEscapeChance,
                         int cavalryStrengthMultiplier, int retreatHexesMax, int retreatSupplyLossDie,
                         int retreatSupplyLossMultiplier, List<CasualtyBand> casualtyBands,
                         Map<StrongholdType, Integer> defensiveBonus) {

        /**
         * @param difference Winning margin, not negative.
         * @return the band with the highest minimum the margin reaches.
         */
        public CasualtyBand bandFor(int difference) {
            CasualtyBand result = casualtyBands.get(0);
            for (CasualtyBand band : casualtyBands) {
                if (difference >= band.minDifference() && band.minDifference() >= result.minDifference()) {
                    result = band;
                }
            }
            return result;
        }
    }

    public record Siege(int baseReduction, int reductionPerEngine, int soldiersPerReductionPoint,
                        int maxSiegeEngines, Map<StrongholdType, Integer> thresholds) {
    }

    public record Harry(int baseChance, int skirmisherBonus, int cavalryBonus, int killPercent,
                        int failureLossPercent, int maxDistance) {
    }

    public record Messaging(double milesPerHex, Map<TerritoryType, Double> speed,
                            Map<TerritoryType, Integer> interceptionDie) {
    }

    public record Naval(double milesPerDay, double milesPerHex) {
    }

    public record Operations(int baseTarget, int defaultLootCost, int complexStages, int sabotageThresholdDamage,
                             Map<Operation.Complexity, Integer> complexityModifier,
                             Map<TerritoryType, Integer> territoryModifier) {
    }

    public record Recruitment(int musterDays, Map<StrongholdType, Integer> progressPerPart) {
    }

    public record Mercenary(int infantryRate, int cavalryRate, int graceDays, int unpaidMoraleLoss,
                            int desertionChance) {
    }

    private final boolean allowFixedRolls;
    private final List<String> upkeepSteps;
    private final int daysPerSeason;
    private final Movement movement;
    private final Supply supply;
    private final Morale morale;
    private final Combat combat;
    private final Siege siege;
    private final Harry harry;
    private final Messaging messaging;
    private final Naval naval;
    private final Operations operations;
    private final Recruitment recruitment;
    private final Mercenary mercenary;

    private RulesConfig(Config root) {
        Config tick = root.getConfig("cataphract.tick");
        Config rules = root.getConfig("cataphract.rules");
        this.allowFixedRolls = rules.getBoolean("allow-fixed-rolls");
        this.upkeepSteps = List.copyOf(tick.getStringList("upkeep-steps"));
        this.daysPerSeason = tick.getInt("days-per-season");

        Config m = rules.getConfig("movement");
        this.movement = new Movement(
                m.getDouble("points-per-day"),
                m.getDouble("off-road-factor"),
                m.getDouble("night-factor"),
                m.getDouble("forced-march-factor"),
                m.getInt("forced-march-morale-loss"),
                m.getDouble("long-column-factor"),
                m.getDouble("long-column-miles"),
                m.getInt("infantry-per-column-mile"),
                m.getInt("cavalry-per-column-mile"),
                m.getInt("wagons-per-column-mile"),
                m.getDouble("ford-days-per-column-mile"),
                m.getDouble("min-ford-days"),
                m.getDouble("supply-per-mile-per-thousand"),
                m.getInt("fork-base-chance"),
                m.getInt("fork-off-road-bonus"),
                m.getInt("fork-night-bonus"),
                doubleMap(m.getConfig("weather"), Weather.class));

        Config s = rules.getConfig("supply");
        this.supply = new Supply(
                s.getInt("infantry-capacity"),
                s.getInt("cavalry-capacity"),
                s.getInt("wagon-capacity"),
                s.getInt("infantry-consumption"),
                s.getInt("cavalry-consumption"),
                s.getInt("wagon-consumption"),
                s.getDouble("noncombatant-ratio"),
                s.getInt("forage-yield-per-settlement"),
                s.getInt("forage-uses-per-season"),
                s.getInt("forage-radius"),
                s.getInt("cavalry-radius-bonus"),
                s.getInt("torch-duration-days"),
                s.getInt("starting-supply-days"));

        Config mo = rules.getConfig("morale");
        this.morale = new Morale(
                mo.getInt("resting"),
                mo.getInt("max"),
                mo.getInt("rout-threshold"),
                mo.getInt("starvation-loss"),
                mo.getInt("starvation-dissolution-days"),
                mo.getInt("rest-recovery-per-day"),
                new MoraleCheck(
                        mo.getInt("check.mutiny-defect-chance"),
                        mo.getInt("check.mass-desertion-percent"),
                        mo.getInt("check.major-desertion-percent"),
                        mo.getInt("check.desertion-percent"),
                        mo.getInt("check.split-chance"),
                        mo.getInt("check.camp-follower-percent")));

        Config c = rules.getConfig("combat");
        this.combat = new Combat(
                c.getInt("assault-penalty"),
                c.getInt("numeric-advantage-cap"),
                c.getInt("morale-bonus-cap"),
                c.getInt("morale-neutral"),
                c.getInt("loser-casualty-percent"),
                c.getInt("pillage-morale-gain"),
                c.getInt("commander-escape-chance"),
                c.getInt("cavalry-strength-multiplier"),
                c.getInt("retreat-hexes-max"),
                c.getInt("retreat-supply-loss-die"),
                c.getInt("retreat-supply-loss-multiplier"),
                casualtyBands(c.getConfigList("casualty-table")),
                intMap(c.getConfig("defensive-bonus"), StrongholdType.class));

        Config si = rules.getConfig("siege");
        this.siege = new Siege(
                si.getInt("base-reduction"),
                si.getInt("reduction-per-engine"),
                si.getInt("soldiers-per-reduction-point"),
                si.getInt("max-siege-engines"),
                intMap(si.getConfig("thresholds"), StrongholdType.class));

        Config h = rules.getConfig("harry");
        this.harry = new Harry(
                h.getInt("base-chance"),
                h.getInt("skirmisher-bonus"),
                h.getInt("cavalry-bonus"),
                h.getInt("kill-percent"),
                h.getInt("failure-loss-percent"),
                h.getInt("max-distance"));

        Config me = rules.getConfig("messaging");
        this.messaging = new Messaging(
                me.getDouble("miles-per-hex"),
                doubleMap(me.getConfig("speed"), TerritoryType.class),
                intMap(me.getConfig("interception-die"), TerritoryType.class));

        Config n = rules.getConfig("naval");
        this.naval = new Naval(n.getDouble("miles-per-day"), n.getDouble("miles-per-hex"));

        Config o = rules.getConfig("operations");
        this.operations = new Operations(
                o.getInt("base-target"),
                o.getInt("default-loot-cost"),
                o.getInt("complex-stages"),
                o.getInt("sabotage-threshold-damage"),
                intMap(o.getConfig("complexity-modifier"), Operation.Complexity.class),
                intMap(o.getConfig("territory-modifier"), TerritoryType.class));

        Config r = rules.getConfig("recruitment");
        this.recruitment = new Recruitment(
                r.getInt("muster-days"),
                intMap(r.getConfig("progress-per-part"), StrongholdType.class));

        Config mc = rules.getConfig("mercenary");
        this.mercenary = new Mercenary(
                mc.getInt("infantry-rate"),
                mc.getInt("cavalry-rate"),
                mc.getInt("grace-days"),
                mc.getInt("unpaid-morale-loss"),
                mc.getInt("desertion-chance"));
    }

    /**
     * Binds the rule constants of a resolved configuration.
     *
     * @param config Root configuration containing the {@code cataphract} block.
     * @return the typed rules.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static RulesConfig fromConfig(Config config) {
        return new RulesConfig(config);
    }

    /**
     * @return the rules from reference.conf alone.
     */
    public static RulesConfig defaults() {
        return new RulesConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    private static List<CasualtyBand> casualtyBands(List<? extends Config> rows) {
        if (rows.isEmpty()) {
            throw new ConfigException.BadValue("cataphract.rules.combat.casualty-table", "needs at least one row");
        }
        List<CasualtyBand> bands = new ArrayList<>();
        for (Config row : rows) {
            bands.add(new CasualtyBand(
                    row.getInt("min-difference"),
                    row.getInt("winner-casualty-percent"),
                    row.getInt("loser-casualty-percent"),
                    row.getInt("winner-morale"),
                    row.getInt("loser-morale"),
                    row.getInt("commander-capture-chance")));
        }
        return List.copyOf(bands);
    }

    private static <E extends Enum<E>> Map<E, Integer> intMap(Config block, Class<E> type) {
        Map<E, Integer> result = new EnumMap<>(type);
        for (E key : type.getEnumConstants()) {
            result.put(key, block.getInt(configKey(key)));
        }
        return result;
    }

    private static <E extends Enum<E>> Map<E, Double> doubleMap(Config block, Class<E> type) {
        Map<E, Double> result = new EnumMap<>(type);
        for (E key : type.getEnumConstants()) {
            result.put(key, block.getDouble(configKey(key)));
        }
        return result;
    }

    private static String configKey(Enum<?> key) {
        return key.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public boolean allowFixedRolls() {
        return allowFixedRolls;
    }

    public List<String> upkeepSteps() {
        return upkeepSteps;
    }

    public int daysPerSeason() {
        return daysPerSeason;
    }

    public Movement movement() {
        return movement;
    }

    public Supply supply() {
        return supply;
    }

    public Morale morale() {
        return morale;
    }

    public Combat combat() {
        return combat;
    }

    public Siege siege() {
        return siege;
    }

    public Harry harry() {
        return harry;
    }

    public Messaging messaging() {
        return messaging;
    }

    public Naval naval() {
        return naval;
    }

    public Operations operations() {
        return operations;
    }

    public Recruitment recruitment() {
        return recruitment;
    }

    public Mercenary mercenary() {
        return mercenary;
    }
}
