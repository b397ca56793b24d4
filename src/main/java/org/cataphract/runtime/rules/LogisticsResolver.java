package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidRouteException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.map.Hex;
import org.cataphract.runtime.map.MapGraph;
import org.cataphract.runtime.map.Road;
import org.cataphract.runtime.map.RiverCrossing;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Movement, foraging, torching, resting, supply transfers and the supply drain
 * of armies in the field.
 * <p>
 * Movement points are miles at ordinary road pace. A leg costs its distance
 * divided by the product of the road, night, weather, forced-march and column
 * factors; fording adds the time the infantry column needs to cross. Running out
 * of points or supplies stops the army at the last hex it could afford, which is
 * a partial completion rather than a failure.
 */
public class LogisticsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LogisticsResolver.class);
    private static final double EPSILON = 1e-9;

    private final RulesConfig rules;
    private final ArmyMath math;
    private final MoraleCheckResolver morale;

    public LogisticsResolver(RulesConfig rules, ArmyMath math) {
        this(rules, math, new MoraleCheckResolver(rules, math));
    }

    public LogisticsResolver(RulesConfig rules, ArmyMath math, MoraleCheckResolver morale) {
        this.rules = rules;
        this.math = math;
        this.morale = morale;
    }

    /**
     * Marches an army along the given legs.
     *
     * @throws InvalidRouteException if any leg is impossible on the map.
     * @throws InvalidStateException if the army cannot march at all.
     */
    public OrderResult resolveMove(Campaign campaign, Army army, OrderParameters.Move move, RollService rolls,
                                   String subject) throws InvalidRouteException, InvalidStateException {
        if (army.isEmbarked()) {
            throw new InvalidStateException("Army " + army.getId() + " is embarked and cannot march");
        }
        if (army.isRouted()) {
            throw new InvalidStateException("Army " + army.getId() + " is routed and cannot march");
        }
        validateRoute(campaign.getMap(), army, move.legs());

        RulesConfig.Movement movement = rules.movement();
        double columnMiles = math.columnLengthMiles(campaign, army);
        int headcount = math.columnHeadcount(army);
        double pointsBefore = army.getMovementPointsRemaining();
        int suppliesBefore = army.getSuppliesCurrent();

        double points = pointsBefore;
        int legsCompleted = 0;
        double milesMarched = 0.0;
        String stopReason = null;
        List<Long> path = new ArrayList<>();
        for (int i = 0; i < move.legs().size(); i++) {
            OrderParameters.Leg leg = move.legs().get(i);
            long from = army.getLocationHexId();
            double cost = leg.distanceMiles() / speedFactor(campaign, from, leg, move.forcedMarch(), columnMiles);
            if (leg.hasRiverFord()) {
                cost += fordingDays(campaign, army) * movement.pointsPerDay();
            }
            int supplyCost = supplyCost(leg.distanceMiles(), headcount);
            if (cost > points + EPSILON) {
                stopReason = "movement_points";
                break;
            }
            if (supplyCost > army.getSuppliesCurrent()) {
                stopReason = "supplies";
                break;
            }
            points -= cost;
            army.setSuppliesCurrent(army.getSuppliesCurrent() - supplyCost);
            milesMarched += leg.distanceMiles();

            long destination = leg.toHexId();
            if (leg.hasFork()) {
                int chance = movement.forkBaseChance()
                        + (leg.onRoad() ? 0 : movement.forkOffRoadBonus())
                        + (leg.isNight() ? movement.forkNightBonus() : 0);
                Roll roll = rolls.d6("move:" + army.getId() + ":fork:" + i, leg.forkFixedRoll());
                if (roll.total() <= chance) {
                    destination = leg.alternateHexId();
                    stopReason = "misdirected";
                }
            }
            army.setLocationHexId(destination);
            path.add(destination);
            legsCompleted++;
            if (stopReason != null) {
                break;
            }
        }

        army.setMovementPointsRemaining(points);
        if (legsCompleted > 0) {
            army.setStatus(Army.Status.MARCHING);
            army.setRestUntilDay(null);
            if (move.forcedMarch()) {
                army.setMoraleCurrent(army.getMoraleCurrent() - movement.forcedMarchMoraleLoss());
            }
        }
        followArmy(campaign, army);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("legs_requested", move.legs().size());
        inputs.put("legs_completed", legsCompleted);
        inputs.put("forced_march", move.forcedMarch());
        inputs.put("weather", campaign.getWeather().name());
        inputs.put("column_miles", columnMiles);
        inputs.put("points_before", pointsBefore);
        inputs.put("points_after", points);
        inputs.put("supplies_spent", suppliesBefore - army.getSuppliesCurrent());
        String effect = "army " + army.getId() + " marched " + milesMarched + " miles to hex " + army.getLocationHexId()
                + (stopReason == null ? "" : " (stopped: " + stopReason + ")");
        rolls.audit(AuditSubsystem.MOVEMENT, subject, inputs, effect);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("final_hex_id", army.getLocationHexId());
        details.put("legs_completed", legsCompleted);
        details.put("path", path);
        details.put("miles", milesMarched);
        details.put("movement_points_remaining", points);
        details.put("supplies_remaining", army.getSuppliesCurrent());
        if (stopReason == null) {
            return OrderResult.completed(effect, details);
        }
        details.put("stop_reason", stopReason);
        return OrderResult.partial(effect, details);
    }

    private void validateRoute(MapGraph map, Army army, List<OrderParameters.Leg> legs) throws InvalidRouteException {
        boolean hasWagons = army.getWagons() > 0;
        long previous = army.getLocationHexId();
        for (int i = 0; i < legs.size(); i++) {
            OrderParameters.Leg leg = legs.get(i);
            long to = leg.toHexId();
            Optional<Hex> hex = map.findHex(to);
            if (hex.isEmpty()) {
                throw new InvalidRouteException("Leg " + i + ": hex " + to + " does not exist");
            }
            if (!hex.get().getTerrain().isLand()) {
                throw new InvalidRouteException("Leg " + i + ": hex " + to + " is open water");
            }
            if (leg.onRoad() && map.findRoad(previous, to).isEmpty()) {
                throw new InvalidRouteException("Leg " + i + ": no road between hex " + previous + " and hex " + to);
            }
            if (leg.hasRiverFord() && map.findCrossing(previous, to, RiverCrossing.Kind.FORD).isEmpty()) {
                throw new InvalidRouteException("Leg " + i + ": no ford between hex " + previous + " and hex " + to);
            }
            if (hasWagons && !leg.onRoad()) {
                throw new InvalidRouteException("Leg " + i + ": wagons cannot travel off-road");
            }
            if (hasWagons && leg.hasRiverFord()) {
                throw new InvalidRouteException("Leg " + i + ": wagons cannot ford a river");
            }
            if (leg.hasFork() && (leg.alternateHexId() == null || !map.hasHex(leg.alternateHexId()))) {
                throw new InvalidRouteException("Leg " + i + ": alternate hex " + leg.alternateHexId() + " does not exist");
            }
            previous = to;
        }
    }

    private double speedFactor(Campaign campaign, long from, OrderParameters.Leg leg, boolean forced,
                               double columnMiles) {
        RulesConfig.Movement movement = rules.movement();
        double factor;
        if (leg.onRoad()) {
            factor = campaign.getMap().findRoad(from, leg.toHexId()).map(Road::costModifier).orElse(1.0);
        } else {
            factor = movement.offRoadFactor();
        }
        if (leg.isNight()) {
            factor *= movement.nightFactor();
        }
        factor *= movement.weatherFactor(campaign.getWeather());
        if (forced) {
            factor *= movement.forcedMarchFactor();
        }
        if (columnMiles > movement.longColumnMiles()) {
            factor *= movement.longColumnFactor();
        }
        return factor;
    }

    private double fordingDays(Campaign campaign, Army army) {
        RulesConfig.Movement movement = rules.movement();
        double infantryMiles = (double) (math.infantry(campaign, army.getDetachments()) + army.getNoncombatants())
                / movement.infantryPerColumnMile();
        return Math.max(movement.minFordDays(), infantryMiles * movement.fordDaysPerColumnMile());
    }

    private int supplyCost(double miles, int headcount) {
        return (int) Math.ceil(miles * headcount * rules.movement().supplyPerMilePerThousand() / 1000.0);
    }

    /**
     * @return how far from its hex the army can forage or torch.
     */
    public int supplyRadius(Campaign campaign, Army army) {
        RulesConfig.Supply supply = rules.supply();
        return supply.forageRadius() + (math.hasCavalry(campaign, army) ? supply.cavalryRadiusBonus() : 0);
    }

    private List<Hex> hexesInRadius(Campaign campaign, Army army, List<Long> hexIds) throws InvalidRouteException {
        MapGraph map = campaign.getMap();
        int radius = supplyRadius(campaign, army);
        List<Hex> result = new ArrayList<>();
        for (long hexId : new LinkedHashSet<>(hexIds)) {
            Optional<Hex> hex = map.findHex(hexId);
            if (hex.isEmpty()) {
                throw new InvalidRouteException("Hex " + hexId + " does not exist");
            }
            if (map.distance(army.getLocationHexId(), hexId) > radius) {
                throw new InvalidRouteException("Hex " + hexId + " is outside the supply radius " + radius
                        + " of army " + army.getId());
            }
            result.add(hex.get());
        }
        return result;
    }

    /**
     * Gathers supplies from the given hexes, up to the army's capacity.
     */
    public OrderResult resolveForage(Campaign campaign, Army army, OrderParameters.Forage forage, RollService rolls,
                                     String subject) throws InvalidRouteException, InvalidStateException {
        requireInField(army);
        List<Hex> hexes = hexesInRadius(campaign, army, forage.hexIds());
        int day = campaign.getCurrentDay();
        int gathered = 0;
        Map<String, Object> yields = new LinkedHashMap<>();
        for (Hex hex : hexes) {
            int yield = 0;
            if (!hex.isTorchedOn(day) && hex.getForagingUsesRemaining() > 0) {
                yield = hex.getSettlement() * rules.supply().forageYieldPerSettlement();
                hex.setForagingUsesRemaining(hex.getForagingUsesRemaining() - 1);
            }
            yields.put(String.valueOf(hex.getId()), yield);
            gathered += yield;
        }
        int taken = army.addSupplies(gathered);
        army.setStatus(Army.Status.FORAGING);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("radius", supplyRadius(campaign, army));
        inputs.put("yields", yields);
        String effect = "army " + army.getId() + " foraged " + taken + " supplies (" + gathered + " available)";
        rolls.audit(AuditSubsystem.LOGISTICS, subject, inputs, effect);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gathered", gathered);
        details.put("taken", taken);
        details.put("supplies", army.getSuppliesCurrent());
        return OrderResult.completed(effect, details);
    }

    /**
     * Burns the countryside so it yields nothing for the configured number of days.
     */
    public OrderResult resolveTorch(Campaign campaign, Army army, OrderParameters.Torch torch, RollService rolls,
                                    String subject) throws InvalidRouteException, InvalidStateException {
        requireInField(army);
        List<Hex> hexes = hexesInRadius(campaign, army, torch.hexIds());
        int until = campaign.getCurrentDay() + rules.supply().torchDurationDays();
        List<Long> burned = new ArrayList<>();
        for (Hex hex : hexes) {
            hex.setTorchedUntilDay(until);
            burned.add(hex.getId());
        }
        army.setStatus(Army.Status.TORCHING);

        String effect = "army " + army.getId() + " torched hexes " + burned + " until day " + until;
        rolls.audit(AuditSubsystem.LOGISTICS, subject, Map.of("radius", supplyRadius(campaign, army)), effect);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("hex_ids", burned);
        details.put("torched_until_day", until);
        return OrderResult.completed(effect, details);
    }

    /**
     * Puts the army in camp for the given number of days. A harried army cannot rest that day.
     */
    public OrderResult resolveRest(Campaign campaign, Army army, OrderParameters.Rest rest, RollService rolls,
                                   String subject) throws InvalidStateException {
        requireInField(army);
        int day = campaign.getCurrentDay();
        if (army.getHarriedOnDay() != null && army.getHarriedOnDay() == day) {
            throw new InvalidStateException("Army " + army.getId() + " was harried today and cannot rest");
        }
        army.setStatus(Army.Status.RESTING);
        army.setRestUntilDay(day + rest.days());

        String effect = "army " + army.getId() + " rests until day " + (day + rest.days());
        rolls.audit(AuditSubsystem.LOGISTICS, subject, Map.of("days", rest.days()), effect);
        return OrderResult.completed(effect, Map.of("rest_until_day", day + rest.days()));
    }

    /**
     * Hands supplies to another army on the same hex, limited by what the receiver can carry.
     */
    public OrderResult resolveSupplyTransfer(Campaign campaign, Army army, OrderParameters.SupplyTransfer transfer,
                                             RollService rolls, String subject)
            throws InvalidRouteException, InvalidStateException, NotFoundException {
        Army target = campaign.requireArmy(transfer.targetArmyId());
        if (target.getId() == army.getId()) {
            throw new InvalidStateException("Army " + army.getId() + " cannot transfer supplies to itself");
        }
        if (target.getLocationHexId() != army.getLocationHexId()) {
            throw new InvalidRouteException("Armies " + army.getId() + " and " + target.getId() + " are not on the same hex");
        }
        int offered = Math.min(transfer.amount(), army.getSuppliesCurrent());
        int moved = target.addSupplies(offered);
        army.setSuppliesCurrent(army.getSuppliesCurrent() - moved);

        String effect = "army " + army.getId() + " transferred " + moved + " supplies to army " + target.getId();
        rolls.audit(AuditSubsystem.LOGISTICS, subject, Map.of("requested", transfer.amount()), effect);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transferred", moved);
        details.put("requested", transfer.amount());
        return moved < transfer.amount()
                ? OrderResult.partial(effect, details)
                : OrderResult.completed(effect, details);
    }

    /**
     * Eats one day-part's share of the army's daily consumption. The four shares of
     * a day add up to exactly the daily figure. At night, an army without supplies
     * starves: it loses morale, takes a morale check and eventually breaks.
     */
    public void drainSupplies(Campaign campaign, Army army, RollService rolls) {
        Tick tick = rolls.tick();
        long daily = math.dailyConsumption(campaign, army);
        int part = tick.part().ordinal();
        int slice = (int) (daily * (part + 1) / Tick.PARTS_PER_DAY - daily * part / Tick.PARTS_PER_DAY);
        army.setSuppliesCurrent(Math.max(0, army.getSuppliesCurrent() - slice));

        if (tick.part() != DayPart.NIGHT) {
            return;
        }
        if (army.getSuppliesCurrent() > 0 || daily == 0) {
            army.setDaysWithoutSupplies(0);
            return;
        }
        RulesConfig.Morale config = rules.morale();
        army.setDaysWithoutSupplies(army.getDaysWithoutSupplies() + 1);
        army.setMoraleCurrent(army.getMoraleCurrent() - config.starvationLoss());
        String effect = "army " + army.getId() + " starving for " + army.getDaysWithoutSupplies() + " days, morale "
                + army.getMoraleCurrent();
        if (!army.isRouted() && (army.getDaysWithoutSupplies() >= config.starvationDissolutionDays()
                || army.getMoraleCurrent() <= config.routThreshold())) {
            army.setStatus(Army.Status.ROUTED);
            effect += ", army routed";
            LOG.info("Army {} routed from starvation on {}", army.getId(), tick);
        }
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("daily_consumption", daily);
        inputs.put("days_without_supplies", army.getDaysWithoutSupplies());
        rolls.audit(AuditSubsystem.SUPPLY, "army:" + army.getId(), inputs, effect);
        if (!army.isRouted()) {
            morale.check(campaign, army, "starvation", rolls);
        }
    }

    private void requireInField(Army army) throws InvalidStateException {
        if (army.isEmbarked()) {
            throw new InvalidStateException("Army " + army.getId() + " is embarked");
        }
    }

    private void followArmy(Campaign campaign, Army army) {
        if (army.getCommanderId() != null) {
            Commander commander = campaign.getCommanders().get(army.getCommanderId());
            if (commander != null) {
                commander.setCurrentHexId(army.getLocationHexId());
            }
        }
    }
}
