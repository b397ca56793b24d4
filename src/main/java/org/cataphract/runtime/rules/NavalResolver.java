package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidRouteException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.map.MapGraph;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.Ship;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embarkation and sea movement. A ship carries one army whose troops and camp
 * followers fit its capacity, and sails hex by hex over water and coast.
 */
public class NavalResolver {

    private final RulesConfig rules;

    public NavalResolver(RulesConfig rules) {
        this.rules = rules;
    }

    public OrderResult resolveEmbark(Campaign campaign, Army army, OrderParameters.Embark embark, RollService rolls,
                                     String subject) throws InvalidRouteException, InvalidStateException, NotFoundException {
        Ship ship = campaign.requireShip(embark.shipId());
        if (army.isEmbarked()) {
            throw new InvalidStateException("Army " + army.getId() + " is already embarked");
        }
        if (ship.isSailing() || ship.getEmbarkedArmyId() != null) {
            throw new InvalidStateException("Ship " + ship.getId() + " is not available for embarkation");
        }
        if (army.getLocationHexId() != ship.getHexId()) {
            throw new InvalidRouteException("Army " + army.getId() + " and ship " + ship.getId() + " are not on the same hex");
        }
        int troops = army.getSoldiers() + army.getNoncombatants();
        if (troops > ship.getTroopCapacity()) {
            throw new InvalidRouteException("Ship " + ship.getId() + " holds " + ship.getTroopCapacity()
                    + " but army " + army.getId() + " numbers " + troops);
        }
        army.setEmbarkedShipId(ship.getId());
        army.setStatus(Army.Status.EMBARKED);
        ship.setEmbarkedArmyId(army.getId());

        String effect = "army " + army.getId() + " embarked on ship " + ship.getId();
        rolls.audit(AuditSubsystem.NAVAL, subject, Map.of("troops", troops, "capacity", ship.getTroopCapacity()), effect);
        return OrderResult.completed(effect, Map.of("ship_id", ship.getId()));
    }

    public OrderResult resolveDisembark(Campaign campaign, Army army, RollService rolls, String subject)
            throws InvalidRouteException, InvalidStateException {
        if (!army.isEmbarked()) {
            throw new InvalidStateException("Army " + army.getId() + " is not embarked");
        }
        Ship ship = campaign.getShips().get(army.getEmbarkedShipId());
        if (ship == null) {
            throw new InvalidStateException("Ship " + army.getEmbarkedShipId() + " carrying army " + army.getId()
                    + " no longer exists");
        }
        if (ship.isSailing()) {
            throw new InvalidStateException("Ship " + ship.getId() + " is still en route");
        }
        if (!campaign.getMap().getHex(ship.getHexId()).getTerrain().isLand()) {
            throw new InvalidRouteException("Ship " + ship.getId() + " is at sea and cannot land troops");
        }
        army.setEmbarkedShipId(null);
        army.setLocationHexId(ship.getHexId());
        army.setStatus(Army.Status.IDLE);
        ship.setEmbarkedArmyId(null);

        String effect = "army " + army.getId() + " disembarked at hex " + ship.getHexId();
        rolls.audit(AuditSubsystem.NAVAL, subject, Map.of("ship_id", ship.getId()), effect);
        return OrderResult.completed(effect, Map.of("hex_id", ship.getHexId()));
    }

    public OrderResult resolveNavalMove(Campaign campaign, OrderParameters.NavalMove move, RollService rolls,
                                        String subject) throws InvalidRouteException, InvalidStateException, NotFoundException {
        Ship ship = campaign.requireShip(move.shipId());
        if (ship.isSailing()) {
            throw new InvalidStateException("Ship " + ship.getId() + " is already under way");
        }
        validateRoute(campaign.getMap(), ship.getHexId(), move.route());

        RulesConfig.Naval naval = rules.naval();
        double miles = move.route().size() * naval.milesPerHex();
        long parts = Math.max(1L, (long) Math.ceil(miles / naval.milesPerDay() * Tick.PARTS_PER_DAY));
        Tick arrival = rolls.tick().plusParts(parts);
        ship.getRoute().clear();
        ship.getRoute().addAll(move.route());
        ship.setArrivalTick(arrival);
        ship.setStatus(Ship.Status.SAILING);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("route", move.route());
        inputs.put("miles", miles);
        inputs.put("transit_parts", parts);
        String effect = "ship " + ship.getId() + " sailing to hex " + move.route().get(move.route().size() - 1)
                + ", arriving " + arrival;
        rolls.audit(AuditSubsystem.NAVAL, subject, inputs, effect);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("arrival_day", arrival.day());
        details.put("arrival_part", arrival.part().wireName());
        details.put("embarked_army_id", ship.getEmbarkedArmyId());
        return OrderResult.completed(effect, details);
    }

    private void validateRoute(MapGraph map, long start, List<Long> route) throws InvalidRouteException {
        long previous = start;
        for (long hexId : route) {
            if (!map.hasHex(hexId)) {
                throw new InvalidRouteException("Hex " + hexId + " does not exist");
            }
            if (!map.isNavigable(hexId)) {
                throw new InvalidRouteException("Hex " + hexId + " is not a sea lane");
            }
            if (!map.areAdjacent(previous, hexId)) {
                throw new InvalidRouteException("Hex " + hexId + " is not adjacent to hex " + previous);
            }
            previous = hexId;
        }
    }

    /**
     * Lands a sailing ship whose arrival tick has come, carrying its army along.
     */
    public void arrive(Campaign campaign, Ship ship, RollService rolls) {
        if (!ship.isSailing() || ship.getArrivalTick().isAfter(rolls.tick())) {
            return;
        }
        long destination = ship.getRoute().get(ship.getRoute().size() - 1);
        ship.setHexId(destination);
        ship.getRoute().clear();
        ship.setArrivalTick(null);
        ship.setStatus(Ship.Status.AVAILABLE);
        String effect = "ship " + ship.getId() + " arrived at hex " + destination;
        if (ship.getEmbarkedArmyId() != null) {
            Army army = campaign.getArmies().get(ship.getEmbarkedArmyId());
            if (army != null) {
                army.setLocationHexId(destination);
                Commander commander = army.getCommanderId() == null
                        ? null : campaign.getCommanders().get(army.getCommanderId());
                if (commander != null) {
                    commander.setCurrentHexId(destination);
                }
                effect += " carrying army " + army.getId();
            }
        }
        rolls.audit(AuditSubsystem.NAVAL, "ship:" + ship.getId(), Map.of(), effect);
    }
}
