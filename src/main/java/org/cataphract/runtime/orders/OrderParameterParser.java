package org.cataphract.runtime.orders;

import org.cataphract.runtime.api.ValidationException;
import org.cataphract.runtime.model.Operation;
import org.cataphract.runtime.model.OperationTarget;
import org.cataphract.runtime.model.TerritoryType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns the open, snake_case parameter map of an order request into the typed
 * record for its order type. Only the shape of the parameters is checked here;
 * whether the referenced entities exist is up to the scheduler.
 */
public class OrderParameterParser {

    private final boolean allowFixedRolls;
    private final int maxSiegeEngines;

    /**
     * @param allowFixedRolls Whether requests may replace dice with fixed values.
     * @param maxSiegeEngines Most siege engines one besiege order may bring.
     */
    public OrderParameterParser(boolean allowFixedRolls, int maxSiegeEngines) {
        this.allowFixedRolls = allowFixedRolls;
        this.maxSiegeEngines = maxSiegeEngines;
    }

    public OrderParameters parse(OrderType type, Map<String, Object> params) throws ValidationException {
        switch (type) {
            case MOVE:
                return parseMove(params);
            case REST:
                return new OrderParameters.Rest(requirePositive(params, "days"));
            case FORAGE:
                return new OrderParameters.Forage(requireIdList(params, "hex_ids"));
            case TORCH:
                return new OrderParameters.Torch(requireIdList(params, "hex_ids"));
            case SUPPLY_TRANSFER:
                return new OrderParameters.SupplyTransfer(requireLong(params, "target_army_id"),
                        requirePositive(params, "amount"));
            case BESIEGE:
                return new OrderParameters.Besiege(requireLong(params, "stronghold_id"), parseSiegeEngines(params));
            case ASSAULT:
                return new OrderParameters.Assault(requireLong(params, "stronghold_id"),
                        optionalInt(params, "attacker_modifier", 0),
                        optionalInt(params, "defender_modifier", 0),
                        fixedRoll(params, "attacker_fixed_roll"),
                        fixedRoll(params, "defender_fixed_roll"),
                        optionalBoolean(params, "pillage"));
            case EMBARK:
                return new OrderParameters.Embark(requireLong(params, "ship_id"));
            case DISEMBARK:
                return new OrderParameters.Disembark();
            case NAVAL_MOVE:
                return new OrderParameters.NavalMove(requireLong(params, "ship_id"), requireIdList(params, "route"));
            case SEND_MESSAGE:
                return new OrderParameters.SendMessage(requireLong(params, "recipient_id"),
                        requireString(params, "content"),
                        territory(params, TerritoryType.NEUTRAL),
                        fixedRoll(params, "interception_fixed_roll"));
            case LAUNCH_OPERATION:
                return parseOperation(params);
            case RAISE_ARMY:
                return parseRaiseArmy(params);
            case HARRY:
                return new OrderParameters.Harry(requireLong(params, "target_army_id"),
                        requireIdList(params, "detachment_ids"),
                        requireEnum(params, "objective", OrderParameters.HarryObjective.class),
                        fixedRoll(params, "fixed_roll"));
            default:
                throw new ValidationException("Unsupported order type " + type.wireName());
        }
    }

    private OrderParameters.Move parseMove(Map<String, Object> params) throws ValidationException {
        Object raw = params.get("legs");
        if (!(raw instanceof List<?>) || ((List<?>) raw).isEmpty()) {
            throw new ValidationException("move needs at least one leg in 'legs'");
        }
        List<OrderParameters.Leg> legs = new ArrayList<>();
        int index = 0;
        for (Object entry : (List<?>) raw) {
            if (!(entry instanceof Map<?, ?>)) {
                throw new ValidationException("legs[" + index + "] is not an object");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> leg = (Map<String, Object>) entry;
            double distance = requireDouble(leg, "distance");
            if (!Double.isFinite(distance) || distance <= 0) {
                throw new ValidationException("legs[" + index + "].distance must be positive");
            }
            boolean hasFork = optionalBoolean(leg, "has_fork");
            Long alternate = optionalLong(leg, "alternate_hex_id");
            if (hasFork && alternate == null) {
                throw new ValidationException("legs[" + index + "] has a fork but no alternate_hex_id");
            }
            legs.add(new OrderParameters.Leg(requireLong(leg, "to_hex_id"), distance,
                    optionalBoolean(leg, "on_road"), optionalBoolean(leg, "has_river_ford"),
                    optionalBoolean(leg, "is_night"), hasFork, alternate, fixedRoll(leg, "fork_fixed_roll")));
            index++;
        }
        return new OrderParameters.Move(legs, optionalBoolean(params, "forced_march"));
    }

    private int parseSiegeEngines(Map<String, Object> params) throws ValidationException {
        int engines = requireNonNegative(params, "siege_engines", 0);
        if (engines > maxSiegeEngines) {
            throw new ValidationException("Parameter 'siege_engines' must not exceed " + maxSiegeEngines + ", got "
                    + engines);
        }
        return engines;
    }

    private OrderParameters.LaunchOperation parseOperation(Map<String, Object> params) throws ValidationException {
        Long operationId = optionalLong(params, "operation_id");
        Integer fixed = fixedRoll(params, "fixed_roll");
        if (operationId != null) {
            return new OrderParameters.LaunchOperation(operationId, null, null, null, null, 0, null, fixed);
        }
        Operation.Type type = requireEnum(params, "operation_type", Operation.Type.class);
        OperationTarget.Kind kind = requireEnum(params, "target_kind", OperationTarget.Kind.class);
        if (type == Operation.Type.ASSASSINATION && kind != OperationTarget.Kind.COMMANDER) {
            throw new ValidationException("assassination must target a commander");
        }
        if (type == Operation.Type.SABOTAGE && kind == OperationTarget.Kind.COMMANDER) {
            throw new ValidationException("sabotage must target an army or a stronghold");
        }
        Integer lootCost = optionalLong(params, "loot_cost") == null ? null : requireNonNegative(params, "loot_cost", 0);
        Operation.Complexity complexity = params.containsKey("complexity")
                ? requireEnum(params, "complexity", Operation.Complexity.class)
                : Operation.Complexity.STANDARD;
        return new OrderParameters.LaunchOperation(null, type, new OperationTarget(kind, requireLong(params, "target_id")),
                complexity, territory(params, TerritoryType.HOSTILE), optionalInt(params, "difficulty_modifier", 0),
                lootCost, fixed);
    }

    private OrderParameters.RaiseArmy parseRaiseArmy(Map<String, Object> params) throws ValidationException {
        Long projectId = optionalLong(params, "project_id");
        if (projectId != null) {
            return new OrderParameters.RaiseArmy(projectId, null, null, Map.of(), 0, null);
        }
        Object raw = params.get("units");
        if (!(raw instanceof Map<?, ?>) || ((Map<?, ?>) raw).isEmpty()) {
            throw new ValidationException("raise_army needs a non-empty 'units' map of unit type id to soldiers");
        }
        Map<Long, Integer> units = new TreeMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            long unitTypeId;
            try {
                unitTypeId = Long.parseLong(String.valueOf(entry.getKey()).trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("units key '" + entry.getKey() + "' is not a unit type id", e);
            }
            if (!(entry.getValue() instanceof Number)) {
                throw new ValidationException("units[" + unitTypeId + "] must be a positive number of soldiers");
            }
            String key = "units[" + unitTypeId + "]";
            int soldiers = toInt(key, (Number) entry.getValue());
            if (soldiers <= 0) {
                throw new ValidationException(key + " must be a positive number of soldiers");
            }
            try {
                units.merge(unitTypeId, soldiers, Math::addExact);
            } catch (ArithmeticException e) {
                throw new ValidationException(key + " is out of range", e);
            }
        }
        return new OrderParameters.RaiseArmy(null, requireLong(params, "stronghold_id"),
                optionalLong(params, "commander_id"), units, requireNonNegative(params, "wagons", 0),
                optionalLong(params, "rally_hex_id"));
    }

    private Integer fixedRoll(Map<String, Object> params, String key) throws ValidationException {
        if (params.get(key) == null) {
            return null;
        }
        if (!allowFixedRolls) {
            throw new ValidationException("Fixed rolls are disabled, '" + key + "' is not accepted");
        }
        return optionalInt(params, key, 0);
    }

    private static TerritoryType territory(Map<String, Object> params, TerritoryType fallback)
            throws ValidationException {
        return params.containsKey("territory_type")
                ? requireEnum(params, "territory_type", TerritoryType.class)
                : fallback;
    }

    private static Number requireNumber(Map<String, Object> params, String key) throws ValidationException {
        Object value = params.get(key);
        if (value == null) {
            throw new ValidationException("Missing parameter '" + key + "'");
        }
        if (!(value instanceof Number)) {
            throw new ValidationException("Parameter '" + key + "' must be a number, got " + value);
        }
        return (Number) value;
    }

    private static long requireLong(Map<String, Object> params, String key) throws ValidationException {
        return requireNumber(params, key).longValue();
    }

    private static double requireDouble(Map<String, Object> params, String key) throws ValidationException {
        return requireNumber(params, key).doubleValue();
    }

    /**
     * Narrows a whole number to an int, rejecting fractions and values outside the int range.
     */
    private static int toInt(String key, Number number) throws ValidationException {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (!Double.isFinite(value) || value != Math.rint(value)
                    || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new ValidationException("Parameter '" + key + "' must be a whole number in range, got " + number);
            }
            return (int) value;
        }
        if (number instanceof BigInteger || number instanceof BigDecimal) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw new ValidationException("Parameter '" + key + "' must be a whole number in range, got "
                        + number, e);
            }
        }
        try {
            return Math.toIntExact(number.longValue());
        } catch (ArithmeticException e) {
            throw new ValidationException("Parameter '" + key + "' is out of range: " + number, e);
        }
    }

    private static int requirePositive(Map<String, Object> params, String key) throws ValidationException {
        int value = toInt(key, requireNumber(params, key));
        if (value <= 0) {
            throw new ValidationException("Parameter '" + key + "' must be positive, got " + value);
        }
        return value;
    }

    private static int requireNonNegative(Map<String, Object> params, String key, int fallback)
            throws ValidationException {
        int value = optionalInt(params, key, fallback);
        if (value < 0) {
            throw new ValidationException("Parameter '" + key + "' must not be negative, got " + value);
        }
        return value;
    }

    private static int optionalInt(Map<String, Object> params, String key, int fallback) throws ValidationException {
        return params.get(key) == null ? fallback : toInt(key, requireNumber(params, key));
    }

    private static Long optionalLong(Map<String, Object> params, String key) throws ValidationException {
        return params.get(key) == null ? null : requireLong(params, key);
    }

    private static boolean optionalBoolean(Map<String, Object> params, String key) throws ValidationException {
        Object value = params.get(key);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new ValidationException("Parameter '" + key + "' must be true or false, got " + value);
        }
        return (Boolean) value;
    }

    private static String requireString(Map<String, Object> params, String key) throws ValidationException {
        Object value = params.get(key);
        if (!(value instanceof String)) {
            throw new ValidationException("Missing text parameter '" + key + "'");
        }
        return (String) value;
    }

    private static List<Long> requireIdList(Map<String, Object> params, String key) throws ValidationException {
        Object value = params.get(key);
        if (!(value instanceof List<?>) || ((List<?>) value).isEmpty()) {
            throw new ValidationException("Parameter '" + key + "' must be a non-empty list of ids");
        }
        List<Long> ids = new ArrayList<>();
        for (Object id : (List<?>) value) {
            if (!(id instanceof Number)) {
                throw new ValidationException("Parameter '" + key + "' contains a non-numeric id " + id);
            }
            ids.add(((Number) id).longValue());
        }
        return ids;
    }

    private static <E extends Enum<E>> E requireEnum(Map<String, Object> params, String key, Class<E> type)
            throws ValidationException {
        String value = requireString(params, key);
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + key + " '" + value + "'", e);
        }
    }
}
