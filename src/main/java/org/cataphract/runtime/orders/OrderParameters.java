package org.cataphract.runtime.orders;

import org.cataphract.runtime.model.Operation;
import org.cataphract.runtime.model.OperationTarget;
import org.cataphract.runtime.model.TerritoryType;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validated, typed parameters of an order. There is exactly one record per
 * {@link OrderType}; {@link #type()} ties the two together.
 */
public sealed interface OrderParameters {

    OrderType type();

    /**
     * One hex-to-hex segment of a march.
     *
     * @param toHexId        Destination of the leg.
     * @param distanceMiles  Length of the leg in miles, positive.
     * @param onRoad         Whether the leg follows a road.
     * @param hasRiverFord   Whether the leg fords a river.
     * @param isNight        Whether the leg is marched at night.
     * @param hasFork        Whether the leg passes a fork where the column can go astray.
     * @param alternateHexId Where a misdirected column ends up; required when {@code hasFork}.
     * @param forkFixedRoll  Fixed value of the fork roll, or null.
     */
    record Leg(long toHexId, double distanceMiles, boolean onRoad, boolean hasRiverFord, boolean isNight,
               boolean hasFork, Long alternateHexId, Integer forkFixedRoll) {
    }

    record Move(List<Leg> legs, boolean forcedMarch) implements OrderParameters {
        public Move {
            legs = List.copyOf(legs);
        }

        @Override
        public OrderType type() {
            return OrderType.MOVE;
        }
    }

    record Rest(int days) implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.REST;
        }
    }

    record Forage(List<Long> hexIds) implements OrderParameters {
        public Forage {
            hexIds = List.copyOf(hexIds);
        }

        @Override
        public OrderType type() {
            return OrderType.FORAGE;
        }
    }

    record Torch(List<Long> hexIds) implements OrderParameters {
        public Torch {
            hexIds = List.copyOf(hexIds);
        }

        @Override
        public OrderType type() {
            return OrderType.TORCH;
        }
    }

    record SupplyTransfer(long targetArmyId, int amount) implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.SUPPLY_TRANSFER;
        }
    }

    record Besiege(long strongholdId, int siegeEngines) implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.BESIEGE;
        }
    }

    record Assault(long strongholdId, int attackerModifier, int defenderModifier, Integer attackerFixedRoll,
                   Integer defenderFixedRoll, boolean pillage) implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.ASSAULT;
        }
    }

    record Embark(long shipId) implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.EMBARK;
        }
    }

    record Disembark() implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.DISEMBARK;
        }
    }

    record NavalMove(long shipId, List<Long> route) implements OrderParameters {
        public NavalMove {
            route = List.copyOf(route);
        }

        @Override
        public OrderType type() {
            return OrderType.NAVAL_MOVE;
        }
    }

    record SendMessage(long recipientId, String content, TerritoryType territoryType, Integer interceptionFixedRoll)
            implements OrderParameters {
        @Override
        public OrderType type() {
            return OrderType.SEND_MESSAGE;
        }
    }

    /**
     * Either starts a new operation or, when {@code operationId} is set, resumes one.
     * The descriptive fields are null when resuming.
     */
    record LaunchOperation(Long operationId, Operation.Type operationType, OperationTarget target,
                           Operation.Complexity complexity, TerritoryType territoryType, int difficultyModifier,
                           Integer lootCost, Integer fixedRoll) implements OrderParameters {
        public boolean isContinuation() {
            return operationId != null;
        }

        @Override
        public OrderType type() {
            return OrderType.LAUNCH_OPERATION;
        }
    }

    /**
     * Either opens a recruitment project or, when {@code projectId} is set, continues one.
     */
    record RaiseArmy(Long projectId, Long strongholdId, Long commanderId, Map<Long, Integer> units, int wagons,
                     Long rallyHexId) implements OrderParameters {
        public RaiseArmy {
            units = units == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(units));
        }

        public boolean isContinuation() {
            return projectId != null;
        }

        @Override
        public OrderType type() {
            return OrderType.RAISE_ARMY;
        }
    }

    record Harry(long targetArmyId, List<Long> detachmentIds, HarryObjective objective, Integer fixedRoll)
            implements OrderParameters {
        public Harry {
            detachmentIds = List.copyOf(detachmentIds);
        }

        @Override
        public OrderType type() {
            return OrderType.HARRY;
        }
    }

    enum HarryObjective {
        KILL,
        TORCH,
        STEAL
    }
}
