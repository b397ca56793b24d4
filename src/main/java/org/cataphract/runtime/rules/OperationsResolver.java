package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.Operation;
import org.cataphract.runtime.model.OperationTarget;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.model.TerritoryType;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Covert operations: spying, sabotage and assassination.
 * <p>
 * Each stage is a 2d6 roll against a target number of base target minus the
 * combined modifier (difficulty, complexity and territory), clamped to [2, 12].
 * The loot cost is paid when the operation is launched, whatever the outcome.
 * Complex operations need more than one successful stage and are resumed by
 * quoting the operation id.
 */
public class OperationsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(OperationsResolver.class);

    private final RulesConfig rules;

    public OperationsResolver(RulesConfig rules) {
        this.rules = rules;
    }

    /**
     * @return the 2d6 total a stage must reach.
     */
    public int targetNumber(Operation.Complexity complexity, TerritoryType territory,
                            int difficultyModifier) {
        RulesConfig.Operations config = rules.operations();
        int modifier = difficultyModifier
                + config.complexityModifier().get(complexity)
                + config.territoryModifier().get(territory);
        return Math.max(2, Math.min(12, config.baseTarget() - modifier));
    }

    /**
     * @return the probability that 2d6 reaches the target number.
     */
    public static double successProbability(int target) {
        int hits = 0;
        for (int a = 1; a <= 6; a++) {
            for (int b = 1; b <= 6; b++) {
                if (a + b >= target) {
                    hits++;
                }
            }
        }
        return hits / 36.0;
    }

    public OrderResult launch(Campaign campaign, Army army, OrderParameters.LaunchOperation launch, RollService rolls,
                              String subject) throws InvalidStateException, NotFoundException {
        Operation operation;
        if (launch.isContinuation()) {
            operation = campaign.requireOperation(launch.operationId());
            if (!operation.isInProgress()) {
                throw new InvalidStateException("Operation " + operation.getId() + " is already "
                        + operation.getStatus().name().toLowerCase(Locale.ROOT));
            }
        } else {
            int cost = launch.lootCost() != null ? launch.lootCost() : rules.operations().defaultLootCost();
            if (army.getLootCarried() < cost) {
                throw new InvalidStateException("Army " + army.getId() + " carries " + army.getLootCarried()
                        + " loot but the operation costs " + cost);
            }
            army.setLootCarried(army.getLootCarried() - cost);
            int stages = launch.complexity() == Operation.Complexity.COMPLEX ? rules.operations().complexStages() : 1;
            operation = new Operation(campaign.allocateId(), army.getCommanderId() == null ? 0L : army.getCommanderId(),
                    army.getId(), launch.operationType(), launch.target(), launch.complexity(), launch.territoryType(),
                    launch.difficultyModifier(), cost, stages);
            campaign.addOperation(operation);
        }
        return runStage(campaign, operation, launch.fixedRoll(), rolls, subject);
    }

    private OrderResult runStage(Campaign campaign, Operation operation, Integer fixedRoll, RollService rolls,
                                 String subject) {
        int target = targetNumber(operation.getComplexity(), operation.getTerritoryType(),
                operation.getDifficultyModifier());
        double probability = successProbability(target);
        operation.setSuccessProbability(probability);
        int stage = operation.getStagesCompleted() + 1;
        Roll roll = rolls.twoD6("operation:" + operation.getId() + ":stage:" + stage, fixedRoll);
        boolean success = roll.total() >= target;

        String effect;
        if (!success) {
            operation.setStatus(Operation.Status.FAILED);
            operation.getOutcome().put("failed_stage", stage);
            effect = "operation " + operation.getId() + " failed at stage " + stage;
        } else {
            operation.setStagesCompleted(stage);
            if (stage < operation.getStagesRequired()) {
                effect = "operation " + operation.getId() + " stage " + stage + " of "
                        + operation.getStagesRequired() + " succeeded, awaiting continuation";
            } else {
                operation.setStatus(Operation.Status.SUCCEEDED);
                effect = "operation " + operation.getId() + " succeeded: " + applyEffect(campaign, operation);
            }
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("type", operation.getType().name());
        inputs.put("target", operation.getTarget().toString());
        inputs.put("complexity", operation.getComplexity().name());
        inputs.put("territory", operation.getTerritoryType().wireName());
        inputs.put("difficulty_modifier", operation.getDifficultyModifier());
        inputs.put("target_number", target);
        inputs.put("success_probability", probability);
        inputs.put("stage", stage);
        rolls.audit(AuditSubsystem.OPERATIONS, subject, inputs, effect);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation_id", operation.getId());
        details.put("status", operation.getStatus().name().toLowerCase(Locale.ROOT));
        details.put("stages_completed", operation.getStagesCompleted());
        details.put("stages_required", operation.getStagesRequired());
        details.put("success_probability", probability);
        if (operation.isInProgress()) {
            details.put("continuation_id", operation.getId());
        }
        details.put("outcome", new LinkedHashMap<>(operation.getOutcome()));
        return OrderResult.completed(effect, details);
    }

    private String applyEffect(Campaign campaign, Operation operation) {
        OperationTarget target = operation.getTarget();
        Map<String, Object> outcome = operation.getOutcome();
        switch (operation.getType()) {
            case INTELLIGENCE:
                outcome.putAll(reveal(campaign, target));
                return "intelligence gathered on " + target;
            case SABOTAGE:
                return sabotage(campaign, target, outcome);
            case ASSASSINATION: {
                Commander victim = campaign.getCommanders().get(target.id());
                if (victim == null || !victim.isActive()) {
                    outcome.put("target_unavailable", true);
                    return "target " + target + " was beyond reach";
                }
                victim.setStatus(Commander.Status.KILLED);
                campaign.findArmyOf(victim.getId()).ifPresent(army -> army.setCommanderId(null));
                outcome.put("killed_commander_id", victim.getId());
                LOG.info("Commander {} assassinated by operation {}", victim.getId(), operation.getId());
                return "commander " + victim.getId() + " killed";
            }
            default:
                throw new IllegalStateException("Unknown operation type " + operation.getType());
        }
    }

    private Map<String, Object> reveal(Campaign campaign, OperationTarget target) {
        Map<String, Object> report = new LinkedHashMap<>();
        switch (target.kind()) {
            case ARMY: {
                Army army = campaign.getArmies().get(target.id());
                if (army != null) {
                    report.put("hex_id", army.getLocationHexId());
                    report.put("soldiers", army.getSoldiers());
                    report.put("supplies", army.getSuppliesCurrent());
                    report.put("morale", army.getMoraleCurrent());
                    report.put("status", army.getStatus().name());
                }
                break;
            }
            case STRONGHOLD: {
                Stronghold stronghold = campaign.getStrongholds().get(target.id());
                if (stronghold != null) {
                    report.put("controlling_faction_id", stronghold.getControllingFactionId());
                    report.put("threshold", stronghold.getCurrentThreshold());
                    report.put("garrison_army_id", stronghold.getGarrisonArmyId());
                    report.put("supplies", stronghold.getSuppliesHeld());
                }
                break;
            }
            case COMMANDER: {
                Commander commander = campaign.getCommanders().get(target.id());
                if (commander != null) {
                    report.put("status", commander.getStatus().name());
                    report.put("hex_id", commander.getCurrentHexId());
                }
                break;
            }
            default:
                throw new IllegalStateException("Unknown target kind " + target.kind());
        }
        return report;
    }

    private String sabotage(Campaign campaign, OperationTarget target, Map<String, Object> outcome) {
        if (target.kind() == OperationTarget.Kind.ARMY) {
            Army army = campaign.getArmies().get(target.id());
            if (army == null) {
                outcome.put("target_unavailable", true);
                return "target " + target + " was beyond reach";
            }
            int destroyed = army.getSuppliesCurrent() / 2;
            army.setSuppliesCurrent(army.getSuppliesCurrent() - destroyed);
            outcome.put("supplies_destroyed", destroyed);
            return destroyed + " supplies of army " + army.getId() + " destroyed";
        }
        Stronghold stronghold = campaign.getStrongholds().get(target.id());
        if (stronghold == null) {
            outcome.put("target_unavailable", true);
            return "target " + target + " was beyond reach";
        }
        // Sabotage weakens the walls but never takes a stronghold on its own.
        int before = stronghold.getCurrentThreshold();
        int after = Math.max(Math.min(before, 1), before - rules.operations().sabotageThresholdDamage());
        stronghold.setCurrentThreshold(after);
        outcome.put("threshold_before", before);
        outcome.put("threshold_after", after);
        return "threshold of stronghold " + stronghold.getId() + " cut from " + before + " to " + after;
    }
}
