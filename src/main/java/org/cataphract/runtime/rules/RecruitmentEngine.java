package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.map.Hex;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.Detachment;
import org.cataphract.runtime.model.RecruitmentProject;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.model.TickError;
import org.cataphract.runtime.orders.Order;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.cataphract.runtime.orders.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Levies raised at a stronghold. A raise_army order opens a project and stays
 * executing while the muster runs; every day-part adds progress according to the
 * stronghold type, and once the muster is complete the new army stands at the
 * rally hex and the order completes with its id.
 */
public class RecruitmentEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecruitmentEngine.class);

    private final RulesConfig rules;
    private final ArmyMath math;

    public RecruitmentEngine(RulesConfig rules, ArmyMath math) {
        this.rules = rules;
        this.math = math;
    }

    /**
     * Opens a recruitment project for a raise_army order. The order is left executing,
     * carrying the project id in an interim result.
     *
     * @return the new project.
     */
    public RecruitmentProject open(Campaign campaign, Commander issuer, Order order, OrderParameters.RaiseArmy raise,
                                   RollService rolls) throws InvalidStateException, NotFoundException {
        Stronghold stronghold = campaign.requireStronghold(raise.strongholdId());
        if (!stronghold.isControlledBy(issuer.getFactionId())) {
            throw new InvalidStateException("Stronghold " + stronghold.getId() + " is no longer held by faction "
                    + issuer.getFactionId());
        }
        long commanderToBe = raise.commanderId() != null ? raise.commanderId() : issuer.getId();
        Commander leader = campaign.requireCommander(commanderToBe);
        if (!leader.isActive()) {
            throw new InvalidStateException("Commander " + leader.getId() + " is " + leader.getStatus());
        }
        long rallyHexId = raise.rallyHexId() != null ? raise.rallyHexId() : stronghold.getHexId();
        campaign.requireHex(rallyHexId);
        for (Long unitTypeId : raise.units().keySet()) {
            campaign.requireUnitType(unitTypeId);
        }

        int required = rules.recruitment().musterDays() * Tick.PARTS_PER_DAY;
        RecruitmentProject project = new RecruitmentProject(campaign.allocateId(), stronghold.getId(), issuer.getId(),
                commanderToBe, raise.units(), raise.wagons(), rallyHexId, order.getId(), required);
        campaign.addProject(project);
        // Interim result so the host learns the project id while the muster runs.
        order.setResult(OrderResult.partial("recruitment project " + project.getId() + " opened",
                Map.of("project_id", project.getId(), "required_progress", required)));

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("stronghold_type", stronghold.getType().name());
        inputs.put("units", new LinkedHashMap<>(raise.units()));
        inputs.put("wagons", raise.wagons());
        inputs.put("required_progress", required);
        rolls.audit(AuditSubsystem.RECRUITMENT, order.subject(), inputs,
                "recruitment project " + project.getId() + " opened at stronghold " + stronghold.getId());
        return project;
    }

    /**
     * Reports on a project for a raise_army order that quotes its id.
     */
    public OrderResult report(Campaign campaign, OrderParameters.RaiseArmy raise) throws InvalidStateException,
            NotFoundException {
        RecruitmentProject project = campaign.requireProject(raise.projectId());
        if (!project.isActive()) {
            throw new InvalidStateException("Recruitment project " + project.getId() + " is " + project.getStatus());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("project_id", project.getId());
        details.put("progress", project.getProgress());
        details.put("required_progress", project.getRequiredProgress());
        return OrderResult.completed("recruitment project " + project.getId() + " at " + project.getProgress() + " of "
                + project.getRequiredProgress(), details);
    }

    /**
     * Adds one day-part of progress and spawns the army when the muster is complete.
     */
    public void advance(Campaign campaign, RecruitmentProject project, RollService rolls) {
        if (!project.isActive()) {
            return;
        }
        String subject = "project:" + project.getId();
        Stronghold stronghold = campaign.getStrongholds().get(project.getStrongholdId());
        Commander issuer = campaign.getCommanders().get(project.getIssuingCommanderId());
        if (stronghold == null || issuer == null || !stronghold.isControlledBy(issuer.getFactionId())) {
            abandon(campaign, project, "stronghold " + project.getStrongholdId() + " changed hands", rolls);
            return;
        }

        int gain = rules.recruitment().progressPerPart().getOrDefault(stronghold.getType(), 1);
        project.setProgress(Math.min(project.getRequiredProgress(), project.getProgress() + gain));
        if (project.getProgress() < project.getRequiredProgress()) {
            rolls.audit(AuditSubsystem.RECRUITMENT, subject, Map.of("gain", gain),
                    "muster at " + project.getProgress() + " of " + project.getRequiredProgress());
            return;
        }

        Commander leader = campaign.getCommanders().get(project.getCommanderToBeId());
        if (leader == null || !leader.isActive() || campaign.findArmyOf(leader.getId()).isPresent()) {
            String reason = "commander " + project.getCommanderToBeId() + " cannot take command";
            campaign.recordTickError(new TickError(rolls.tick(), subject, "conflict", reason));
            abandon(campaign, project, reason, rolls);
            return;
        }
        Army army = spawn(campaign, project, leader);
        project.setStatus(RecruitmentProject.Status.COMPLETED);
        project.setSpawnedArmyId(army.getId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("project_id", project.getId());
        details.put("army_id", army.getId());
        details.put("hex_id", army.getLocationHexId());
        String effect = "army " + army.getId() + " of " + army.getSoldiers() + " soldiers raised at hex "
                + army.getLocationHexId();
        finishOrder(campaign, project, OrderStatus.COMPLETED, OrderResult.completed(effect, details));
        rolls.audit(AuditSubsystem.RECRUITMENT, subject, Map.of("gain", gain), effect);
        LOG.info("Recruitment project {} raised army {} on {}", project.getId(), army.getId(), rolls.tick());
    }

    /**
     * Stops a project for good and fails the order that opened it, if that order is still running.
     */
    public void abandon(Campaign campaign, RecruitmentProject project, String reason, RollService rolls) {
        project.setStatus(RecruitmentProject.Status.ABANDONED);
        finishOrder(campaign, project, OrderStatus.FAILED,
                OrderResult.failed("invalid_state", "recruitment abandoned: " + reason));
        rolls.audit(AuditSubsystem.RECRUITMENT, "project:" + project.getId(), Map.of(),
                "recruitment abandoned: " + reason);
    }

    /**
     * @return the active project opened by the given order, if any.
     */
    public Optional<RecruitmentProject> findActiveByOrder(Campaign campaign, long orderId) {
        return campaign.getProjects().values().stream()
                .filter(p -> p.isActive() && p.getOrderId() == orderId)
                .findFirst();
    }

    private Army spawn(Campaign campaign, RecruitmentProject project, Commander leader) {
        RulesConfig.Supply supply = rules.supply();
        RulesConfig.Morale morale = rules.morale();
        Army army = new Army(campaign.allocateId(), leader.getId(), project.getRallyHexId());
        boolean first = true;
        for (Map.Entry<Long, Integer> unit : project.getComposition().entrySet()) {
            Detachment detachment = new Detachment(campaign.allocateId(), unit.getKey(), unit.getValue(),
                    first ? project.getWagons() : 0);
            army.getDetachments().add(detachment);
            first = false;
        }
        army.setNoncombatants((int) (army.getSoldiers() * supply.noncombatantRatio()));
        army.setSuppliesCapacity(math.capacity(campaign, army));
        army.setSuppliesCurrent(Math.min(army.getSuppliesCapacity(),
                math.dailyConsumption(campaign, army) * supply.startingSupplyDays()));
        army.setMoraleMax(morale.max());
        army.setMoraleResting(morale.resting());
        army.setMoraleCurrent(morale.resting());
        army.setMovementPointsRemaining(rules.movement().pointsPerDay());
        campaign.addArmy(army);

        Hex rally = campaign.getMap().getHex(project.getRallyHexId());
        leader.setCurrentHexId(rally.getId());
        return army;
    }

    private void finishOrder(Campaign campaign, RecruitmentProject project, OrderStatus status, OrderResult result) {
        Order order = campaign.getOrders().get(project.getOrderId());
        if (order == null || order.getStatus() != OrderStatus.EXECUTING) {
            return;
        }
        order.setResult(result);
        order.transitionTo(status);
        campaign.dequeue(order);
    }
}
