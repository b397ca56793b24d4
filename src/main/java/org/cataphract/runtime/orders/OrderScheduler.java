package org.cataphract.runtime.orders;

import org.cataphract.runtime.api.AuthorizationException;
import org.cataphract.runtime.api.CampaignRuleException;
import org.cataphract.runtime.api.ConflictException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.InvariantViolationException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.api.OrderRequest;
import org.cataphract.runtime.api.ValidationException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.Operation;
import org.cataphract.runtime.model.OperationTarget;
import org.cataphract.runtime.model.RecruitmentProject;
import org.cataphract.runtime.model.Ship;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Accepts, cancels and dispatches orders.
 * <p>
 * Submission validates the request against the campaign as it stands and queues
 * the order on its army, or on its commander for commander-level orders, in
 * dispatch order. Dispatch hands every due order to its resolver. Rule violations
 * raised during resolution fail the order without touching the rest of the part;
 * only a broken invariant escapes.
 */
public class OrderScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(OrderScheduler.class);

    private final RuleSet rules;
    private final OrderParameterParser parser;

    public OrderScheduler(RuleSet rules) {
        this.rules = rules;
        this.parser = new OrderParameterParser(rules.config().allowFixedRolls(),
                rules.config().siege().maxSiegeEngines());
    }

    /**
     * Validates a request and queues the resulting order as PENDING.
     *
     * @return the queued order.
     * @throws ValidationException    if the order type or parameters are malformed.
     * @throws NotFoundException      if a referenced entity does not exist.
     * @throws AuthorizationException if the commander may not give this order.
     * @throws ConflictException      if the order collides with a recruitment already under way.
     */
    public Order submit(Campaign campaign, OrderRequest request)
            throws ValidationException, NotFoundException, AuthorizationException, ConflictException {
        OrderType type = OrderType.fromWireName(request.orderType())
                .orElseThrow(() -> new ValidationException("Unknown order type '" + request.orderType() + "'"));
        if (request.executePart() != null && request.executeDay() == null) {
            throw new ValidationException("execute_part needs an execute_day");
        }
        if (request.executeDay() != null && request.executeDay() < 0) {
            throw new ValidationException("execute_day must not be negative");
        }
        if (type.requiresArmy() && request.armyId() == null) {
            throw new ValidationException(type.wireName() + " needs an acting army");
        }
        OrderParameters parameters = parser.parse(type, request.parameters());

        Commander commander = campaign.requireCommander(request.commanderId());
        if (!commander.isActive()) {
            throw new AuthorizationException("Commander " + commander.getId() + " is " + commander.getStatus()
                    + " and cannot give orders");
        }
        Army army = null;
        if (request.armyId() != null) {
            army = campaign.requireArmy(request.armyId());
            if (!Objects.equals(army.getCommanderId(), commander.getId())) {
                throw new AuthorizationException("Commander " + commander.getId() + " does not command army "
                        + army.getId());
            }
        }
        checkReferences(campaign, commander, parameters);

        Order order = new Order(campaign.allocateId(), campaign.allocateOrderSequence(), commander.getId(),
                request.armyId(), parameters, request.executeDay(), request.executePart(), request.priority(),
                campaign.getCurrentTick());
        campaign.addOrder(order);
        enqueue(campaign, type.requiresArmy() ? army.getPendingOrderIds() : commander.getPendingOrderIds(), order);
        LOG.debug("Order {} ({}) queued for commander {}, due {}", order.getId(), type.wireName(), commander.getId(),
                order.getDueTick());
        return order;
    }

    private void checkReferences(Campaign campaign, Commander commander, OrderParameters parameters)
            throws NotFoundException, AuthorizationException, ConflictException {
        switch (parameters.type()) {
            case SUPPLY_TRANSFER:
                campaign.requireArmy(((OrderParameters.SupplyTransfer) parameters).targetArmyId());
                break;
            case BESIEGE:
                campaign.requireStronghold(((OrderParameters.Besiege) parameters).strongholdId());
                break;
            case ASSAULT:
                campaign.requireStronghold(((OrderParameters.Assault) parameters).strongholdId());
                break;
            case EMBARK:
                campaign.requireShip(((OrderParameters.Embark) parameters).shipId());
                break;
            case NAVAL_MOVE: {
                Ship ship = campaign.requireShip(((OrderParameters.NavalMove) parameters).shipId());
                if (ship.getFactionId() != commander.getFactionId()) {
                    throw new AuthorizationException("Ship " + ship.getId() + " does not sail for faction "
                            + commander.getFactionId());
                }
                break;
            }
            case SEND_MESSAGE:
                campaign.requireCommander(((OrderParameters.SendMessage) parameters).recipientId());
                break;
            case LAUNCH_OPERATION:
                checkOperation(campaign, commander, (OrderParameters.LaunchOperation) parameters);
                break;
            case RAISE_ARMY:
                checkRecruitment(campaign, commander, (OrderParameters.RaiseArmy) parameters);
                break;
            case HARRY:
                campaign.requireArmy(((OrderParameters.Harry) parameters).targetArmyId());
                break;
            case MOVE:
            case REST:
            case FORAGE:
            case TORCH:
            case DISEMBARK:
                // Routes and hexes are judged when the order is carried out.
                break;
            default:
                throw new IllegalStateException("Unhandled order type " + parameters.type());
        }
    }

    private void checkOperation(Campaign campaign, Commander commander, OrderParameters.LaunchOperation launch)
            throws NotFoundException, AuthorizationException {
        if (launch.isContinuation()) {
            Operation operation = campaign.requireOperation(launch.operationId());
            if (operation.getCommanderId() != commander.getId()) {
                throw new AuthorizationException("Operation " + operation.getId() + " belongs to commander "
                        + operation.getCommanderId());
            }
            return;
        }
        OperationTarget target = launch.target();
        switch (target.kind()) {
            case ARMY:
                campaign.requireArmy(target.id());
                break;
            case STRONGHOLD:
                campaign.requireStronghold(target.id());
                break;
            case COMMANDER:
                campaign.requireCommander(target.id());
                break;
            default:
                throw new IllegalStateException("Unhandled target kind " + target.kind());
        }
    }

    private void checkRecruitment(Campaign campaign, Commander commander, OrderParameters.RaiseArmy raise)
            throws NotFoundException, AuthorizationException, ConflictException {
        if (raise.isContinuation()) {
            RecruitmentProject project = campaign.requireProject(raise.projectId());
            if (project.getIssuingCommanderId() != commander.getId()) {
                throw new AuthorizationException("Recruitment project " + project.getId()
                        + " was not opened by commander " + commander.getId());
            }
            return;
        }
        Stronghold stronghold = campaign.requireStronghold(raise.strongholdId());
        if (!stronghold.isControlledBy(commander.getFactionId())) {
            throw new AuthorizationException("Faction " + commander.getFactionId() + " does not hold stronghold "
                    + stronghold.getId());
        }
        long commanderToBe = raise.commanderId() != null ? raise.commanderId() : commander.getId();
        Commander leader = campaign.requireCommander(commanderToBe);
        if (leader.getFactionId() != commander.getFactionId()) {
            throw new AuthorizationException("Commander " + leader.getId() + " serves another faction");
        }
        if (raise.rallyHexId() != null) {
            campaign.requireHex(raise.rallyHexId());
        }
        for (Long unitTypeId : raise.units().keySet()) {
            campaign.requireUnitType(unitTypeId);
        }

        boolean projectActive = campaign.getProjects().values().stream()
                .anyMatch(p -> p.isActive() && p.getStrongholdId() == stronghold.getId()
                        && p.getCommanderToBeId() == commanderToBe);
        boolean orderPending = campaign.getOrders().values().stream()
                .filter(o -> o.getStatus() == OrderStatus.PENDING && o.getType() == OrderType.RAISE_ARMY)
                .anyMatch(o -> {
                    OrderParameters.RaiseArmy pending = (OrderParameters.RaiseArmy) o.getParameters();
                    long pendingLeader = pending.commanderId() != null ? pending.commanderId() : o.getCommanderId();
                    return !pending.isContinuation() && Objects.equals(pending.strongholdId(), stronghold.getId())
                            && pendingLeader == commanderToBe;
                });
        if (projectActive || orderPending) {
            throw new ConflictException("Recruitment at stronghold " + stronghold.getId() + " for commander "
                    + commanderToBe + " is already under way; quote its project_id to continue it");
        }
        if (campaign.findArmyOf(commanderToBe).isPresent()) {
            throw new ConflictException("Commander " + commanderToBe + " already commands an army");
        }
    }

    private static void enqueue(Campaign campaign, List<Long> queue, Order order) {
        Map<Long, Order> orders = campaign.getOrders();
        int index = 0;
        while (index < queue.size()) {
            Order queued = orders.get(queue.get(index));
            if (queued != null && Order.DISPATCH_ORDER.compare(order, queued) < 0) {
                break;
            }
            index++;
        }
        queue.add(index, order.getId());
    }

    /**
     * Cancels a live order. Cancelling a running raise_army order abandons its recruitment.
     *
     * @return the cancelled order.
     * @throws NotFoundException     if the order does not exist.
     * @throws InvalidStateException if the order has already finished.
     */
    public Order cancel(Campaign campaign, long orderId, RollService rolls)
            throws NotFoundException, InvalidStateException {
        Order order = campaign.requireOrder(orderId);
        if (order.getStatus().isTerminal()) {
            throw new InvalidStateException("Order " + orderId + " is already " + order.getStatus());
        }
        boolean wasExecuting = order.getStatus() == OrderStatus.EXECUTING;
        order.transitionTo(OrderStatus.CANCELLED);
        campaign.dequeue(order);
        if (wasExecuting && order.getType() == OrderType.RAISE_ARMY) {
            rules.recruitment().findActiveByOrder(campaign, orderId)
                    .ifPresent(project -> rules.recruitment().abandon(campaign, project, "order cancelled", rolls));
        }
        LOG.debug("Order {} cancelled", orderId);
        return order;
    }

    /**
     * Runs every pending order due at the current tick, in dispatch order.
     *
     * @return the number of orders dispatched.
     * @throws InvariantViolationException if a resolver broke an engine invariant.
     */
    public int dispatchDue(Campaign campaign, RollService rolls) {
        List<Order> due = campaign.getOrders().values().stream()
                .filter(order -> order.getStatus() == OrderStatus.PENDING && order.isDue(rolls.tick()))
                .sorted(Order.DISPATCH_ORDER)
                .collect(Collectors.toList());
        for (Order order : due) {
            // An earlier order of this part may have cancelled or finished it.
            if (order.getStatus() == OrderStatus.PENDING) {
                execute(campaign, order, rolls);
            }
        }
        return due.size();
    }

    private void execute(Campaign campaign, Order order, RollService rolls) {
        order.transitionTo(OrderStatus.EXECUTING);
        try {
            OrderResult result = route(campaign, order, rolls);
            if (result == null) {
                LOG.debug("Order {} keeps running after {}", order.getId(), rolls.tick());
                return;
            }
            order.setResult(result);
            order.transitionTo(OrderStatus.COMPLETED);
            campaign.dequeue(order);
            LOG.debug("Order {} completed: {}", order.getId(), result.summary());
        } catch (CampaignRuleException e) {
            fail(campaign, order, e.errorType(), e.getMessage(), rolls);
            LOG.debug("Order {} failed with {}: {}", order.getId(), e.errorType(), e.getMessage());
        } catch (InvariantViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(campaign, order, "internal", e.toString(), rolls);
            LOG.warn("Order {} failed unexpectedly on {}", order.getId(), rolls.tick(), e);
        }
    }

    private void fail(Campaign campaign, Order order, String errorType, String message, RollService rolls) {
        order.setResult(OrderResult.failed(errorType, message));
        order.transitionTo(OrderStatus.FAILED);
        campaign.dequeue(order);
        rolls.audit(AuditSubsystem.SCHEDULER, order.subject(), Map.of("error_type", errorType),
                order.getType().wireName() + " failed: " + message);
    }

    private OrderResult route(Campaign campaign, Order order, RollService rolls) throws CampaignRuleException {
        Commander commander = campaign.requireCommander(order.getCommanderId());
        if (!commander.isActive()) {
            throw new InvalidStateException("Commander " + commander.getId() + " is " + commander.getStatus());
        }
        Army army = order.getType().requiresArmy() ? actingArmy(campaign, order) : null;
        OrderParameters parameters = order.getParameters();
        String subject = order.subject();
        switch (order.getType()) {
            case MOVE:
                return rules.logistics().resolveMove(campaign, army, (OrderParameters.Move) parameters, rolls, subject);
            case REST:
                return rules.logistics().resolveRest(campaign, army, (OrderParameters.Rest) parameters, rolls, subject);
            case FORAGE:
                return rules.logistics().resolveForage(campaign, army, (OrderParameters.Forage) parameters, rolls,
                        subject);
            case TORCH:
                return rules.logistics().resolveTorch(campaign, army, (OrderParameters.Torch) parameters, rolls,
                        subject);
            case SUPPLY_TRANSFER:
                return rules.logistics().resolveSupplyTransfer(campaign, army,
                        (OrderParameters.SupplyTransfer) parameters, rolls, subject);
            case BESIEGE:
                return rules.combat().resolveBesiege(campaign, army, (OrderParameters.Besiege) parameters, rolls,
                        subject);
            case ASSAULT:
                return rules.combat().resolveAssault(campaign, army, (OrderParameters.Assault) parameters, rolls,
                        subject);
            case EMBARK:
                return rules.naval().resolveEmbark(campaign, army, (OrderParameters.Embark) parameters, rolls,
                        subject);
            case DISEMBARK:
                return rules.naval().resolveDisembark(campaign, army, rolls, subject);
            case NAVAL_MOVE:
                return rules.naval().resolveNavalMove(campaign, (OrderParameters.NavalMove) parameters, rolls,
                        subject);
            case SEND_MESSAGE:
                return rules.messaging().dispatch(campaign, commander, (OrderParameters.SendMessage) parameters,
                        rolls, subject);
            case LAUNCH_OPERATION:
                return rules.operations().launch(campaign, army, (OrderParameters.LaunchOperation) parameters,
                        rolls, subject);
            case RAISE_ARMY: {
                OrderParameters.RaiseArmy raise = (OrderParameters.RaiseArmy) parameters;
                if (raise.isContinuation()) {
                    return rules.recruitment().report(campaign, raise);
                }
                rules.recruitment().open(campaign, commander, order, raise, rolls);
                return null;
            }
            case HARRY:
                return rules.harrying().resolveHarry(campaign, army, (OrderParameters.Harry) parameters, rolls,
                        subject);
            default:
                throw new IllegalStateException("Unhandled order type " + order.getType());
        }
    }

    private Army actingArmy(Campaign campaign, Order order) throws CampaignRuleException {
        Army army = campaign.requireArmy(order.getArmyId());
        if (!Objects.equals(army.getCommanderId(), order.getCommanderId())) {
            throw new AuthorizationException("Commander " + order.getCommanderId() + " no longer commands army "
                    + army.getId());
        }
        if (army.isRouted()) {
            throw new InvalidStateException("Army " + army.getId() + " is routed");
        }
        return army;
    }
}
