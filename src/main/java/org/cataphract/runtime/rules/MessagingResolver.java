package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.InvalidRouteException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.audit.Roll;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.Message;
import org.cataphract.runtime.model.TerritoryType;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Couriers. Transit time follows the shortest land path between sender and
 * recipient; the risk of interception depends on the territory crossed and is
 * drawn once, when the message leaves. Intercepted messages are lost for good.
 */
public class MessagingResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MessagingResolver.class);

    private final RulesConfig rules;

    public MessagingResolver(RulesConfig rules) {
        this.rules = rules;
    }

    /**
     * @return the chance that a courier crossing this territory is intercepted.
     */
    public double interceptionProbability(TerritoryType territory) {
        return 1.0 / rules.messaging().interceptionDie().get(territory);
    }

    /**
     * @param miles     Distance the courier rides.
     * @param territory Territory crossed.
     * @return day-parts in transit, at least one.
     */
    public long transitParts(double miles, TerritoryType territory) {
        double days = miles / rules.messaging().speed().get(territory);
        return Math.max(1L, (long) Math.ceil(days * Tick.PARTS_PER_DAY));
    }

    public OrderResult dispatch(Campaign campaign, Commander sender, OrderParameters.SendMessage send,
                                RollService rolls, String subject)
            throws InvalidRouteException, InvalidStateException, NotFoundException {
        Commander recipient = campaign.requireCommander(send.recipientId());
        long from = lastKnownLocation(campaign, sender).orElseThrow(() -> new InvalidStateException(
                "Location of sender " + sender.getId() + " is unknown"));
        long to = lastKnownLocation(campaign, recipient).orElseThrow(() -> new InvalidStateException(
                "Last known location of recipient " + recipient.getId() + " is unknown"));
        OptionalInt hops = campaign.getMap().shortestLandPath(from, to);
        if (hops.isEmpty()) {
            throw new InvalidRouteException("No land route from hex " + from + " to hex " + to);
        }

        TerritoryType territory = send.territoryType();
        double miles = hops.getAsInt() * rules.messaging().milesPerHex();
        long parts = transitParts(miles, territory);
        double probability = interceptionProbability(territory);
        int die = rules.messaging().interceptionDie().get(territory);

        Message message = new Message(campaign.allocateId(), sender.getId(), recipient.getId(), send.content(),
                territory, rolls.tick());
        message.setDeliveryTick(rolls.tick().plusParts(parts));
        message.setInterceptionProbability(probability);
        Roll roll = rolls.roll("message:" + message.getId() + ":interception", 1, die, send.interceptionFixedRoll());
        boolean intercepted = roll.total() == 1;
        if (intercepted) {
            message.markLost();
        }
        campaign.addMessage(message);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("territory", territory.wireName());
        inputs.put("hops", hops.getAsInt());
        inputs.put("miles", miles);
        inputs.put("transit_parts", parts);
        inputs.put("interception_probability", probability);
        String effect = intercepted
                ? "message " + message.getId() + " intercepted"
                : "message " + message.getId() + " due " + message.getDeliveryTick();
        rolls.audit(AuditSubsystem.MESSAGING, subject, inputs, effect);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message_id", message.getId());
        details.put("delivery_day", message.getDeliveryTick().day());
        details.put("delivery_part", message.getDeliveryTick().part().wireName());
        details.put("interception_probability", probability);
        details.put("intercepted", intercepted);
        return OrderResult.completed(effect, details);
    }

    /**
     * Hands the message over if its delivery tick has come.
     */
    public void deliverDue(Campaign campaign, Message message, RollService rolls) {
        if (message.getStatus() != Message.Status.IN_TRANSIT || message.getDeliveryTick().isAfter(rolls.tick())) {
            return;
        }
        message.markDelivered();
        rolls.audit(AuditSubsystem.MESSAGING, "message:" + message.getId(), Map.of(),
                "delivered to commander " + message.getRecipientId());
        LOG.debug("Message {} delivered to commander {} on {}", message.getId(), message.getRecipientId(), rolls.tick());
    }

    private Optional<Long> lastKnownLocation(Campaign campaign, Commander commander) {
        if (commander.getCurrentHexId() != null) {
            return Optional.of(commander.getCurrentHexId());
        }
        return campaign.findArmyOf(commander.getId()).map(Army::getLocationHexId);
    }
}
