package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Message;
import org.cataphract.runtime.rules.RuleSet;

import java.util.Collection;
import java.util.stream.Collectors;

public class MessageDeliveryStep extends PerEntityStep<Message> {

    public static final String NAME = "message-delivery";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Collection<Message> entities(Campaign campaign, RollService rolls) {
        return campaign.getMessages().values().stream()
                .filter(message -> message.getStatus() == Message.Status.IN_TRANSIT)
                .collect(Collectors.toList());
    }

    @Override
    protected String describe(Message message) {
        return "message:" + message.getId();
    }

    @Override
    protected AuditSubsystem subsystem() {
        return AuditSubsystem.MESSAGING;
    }

    @Override
    protected void applyTo(Campaign campaign, RuleSet rules, Message message, RollService rolls) {
        rules.messaging().deliverDue(campaign, message, rolls);
    }
}
