package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Message;
import org.cataphract.runtime.model.TerritoryType;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.cataphract.testutils.ScriptedRollSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.cataphract.testutils.CampaignFixtures.BLUE;
import static org.cataphract.testutils.CampaignFixtures.RED;
import static org.cataphract.testutils.CampaignFixtures.army;
import static org.cataphract.testutils.CampaignFixtures.campaign;
import static org.cataphract.testutils.CampaignFixtures.commander;
import static org.cataphract.testutils.CampaignFixtures.hex;

/**
 * Unit tests for {@link MessagingResolver}: transit time, interception odds and delivery.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class MessagingResolverTest {

    private static final Tick DISPATCH = Tick.of(2, DayPart.MORNING);

    private final RulesConfig config = RulesConfig.defaults();
    private final MessagingResolver messaging = new MessagingResolver(config);
    private Campaign campaign;
    private Commander sender;

    @BeforeEach
    void setUp() {
        campaign = campaign(6L);
        sender = commander(campaign, 21, RED, hex(0));
        commander(campaign, 22, RED, hex(2));
    }

    private RollService rolls(Tick tick) {
        return new RollService(new ScriptedRollSource(4), campaign.getAuditLog(), tick);
    }

    private OrderResult send(TerritoryType territory, Integer fixedRoll) throws Exception {
        return messaging.dispatch(campaign, sender, new OrderParameters.SendMessage(22, "Hold", territory, fixedRoll),
                rolls(DISPATCH), "order:1");
    }

    @Test
    @DisplayName("Interception odds grow with hostility")
    void interceptionOdds() {
        assertEquals(0.05, messaging.interceptionProbability(TerritoryType.FRIENDLY), 1e-9);
        assertEquals(0.1, messaging.interceptionProbability(TerritoryType.NEUTRAL), 1e-9);
        assertEquals(1.0 / 6, messaging.interceptionProbability(TerritoryType.HOSTILE), 1e-9);
    }

    @Test
    @DisplayName("Transit takes at least one day-part")
    void transitParts() {
        assertEquals(1, messaging.transitParts(1.0, TerritoryType.FRIENDLY));
        assertEquals(2, messaging.transitParts(12.0, TerritoryType.NEUTRAL));
        assertEquals(4, messaging.transitParts(36.0, TerritoryType.HOSTILE));
    }

    @Test
    @DisplayName("A courier that is not intercepted delivers when its tick comes")
    void delivered() throws Exception {
        OrderResult result = send(TerritoryType.NEUTRAL, null);

        assertEquals(false, result.details().get("intercepted"));
        Message message = campaign.getMessages().values().iterator().next();
        assertEquals(Tick.of(2, DayPart.EVENING), message.getDeliveryTick());

        messaging.deliverDue(campaign, message, rolls(Tick.of(2, DayPart.MIDDAY)));
        assertFalse(message.isDelivered());

        messaging.deliverDue(campaign, message, rolls(Tick.of(2, DayPart.EVENING)));
        assertTrue(message.isDelivered());
        assertEquals(Message.Status.DELIVERED, message.getStatus());
    }

    @Test
    @DisplayName("An intercepted message is lost and never delivered")
    void intercepted() throws Exception {
        OrderResult result = send(TerritoryType.HOSTILE, 1);

        assertTrue(result.success());
        assertEquals(true, result.details().get("intercepted"));
        Message message = campaign.getMessages().values().iterator().next();
        assertEquals(Message.Status.LOST, message.getStatus());

        messaging.deliverDue(campaign, message, rolls(Tick.of(5, DayPart.NIGHT)));
        assertFalse(message.isDelivered());
    }

    @Test
    @DisplayName("A recipient whose whereabouts are unknown cannot be reached")
    void unknownRecipient() {
        campaign.getCommanders().get(22L).setCurrentHexId(null);

        assertThrows(InvalidStateException.class, () -> send(TerritoryType.FRIENDLY, null));
    }

    @Test
    @DisplayName("The recipient's army stands in for an unknown location")
    void recipientLocatedByArmy() throws Exception {
        commander(campaign, 23, BLUE, null);
        army(campaign, config, 33, 23L, hex(5), 100, 0, 0);

        OrderResult result = messaging.dispatch(campaign, sender,
                new OrderParameters.SendMessage(23, "Parley?", TerritoryType.HOSTILE, null), rolls(DISPATCH), "o");

        assertEquals((Object) (5 * config.messaging().milesPerHex()), campaign.getAuditLog().entries().get(0).inputs().get("miles"));
        assertTrue(result.success());
    }
}
