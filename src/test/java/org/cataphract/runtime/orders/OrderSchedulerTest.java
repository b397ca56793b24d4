package org.cataphract.runtime.orders;

import org.cataphract.config.RulesConfig;
import org.cataphract.junit.extensions.logging.ExpectLog;
import org.cataphract.junit.extensions.logging.LogLevel;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.api.AuthorizationException;
import org.cataphract.runtime.api.CampaignRuleException;
import org.cataphract.runtime.api.ConflictException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.api.OrderRequest;
import org.cataphract.runtime.api.ValidationException;
import org.cataphract.runtime.audit.AuditEntry;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.RecruitmentProject;
import org.cataphract.runtime.model.StrongholdType;
import org.cataphract.runtime.rules.LogisticsResolver;
import org.cataphract.runtime.rules.RuleSet;
import org.cataphract.testutils.ScriptedRollSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.cataphract.testutils.CampaignFixtures.BLUE;
import static org.cataphract.testutils.CampaignFixtures.RED;
import static org.cataphract.testutils.CampaignFixtures.army;
import static org.cataphract.testutils.CampaignFixtures.campaign;
import static org.cataphract.testutils.CampaignFixtures.commander;
import static org.cataphract.testutils.CampaignFixtures.hex;
import static org.cataphract.testutils.CampaignFixtures.stronghold;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link OrderScheduler}: submission checks, queueing, cancellation
 * and dispatch of due orders.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class OrderSchedulerTest {

    private final RulesConfig config = RulesConfig.defaults();
    @Mock
    private RuleSet mockRules;
    @Mock
    private LogisticsResolver mockLogistics;
    private OrderScheduler scheduler;
    private Campaign campaign;
    private Army redArmy;

    @BeforeEach
    void setUp() {
        scheduler = new OrderScheduler(new RuleSet(config));
        campaign = campaign(11L);
        commander(campaign, 21, RED, hex(0));
        commander(campaign, 22, BLUE, hex(1));
        commander(campaign, 23, RED, hex(2));
        redArmy = army(campaign, config, 31, 21L, hex(0), 1000, 0, 0);
        army(campaign, config, 32, 22L, hex(1), 1000, 0, 0);
        stronghold(campaign, 41, hex(2), StrongholdType.TOWN, RED, 10, 1);
        stronghold(campaign, 42, hex(3), StrongholdType.CITY, BLUE, 15, 2);
    }

    private RollService rolls() {
        return new RollService(new ScriptedRollSource(3), campaign.getAuditLog(), campaign.getCurrentTick());
    }

    private static Map<String, Object> moveTo(long hexId) {
        return Map.of("legs", List.of(Map.of("to_hex_id", hexId, "distance", 6.0, "on_road", true)));
    }

    @Test
    @DisplayName("Submitted orders are pending and queued on the acting army")
    void submitQueuesOnArmy() throws CampaignRuleException {
        Order order = scheduler.submit(campaign, OrderRequest.of(21, 31L, "move", moveTo(hex(1))));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getType()).isEqualTo(OrderType.MOVE);
        assertThat(redArmy.getPendingOrderIds()).containsExactly(order.getId());
        assertThat(campaign.getOrders()).containsKey(order.getId());
    }

    @Test
    @DisplayName("Army queues follow due tick, then priority, then submission order")
    void queueOrder() throws CampaignRuleException {
        Order later = scheduler.submit(campaign,
                new OrderRequest(21, 31L, "rest", Map.of("days", 1), 2, DayPart.MORNING, 0));
        Order first = scheduler.submit(campaign, OrderRequest.of(21, 31L, "rest", Map.of("days", 1)));
        Order urgent = scheduler.submit(campaign,
                new OrderRequest(21, 31L, "rest", Map.of("days", 2), null, null, 5));

        assertThat(redArmy.getPendingOrderIds()).containsExactly(urgent.getId(), first.getId(), later.getId());
    }

    @Test
    @DisplayName("Commander-level orders are queued on the commander")
    void commanderLevelQueue() throws CampaignRuleException {
        Order order = scheduler.submit(campaign, OrderRequest.of(21, null, "send_message",
                Map.of("recipient_id", 23, "content", "Meet at the town")));

        assertThat(campaign.getCommanders().get(21L).getPendingOrderIds()).containsExactly(order.getId());
        assertThat(redArmy.getPendingOrderIds()).isEmpty();
    }

    @Test
    @DisplayName("Malformed requests fail validation")
    void validation() {
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(21, 31L, "parley", Map.of())))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(21, null, "move", moveTo(hex(1)))))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> scheduler.submit(campaign,
                new OrderRequest(21, 31L, "rest", Map.of("days", 1), null, DayPart.EVENING, 0)))
                .isInstanceOf(ValidationException.class);
        assertThat(campaign.getOrders()).isEmpty();
    }

    @Test
    @DisplayName("Only the army's own commander, and only an active one, may give orders")
    void authorization() {
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(22, 31L, "rest", Map.of("days", 1))))
                .isInstanceOf(AuthorizationException.class);

        campaign.getCommanders().get(21L).setStatus(Commander.Status.CAPTURED);
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(21, 31L, "rest", Map.of("days", 1))))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("References to missing entities are rejected")
    void missingReferences() {
        assertThatThrownBy(() -> scheduler.submit(campaign,
                OrderRequest.of(21, 31L, "besiege", Map.of("stronghold_id", 999))))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(99, 31L, "rest", Map.of("days", 1))))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Recruiting at a stronghold the faction does not hold is not authorized")
    void recruitmentNeedsOwnStronghold() {
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(23, null, "raise_army",
                Map.of("stronghold_id", 42, "units", Map.of("10", 500)))))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("A second recruitment for the same stronghold and commander conflicts")
    void recruitmentConflict() throws CampaignRuleException {
        Map<String, Object> raise = Map.of("stronghold_id", 41, "units", Map.of("10", 500));
        scheduler.submit(campaign, OrderRequest.of(23, null, "raise_army", raise));

        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(23, null, "raise_army", raise)))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> scheduler.submit(campaign, OrderRequest.of(21, null, "raise_army", raise)))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("already commands");
    }

    @Test
    @DisplayName("Cancelling a pending order dequeues it; a finished order cannot be cancelled")
    void cancel() throws CampaignRuleException {
        Order order = scheduler.submit(campaign, OrderRequest.of(21, 31L, "rest", Map.of("days", 1)));

        scheduler.cancel(campaign, order.getId(), rolls());

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(redArmy.getPendingOrderIds()).isEmpty();
        assertThatThrownBy(() -> scheduler.cancel(campaign, order.getId(), rolls()))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> scheduler.cancel(campaign, 9999, rolls()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Cancelling a running recruitment succeeds and abandons its project")
    void cancelExecutingRecruitment() throws CampaignRuleException {
        Order order = scheduler.submit(campaign, OrderRequest.of(23, null, "raise_army",
                Map.of("stronghold_id", 41, "units", Map.of("10", 500))));
        scheduler.dispatchDue(campaign, rolls());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.EXECUTING);
        RecruitmentProject project = campaign.getProjects().values().iterator().next();
        assertThat(project.isActive()).isTrue();

        scheduler.cancel(campaign, order.getId(), rolls());

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(project.getStatus()).isEqualTo(RecruitmentProject.Status.ABANDONED);
        assertThat(campaign.getAuditLog().entries()).last()
                .satisfies(e -> assertThat(e.effect()).contains("recruitment abandoned: order cancelled"));
    }

    @Test
    @DisplayName("Due orders are resolved; later orders wait")
    void dispatchDue() throws CampaignRuleException {
        Order now = scheduler.submit(campaign, OrderRequest.of(21, 31L, "rest", Map.of("days", 2)));
        Order later = scheduler.submit(campaign,
                new OrderRequest(21, 31L, "rest", Map.of("days", 1), 3, DayPart.MIDDAY, 0));

        int dispatched = scheduler.dispatchDue(campaign, rolls());

        assertThat(dispatched).isEqualTo(1);
        assertThat(now.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(now.getResult().details()).containsEntry("rest_until_day", 2);
        assertThat(later.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(redArmy.getStatus()).isEqualTo(Army.Status.RESTING);
        assertThat(redArmy.getPendingOrderIds()).containsExactly(later.getId());
    }

    @Test
    @DisplayName("A rule violation fails the order with its error type and an audit entry")
    void ruleViolationFailsOrder() throws CampaignRuleException {
        Order order = scheduler.submit(campaign, OrderRequest.of(21, 31L, "move", moveTo(999)));

        scheduler.dispatchDue(campaign, rolls());

        assertThat(order.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(order.getResult().success()).isFalse();
        assertThat(order.getResult().errorType()).isEqualTo("invalid_route");
        AuditEntry entry = campaign.getAuditLog().entries().get(0);
        assertThat(entry.subsystem()).isEqualTo(AuditSubsystem.SCHEDULER);
        assertThat(entry.subject()).isEqualTo(order.subject());
        assertThat(redArmy.getLocationHexId()).isEqualTo(hex(0));
    }

    @Test
    @DisplayName("A broken command chain at dispatch time fails the order")
    void commanderLostArmy() throws CampaignRuleException {
        Order order = scheduler.submit(campaign, OrderRequest.of(21, 31L, "rest", Map.of("days", 1)));
        redArmy.setCommanderId(23L);

        scheduler.dispatchDue(campaign, rolls());

        assertThat(order.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(order.getResult().errorType()).isEqualTo("authorization");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Order \\d+ failed unexpectedly.*")
    @DisplayName("An unexpected resolver error fails only that order")
    void unexpectedErrorIsContained() throws CampaignRuleException {
        when(mockRules.config()).thenReturn(config);
        when(mockRules.logistics()).thenReturn(mockLogistics);
        when(mockLogistics.resolveRest(any(), any(), any(), any(), anyString()))
                .thenThrow(new IllegalStateException("boom"));
        OrderScheduler failing = new OrderScheduler(mockRules);
        Order broken = failing.submit(campaign, OrderRequest.of(21, 31L, "rest", Map.of("days", 1)));
        Order fine = failing.submit(campaign,
                OrderRequest.of(21, null, "send_message", Map.of("recipient_id", 23, "content", "x")));
        when(mockRules.messaging()).thenReturn(new RuleSet(config).messaging());

        failing.dispatchDue(campaign, rolls());

        assertThat(broken.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(broken.getResult().errorType()).isEqualTo("internal");
        assertThat(fine.getStatus()).isEqualTo(OrderStatus.COMPLETED);
    }
}
