package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Commander;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.RecruitmentProject;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.model.StrongholdType;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.Order;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderStatus;
import org.cataphract.testutils.ScriptedRollSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.cataphract.testutils.CampaignFixtures.BLUE;
import static org.cataphract.testutils.CampaignFixtures.CAVALRY;
import static org.cataphract.testutils.CampaignFixtures.INFANTRY;
import static org.cataphract.testutils.CampaignFixtures.RED;
import static org.cataphract.testutils.CampaignFixtures.campaign;
import static org.cataphract.testutils.CampaignFixtures.commander;
import static org.cataphract.testutils.CampaignFixtures.hex;
import static org.cataphract.testutils.CampaignFixtures.stronghold;

/**
 * Unit tests for {@link RecruitmentEngine}: a city of the red faction musters
 * 900 soldiers for commander 23, rallying one hex away.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RecruitmentEngineTest {

    private final RulesConfig config = RulesConfig.defaults();
    private final RecruitmentEngine recruitment = new RecruitmentEngine(config, new ArmyMath(config));
    private Campaign campaign;
    private Commander issuer;
    private Stronghold city;
    private Order order;

    @BeforeEach
    void setUp() {
        campaign = campaign(30L);
        issuer = commander(campaign, 21, RED, hex(2));
        commander(campaign, 23, RED, hex(2));
        city = stronghold(campaign, 41, hex(2), StrongholdType.CITY, RED, 15, 2);
        OrderParameters.RaiseArmy raise = new OrderParameters.RaiseArmy(null, 41L, 23L,
                Map.of(INFANTRY, 800, CAVALRY, 100), 5, hex(3));
        order = new Order(campaign.allocateId(), campaign.allocateOrderSequence(), 21, null, raise, null, null, 0,
                Tick.of(0, DayPart.MORNING));
        campaign.addOrder(order);
        order.transitionTo(OrderStatus.EXECUTING);
    }

    private RollService rolls() {
        return new RollService(new ScriptedRollSource(1), campaign.getAuditLog(), Tick.of(0, DayPart.MIDDAY));
    }

    private RecruitmentProject open() throws Exception {
        return recruitment.open(campaign, issuer, order, (OrderParameters.RaiseArmy) order.getParameters(), rolls());
    }

    @Test
    @DisplayName("A city musters its levy in half the nominal day-parts and the order completes with the army")
    void musterSpawnsArmy() throws Exception {
        RecruitmentProject project = open();
        assertThat(order.getResult().details()).containsEntry("project_id", project.getId());
        int parts = config.recruitment().musterDays() * Tick.PARTS_PER_DAY / 2;
        assertThat(project.getRequiredProgress()).isEqualTo(parts * 2);

        for (int i = 1; i < parts; i++) {
            recruitment.advance(campaign, project, rolls());
        }
        assertThat(project.isActive()).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.EXECUTING);

        recruitment.advance(campaign, project, rolls());

        assertThat(project.getStatus()).isEqualTo(RecruitmentProject.Status.COMPLETED);
        Army raised = campaign.getArmies().get(project.getSpawnedArmyId());
        assertThat(raised.getCommanderId()).isEqualTo(23L);
        assertThat(raised.getLocationHexId()).isEqualTo(hex(3));
        assertThat(raised.getSoldiers()).isEqualTo(900);
        assertThat(raised.getNoncombatants()).isEqualTo(225);
        assertThat(raised.getSuppliesCurrent()).isPositive().isLessThanOrEqualTo(raised.getSuppliesCapacity());
        assertThat(campaign.getCommanders().get(23L).getCurrentHexId()).isEqualTo(hex(3));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getResult().details()).containsEntry("army_id", raised.getId());
    }

    @Test
    @DisplayName("Losing the stronghold abandons the project and fails the order")
    void strongholdLost() throws Exception {
        RecruitmentProject project = open();
        city.setControllingFactionId(BLUE);

        recruitment.advance(campaign, project, rolls());

        assertThat(project.getStatus()).isEqualTo(RecruitmentProject.Status.ABANDONED);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(order.getResult().errorType()).isEqualTo("invalid_state");
        assertThat(campaign.getArmies()).isEmpty();
    }

    @Test
    @DisplayName("Projects cannot be opened at foreign strongholds")
    void foreignStronghold() {
        city.setControllingFactionId(BLUE);

        assertThatThrownBy(this::open).isInstanceOf(InvalidStateException.class);
        assertThat(campaign.getProjects()).isEmpty();
    }

    @Test
    @DisplayName("Progress is reported to orders quoting the project id")
    void report() throws Exception {
        RecruitmentProject project = open();
        recruitment.advance(campaign, project, rolls());

        assertThat(recruitment.report(campaign, new OrderParameters.RaiseArmy(project.getId(), null, null, null, 0,
                null)).details()).containsEntry("progress", 2);
        assertThat(recruitment.findActiveByOrder(campaign, order.getId())).contains(project);
    }
}
