package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.MercenaryContract;
import org.cataphract.runtime.model.Tick;
import org.cataphract.testutils.ScriptedRollSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cataphract.testutils.CampaignFixtures.RED;
import static org.cataphract.testutils.CampaignFixtures.army;
import static org.cataphract.testutils.CampaignFixtures.campaign;
import static org.cataphract.testutils.CampaignFixtures.commander;
import static org.cataphract.testutils.CampaignFixtures.hex;

/**
 * Unit tests for {@link MercenaryUpkeep}. Army 31 has hired its 100 cavalry
 * (detachment 312) under contract 61 for 300 loot a night.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class MercenaryUpkeepTest {

    private static final long HIRED = 312;

    private final RulesConfig config = RulesConfig.defaults();
    private final MercenaryUpkeep upkeep = new MercenaryUpkeep(config, new ArmyMath(config));
    private Campaign campaign;
    private Army army;
    private MercenaryContract contract;

    @BeforeEach
    void setUp() {
        campaign = campaign(21L);
        commander(campaign, 21, RED, hex(0));
        army = army(campaign, config, 31, 21L, hex(0), 1000, 100, 0);
        army.findDetachment(HIRED).orElseThrow().setMercenaryContractId(61L);
        contract = new MercenaryContract(61, 31, 0);
        campaign.addContract(contract);
    }

    private RollService rolls(int face) {
        return new RollService(new ScriptedRollSource(face), campaign.getAuditLog(), Tick.of(4, DayPart.NIGHT));
    }

    @Test
    @DisplayName("Wages depend on the category of the hired soldiers")
    void wage() {
        assertThat(upkeep.wage(campaign, army.getDetachments())).isEqualTo(1000 + 300);
    }

    @Test
    @DisplayName("Paid mercenaries stay content")
    void paid() {
        army.setLootCarried(500);

        upkeep.settle(campaign, contract, rolls(1));

        assertThat(army.getLootCarried()).isEqualTo(200);
        assertThat(contract.getLastPaidDay()).isEqualTo(4);
        assertThat(contract.getStatus()).isEqualTo(MercenaryContract.Status.ACTIVE);
        assertThat(campaign.getAuditLog().entries()).singleElement()
                .satisfies(e -> assertThat(e.subsystem()).isEqualTo(AuditSubsystem.MERCENARY));
    }

    @Test
    @DisplayName("Unpaid mercenaries cost morale but keep serving during the grace period")
    void unpaid() {
        army.setLootCarried(200);

        upkeep.settle(campaign, contract, rolls(1));

        assertThat(army.getLootCarried()).isEqualTo(200);
        assertThat(contract.getDaysUnpaid()).isEqualTo(1);
        assertThat(contract.getStatus()).isEqualTo(MercenaryContract.Status.UNPAID);
        assertThat(army.getMoraleCurrent()).isEqualTo(8);
        assertThat(army.getSoldiers()).isEqualTo(1100);
        assertThat(campaign.getAuditLog().entries().get(0).rolls()).isEmpty();
    }

    @Test
    @DisplayName("Past the grace period a low roll makes the mercenaries desert")
    void desertion() {
        contract.setDaysUnpaid(config.mercenary().graceDays());

        upkeep.settle(campaign, contract, rolls(1));

        assertThat(contract.isTerminated()).isTrue();
        assertThat(army.getSoldiers()).isEqualTo(1000);
        assertThat(army.findDetachment(HIRED)).isEmpty();
    }

    @Test
    @DisplayName("Past the grace period a high roll keeps the mercenaries grumbling")
    void noDesertion() {
        contract.setDaysUnpaid(config.mercenary().graceDays());

        upkeep.settle(campaign, contract, rolls(6));

        assertThat(contract.getStatus()).isEqualTo(MercenaryContract.Status.UNPAID);
        assertThat(army.getSoldiers()).isEqualTo(1100);
    }

    @Test
    @DisplayName("A contract without hired soldiers ends")
    void noSoldiersLeft() {
        army.findDetachment(HIRED).orElseThrow().setSoldiers(0);

        upkeep.settle(campaign, contract, rolls(1));
        upkeep.settle(campaign, contract, rolls(1));

        assertThat(contract.isTerminated()).isTrue();
        assertThat(campaign.getAuditLog().entries()).hasSize(1);
    }
}
