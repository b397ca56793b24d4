package org.cataphract.runtime.internal.services;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.CampaignSnapshot;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.CampaignStatus;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Tick;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cataphract.testutils.CampaignFixtures.RED;
import static org.cataphract.testutils.CampaignFixtures.army;
import static org.cataphract.testutils.CampaignFixtures.campaign;
import static org.cataphract.testutils.CampaignFixtures.commander;
import static org.cataphract.testutils.CampaignFixtures.hex;

@Tag("unit")
class SnapshotWriterTest {

    private final RulesConfig config = RulesConfig.defaults();
    private final SnapshotWriter writer = new SnapshotWriter();

    private Campaign populated() {
        Campaign campaign = campaign(3L);
        commander(campaign, 21, RED, hex(0));
        army(campaign, config, 31, 21L, hex(0), 1200, 50, 4);
        return campaign;
    }

    @Test
    @DisplayName("Equal campaigns render to identical JSON")
    void canonicalJson() {
        assertThat(writer.stateJson(populated())).isEqualTo(writer.stateJson(populated()));
    }

    @Test
    @DisplayName("A deep copy renders like its original until either changes")
    void copyRendersEqually() {
        Campaign campaign = populated();
        Campaign copy = campaign.deepCopy();
        assertThat(writer.stateJson(copy)).isEqualTo(writer.stateJson(campaign));

        copy.getArmies().get(31L).setLootCarried(10);
        assertThat(writer.stateJson(copy)).isNotEqualTo(writer.stateJson(campaign));
    }

    @Test
    @DisplayName("Snapshots carry the resolved part, the new clock and the part's entries")
    void snapshot() {
        Campaign campaign = populated();
        campaign.setCurrentTick(Tick.of(0, DayPart.MIDDAY));

        CampaignSnapshot snapshot = writer.snapshot(campaign, Tick.of(0, DayPart.MORNING), List.of());

        assertThat(snapshot.campaignId()).isEqualTo(1L);
        assertThat(snapshot.resolvedTick()).isEqualTo(Tick.of(0, DayPart.MORNING));
        assertThat(snapshot.currentTick()).isEqualTo(Tick.of(0, DayPart.MIDDAY));
        assertThat(snapshot.status()).isEqualTo(CampaignStatus.ACTIVE);
        assertThat(snapshot.auditEntries()).isEmpty();
        assertThat(snapshot.stateJson()).contains("\"lootCarried\"");
    }
}
