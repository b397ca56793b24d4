package org.cataphract.runtime;

import org.cataphract.config.RulesConfig;
import org.cataphract.junit.extensions.logging.ExpectLog;
import org.cataphract.junit.extensions.logging.LogLevel;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.api.CampaignSnapshot;
import org.cataphract.runtime.api.CommitException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.OrderRequest;
import org.cataphract.runtime.api.TickAbortedException;
import org.cataphract.runtime.internal.services.SnapshotWriter;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.CampaignStatus;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.StrongholdType;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.Order;
import org.cataphract.runtime.orders.OrderStatus;
import org.cataphract.runtime.spi.ICampaignCommitter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.cataphract.testutils.CampaignFixtures.BLUE;
import static org.cataphract.testutils.CampaignFixtures.RED;
import static org.cataphract.testutils.CampaignFixtures.army;
import static org.cataphract.testutils.CampaignFixtures.campaign;
import static org.cataphract.testutils.CampaignFixtures.commander;
import static org.cataphract.testutils.CampaignFixtures.hex;
import static org.cataphract.testutils.CampaignFixtures.rowMap;
import static org.cataphract.testutils.CampaignFixtures.stronghold;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Integration tests for {@link CampaignEngine}: whole days resolved through the
 * scheduler, the rules and the host's committer.
 */
@Tag("integration")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class CampaignEngineTest {

    private final RulesConfig config = RulesConfig.defaults();

    @Mock
    private ICampaignCommitter committer;

    /**
     * Red marches on a blue town and besieges it while blue rests nearby; dice
     * come from the campaign seed.
     */
    private Campaign scenario(long id, long seed) {
        Campaign campaign = campaign(id, seed, rowMap(6, 2));
        commander(campaign, 21, RED, hex(0));
        commander(campaign, 22, BLUE, hex(5));
        army(campaign, config, 31, 21L, hex(0), 2000, 200, 10);
        army(campaign, config, 32, 22L, hex(5), 1500, 0, 0);
        stronghold(campaign, 41, hex(2), StrongholdType.TOWN, BLUE, 10, 1);
        return campaign;
    }

    private static void submitPlan(CampaignEngine engine, Campaign campaign) throws Exception {
        engine.submitOrder(campaign, OrderRequest.of(21, 31L, "move", Map.of("legs", List.of(
                Map.of("to_hex_id", hex(1), "distance", 6.0, "on_road", true),
                Map.of("to_hex_id", hex(2), "distance", 6.0, "on_road", true)))));
        engine.submitOrder(campaign, new OrderRequest(21, 31L, "besiege", Map.of("stronghold_id", 41,
                "siege_engines", 1), 1, DayPart.MORNING, 0));
        engine.submitOrder(campaign, OrderRequest.of(22, 32L, "rest", Map.of("days", 2)));
        engine.submitOrder(campaign, OrderRequest.of(22, null, "send_message",
                Map.of("recipient_id", 21, "content", "Yield", "territory_type", "hostile")));
    }

    @Test
    @DisplayName("Advancing a day commits one snapshot per day-part and resolves the orders due")
    void advanceCommitsEachPart() throws Exception {
        List<CampaignSnapshot> committed = Collections.synchronizedList(new ArrayList<>());
        CampaignEngine engine = new CampaignEngine(config, committed::add);
        Campaign campaign = scenario(1, 77L);
        submitPlan(engine, campaign);

        CampaignSnapshot last = engine.advance(campaign, 2);

        assertThat(committed).hasSize(2 * Tick.PARTS_PER_DAY);
        assertThat(committed.get(0).resolvedTick()).isEqualTo(Tick.of(0, DayPart.MORNING));
        assertThat(committed.get(0).currentTick()).isEqualTo(Tick.of(0, DayPart.MIDDAY));
        assertThat(last.currentTick()).isEqualTo(Tick.of(2, DayPart.MORNING));
        assertThat(campaign.getCurrentTick()).isEqualTo(Tick.of(2, DayPart.MORNING));
        assertThat(last.stateJson()).isEqualTo(engine.stateJson(campaign));

        assertThat(campaign.getOrders().values()).extracting(Order::getStatus)
                .doesNotContain(OrderStatus.PENDING, OrderStatus.EXECUTING);
        assertThat(campaign.getArmies().get(31L).getLocationHexId()).isEqualTo(hex(2));
        assertThat(campaign.findActiveSiege(41)).isPresent();

        int entries = committed.stream().mapToInt(s -> s.auditEntries().size()).sum();
        assertThat(entries).isEqualTo(campaign.getAuditLog().size());
        assertThat(engine.getAuditLog(campaign, Tick.of(1, DayPart.MORNING)))
                .allMatch(e -> !e.tick().isAfter(Tick.of(2, DayPart.MORNING))
                        && e.tick().compareTo(Tick.of(1, DayPart.MORNING)) >= 0);
    }

    @Test
    @DisplayName("Identical campaigns with identical orders end in identical states and audits")
    void deterministic() throws Exception {
        CampaignEngine engine = new CampaignEngine(config, snapshot -> { });
        Campaign first = scenario(1, 2024L);
        Campaign second = scenario(1, 2024L);
        submitPlan(engine, first);
        submitPlan(engine, second);

        engine.advance(first, 3);
        engine.advance(second, 3);

        SnapshotWriter writer = new SnapshotWriter();
        assertThat(writer.auditJson(second.getAuditLog().entries()))
                .isEqualTo(writer.auditJson(first.getAuditLog().entries()));
        assertThat(engine.stateJson(second)).isEqualTo(engine.stateJson(first));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Campaign .* rolled back.*")
    @DisplayName("A failed commit rolls the part back and keeps earlier parts")
    void failedCommitRollsBack() throws Exception {
        CampaignEngine engine = new CampaignEngine(config, committer);
        Campaign campaign = scenario(1, 9L);
        submitPlan(engine, campaign);
        doNothing().doThrow(new CommitException("store unavailable")).when(committer).commit(any());

        assertThatThrownBy(() -> engine.advance(campaign, 1))
                .isInstanceOf(TickAbortedException.class);

        // The morning stays committed; the failed midday is undone.
        assertThat(campaign.getCurrentTick()).isEqualTo(Tick.of(0, DayPart.MIDDAY));
        ArgumentCaptor<CampaignSnapshot> snapshots = ArgumentCaptor.forClass(CampaignSnapshot.class);
        verify(committer, times(2)).commit(snapshots.capture());
        assertThat(engine.stateJson(campaign)).isEqualTo(snapshots.getAllValues().get(0).stateJson());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Campaign .* rolled back.*")
    @DisplayName("The aborted part is reported and the campaign is left as before it")
    void abortedPartReported() throws Exception {
        CampaignEngine engine = new CampaignEngine(config, snapshot -> {
            throw new CommitException("store unavailable");
        });
        Campaign campaign = scenario(1, 9L);
        submitPlan(engine, campaign);
        String before = engine.stateJson(campaign);

        assertThatThrownBy(() -> engine.advance(campaign, 1))
                .isInstanceOf(TickAbortedException.class)
                .hasCauseInstanceOf(CommitException.class)
                .satisfies(e -> assertThat(((TickAbortedException) e).getTick())
                        .isEqualTo(Tick.of(0, DayPart.MORNING)));

        assertThat(engine.stateJson(campaign)).isEqualTo(before);
        assertThat(campaign.getAuditLog().size()).isZero();
        assertThat(campaign.getOrders().values()).extracting(Order::getStatus).containsOnly(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("Different campaigns advance in parallel without interfering")
    void campaignsAdvanceConcurrently() throws Exception {
        CampaignEngine engine = new CampaignEngine(config, snapshot -> { });
        List<Campaign> campaigns = new ArrayList<>();
        for (long id = 1; id <= 4; id++) {
            Campaign campaign = scenario(id, 500L);
            submitPlan(engine, campaign);
            campaigns.add(campaign);
        }
        Campaign reference = scenario(99, 500L);
        submitPlan(engine, reference);
        engine.advance(reference, 2);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<CampaignSnapshot>> futures = new ArrayList<>();
            for (Campaign campaign : campaigns) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return engine.advance(campaign, 2);
                    } catch (InvalidStateException | TickAbortedException e) {
                        throw new IllegalStateException(e);
                    }
                }, executor));
            }

            await().atMost(Duration.ofSeconds(30))
                    .until(() -> futures.stream().allMatch(CompletableFuture::isDone));

            for (CompletableFuture<CampaignSnapshot> future : futures) {
                assertThat(future).isCompletedWithValueMatching(
                        s -> s.currentTick().equals(Tick.of(2, DayPart.MORNING)));
            }
            SnapshotWriter writer = new SnapshotWriter();
            for (Campaign campaign : campaigns) {
                assertThat(writer.auditJson(campaign.getAuditLog().entries()))
                        .isEqualTo(writer.auditJson(reference.getAuditLog().entries()));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Advancing needs a positive number of days and an active campaign")
    void advancePreconditions() {
        CampaignEngine engine = new CampaignEngine(config, snapshot -> { });
        Campaign campaign = scenario(1, 1L);

        assertThatThrownBy(() -> engine.advance(campaign, 0)).isInstanceOf(IllegalArgumentException.class);

        campaign.setStatus(CampaignStatus.PAUSED);
        assertThatThrownBy(() -> engine.advance(campaign, 1)).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> engine.submitOrder(campaign, OrderRequest.of(21, 31L, "rest",
                Map.of("days", 1)))).isInstanceOf(InvalidStateException.class);
        assertThat(campaign.getCurrentTick()).isEqualTo(Tick.of(0, DayPart.MORNING));
    }
}
