package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.api.InvalidRouteException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.map.Hex;
import org.cataphract.runtime.map.HexCoord;
import org.cataphract.runtime.map.MapGraph;
import org.cataphract.runtime.map.Terrain;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Ship;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.OrderParameters;
import org.cataphract.runtime.orders.OrderResult;
import org.cataphract.testutils.CampaignFixtures;
import org.cataphract.testutils.ScriptedRollSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.cataphract.testutils.CampaignFixtures.RED;

/**
 * Unit tests for {@link NavalResolver}: embarking, sailing a route and landing.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NavalResolverTest {

    private static final long PORT = 1;
    private static final long SEA_1 = 2;
    private static final long SEA_2 = 3;
    private static final long HARBOUR = 4;
    private static final long INLAND = 5;

    private final RulesConfig config = RulesConfig.defaults();
    private final NavalResolver naval = new NavalResolver(config);
    private Campaign campaign;
    private Army army;
    private Ship ship;

    @BeforeEach
    void setUp() {
        MapGraph map = new MapGraph(List.of(
                new Hex(PORT, new HexCoord(0, 0), Terrain.COAST, 1, 5),
                new Hex(SEA_1, new HexCoord(1, 0), Terrain.WATER, 0, 0),
                new Hex(SEA_2, new HexCoord(2, 0), Terrain.WATER, 0, 0),
                new Hex(HARBOUR, new HexCoord(3, 0), Terrain.COAST, 1, 5),
                new Hex(INLAND, new HexCoord(0, 1), Terrain.FLATLAND, 1, 5)), List.of(), List.of());
        campaign = CampaignFixtures.campaign(4L, map);
        CampaignFixtures.commander(campaign, 21, RED, PORT);
        army = CampaignFixtures.army(campaign, config, 31, 21L, PORT, 500, 0, 0);
        ship = new Ship(51, RED, PORT, 1000);
        campaign.addShip(ship);
    }

    private RollService rolls(Tick tick) {
        return new RollService(new ScriptedRollSource(1), campaign.getAuditLog(), tick);
    }

    @Test
    @DisplayName("An army sails with its ship and lands at the destination")
    void embarkSailAndLand() throws Exception {
        Tick start = Tick.of(0, DayPart.MORNING);
        naval.resolveEmbark(campaign, army, new OrderParameters.Embark(51), rolls(start), "order:1");
        assertThat(army.isEmbarked()).isTrue();
        assertThat(ship.getEmbarkedArmyId()).isEqualTo(31L);

        OrderResult sailing = naval.resolveNavalMove(campaign,
                new OrderParameters.NavalMove(51, List.of(SEA_1, SEA_2, HARBOUR)), rolls(start), "order:2");

        // 18 miles at 48 miles a day take two day-parts.
        assertThat(sailing.details()).containsEntry("arrival_day", 0).containsEntry("arrival_part", "evening");
        assertThat(ship.isSailing()).isTrue();

        naval.arrive(campaign, ship, rolls(Tick.of(0, DayPart.MIDDAY)));
        assertThat(ship.getHexId()).isEqualTo(PORT);

        naval.arrive(campaign, ship, rolls(Tick.of(0, DayPart.EVENING)));
        assertThat(ship.getHexId()).isEqualTo(HARBOUR);
        assertThat(ship.getStatus()).isEqualTo(Ship.Status.AVAILABLE);
        assertThat(army.getLocationHexId()).isEqualTo(HARBOUR);
        assertThat(campaign.getCommanders().get(21L).getCurrentHexId()).isEqualTo(HARBOUR);

        naval.resolveDisembark(campaign, army, rolls(Tick.of(0, DayPart.NIGHT)), "order:3");
        assertThat(army.isEmbarked()).isFalse();
        assertThat(army.getStatus()).isEqualTo(Army.Status.IDLE);
        assertThat(ship.getEmbarkedArmyId()).isNull();
    }

    @Test
    @DisplayName("Routes must run over adjacent sea lanes")
    void invalidSeaRoutes() {
        Tick start = Tick.of(0, DayPart.MORNING);
        assertThatThrownBy(() -> naval.resolveNavalMove(campaign,
                new OrderParameters.NavalMove(51, List.of(INLAND)), rolls(start), "order:1"))
                .isInstanceOf(InvalidRouteException.class)
                .hasMessageContaining("sea lane");
        assertThatThrownBy(() -> naval.resolveNavalMove(campaign,
                new OrderParameters.NavalMove(51, List.of(SEA_2)), rolls(start), "order:1"))
                .isInstanceOf(InvalidRouteException.class)
                .hasMessageContaining("adjacent");
        assertThat(ship.isSailing()).isFalse();
    }

    @Test
    @DisplayName("Ships refuse armies larger than their capacity and landing at sea")
    void embarkLimits() throws Exception {
        army.getDetachments().get(0).setSoldiers(1500);
        assertThatThrownBy(() -> naval.resolveEmbark(campaign, army, new OrderParameters.Embark(51),
                rolls(Tick.of(0, DayPart.MORNING)), "order:1"))
                .isInstanceOf(InvalidRouteException.class);

        army.getDetachments().get(0).setSoldiers(500);
        naval.resolveEmbark(campaign, army, new OrderParameters.Embark(51), rolls(Tick.of(0, DayPart.MORNING)),
                "order:1");
        ship.setHexId(SEA_1);
        assertThatThrownBy(() -> naval.resolveDisembark(campaign, army, rolls(Tick.of(0, DayPart.MORNING)), "o"))
                .isInstanceOf(InvalidRouteException.class);

        ship.setStatus(Ship.Status.SAILING);
        assertThatThrownBy(() -> naval.resolveDisembark(campaign, army, rolls(Tick.of(0, DayPart.MORNING)), "o"))
                .isInstanceOf(InvalidStateException.class);
    }
}
