package org.cataphract.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.cataphract.junit.extensions.logging.LogWatchExtension;
import org.cataphract.runtime.model.Operation;
import org.cataphract.runtime.model.StrongholdType;
import org.cataphract.runtime.model.TerritoryType;
import org.cataphract.runtime.model.Weather;
import org.cataphract.runtime.upkeep.FleetArrivalStep;
import org.cataphract.runtime.upkeep.SupplyDrainStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulesConfig} binding of reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RulesConfigTest {

    @Test
    @DisplayName("Defaults bind every enum-keyed table")
    void defaultsBindEnumTables() {
        RulesConfig rules = RulesConfig.defaults();

        assertThat(rules.movement().weatherFactors()).containsKeys(Weather.values());
        assertThat(rules.movement().weatherFactor(Weather.VERY_BAD)).isEqualTo(0.5);
        assertThat(rules.combat().defensiveBonus()).containsKeys(StrongholdType.values());
        assertThat(rules.siege().thresholds().get(StrongholdType.FORTRESS)).isEqualTo(20);
        assertThat(rules.messaging().interceptionDie().get(TerritoryType.HOSTILE)).isEqualTo(6);
        assertThat(rules.operations().complexityModifier().get(Operation.Complexity.SIMPLE)).isEqualTo(2);
        assertThat(rules.recruitment().progressPerPart()).containsKeys(StrongholdType.values());
    }

    @Test
    @DisplayName("Upkeep steps come in their configured order")
    void upkeepStepOrder() {
        assertThat(RulesConfig.defaults().upkeepSteps())
                .startsWith(SupplyDrainStep.NAME)
                .endsWith(FleetArrivalStep.NAME)
                .hasSize(6);
    }

    @Test
    @DisplayName("The battle table picks the highest band the margin reaches")
    void battleTableBands() {
        RulesConfig.Combat combat = RulesConfig.defaults().combat();

        assertThat(combat.bandFor(0).winnerMoraleChange()).isEqualTo(-1);
        assertThat(combat.bandFor(1).loserCasualtyPercent()).isEqualTo(10);
        assertThat(combat.bandFor(3).minDifference()).isEqualTo(2);
        assertThat(combat.bandFor(5).loserCasualtyPercent()).isEqualTo(15);
        assertThat(combat.bandFor(5).commanderCaptureChance()).isEqualTo(1);
        assertThat(combat.bandFor(40).loserCasualtyPercent()).isEqualTo(20);
        assertThat(combat.bandFor(40).commanderCaptureChance()).isEqualTo(2);
    }

    @Test
    @DisplayName("Morale check consequences and the siege engine cap are bound")
    void moraleCheckAndSiegeCap() {
        RulesConfig rules = RulesConfig.defaults();

        assertThat(rules.morale().check().mutinyDefectChance()).isEqualTo(19);
        assertThat(rules.morale().check().desertionPercent()).isEqualTo(10);
        assertThat(rules.siege().maxSiegeEngines()).isEqualTo(50);
    }

    @Test
    @DisplayName("An empty battle table is rejected")
    void emptyBattleTable() {
        assertThatThrownBy(() -> RulesConfig.fromConfig(ConfigFactory.parseString(
                        "cataphract.rules.combat.casualty-table = []")
                .withFallback(ConfigFactory.parseResources("reference.conf")).resolve()))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("casualty-table");
    }

    @Test
    @DisplayName("A missing rule constant fails loudly")
    void missingKeyFails() {
        assertThatThrownBy(() -> RulesConfig.fromConfig(
                ConfigFactory.parseString("cataphract.tick { upkeep-steps = [], days-per-season = 90 }")))
                .isInstanceOf(ConfigException.class);
    }
}
