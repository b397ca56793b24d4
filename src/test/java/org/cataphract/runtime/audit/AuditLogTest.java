package org.cataphract.runtime.audit;

import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Tick;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AuditLogTest {

    @Test
    @DisplayName("Entries are numbered in append order and filtered by tick")
    void sequenceAndSince() {
        AuditLog log = new AuditLog();
        log.append(Tick.of(0, DayPart.NIGHT), AuditSubsystem.SUPPLY, "army:1", List.of(), Map.of(), "ate");
        log.append(Tick.of(1, DayPart.MORNING), AuditSubsystem.MOVEMENT, "order:2", List.of(), Map.of(), "marched");
        log.append(Tick.of(1, DayPart.MIDDAY), AuditSubsystem.SIEGE, "siege:3", List.of(), Map.of(), "walls down");

        assertThat(log.entries()).extracting(AuditEntry::sequence).containsExactly(0L, 1L, 2L);
        assertThat(log.entriesSince(Tick.of(1, DayPart.MORNING))).extracting(AuditEntry::subject)
                .containsExactly("order:2", "siege:3");
    }

    @Test
    @DisplayName("Entries cannot be changed after the fact")
    void entriesAreImmutable() {
        AuditLog log = new AuditLog();
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("miles", 6.0);
        AuditEntry entry = log.append(Tick.of(0, DayPart.MORNING), AuditSubsystem.MESSAGING, "order:1", List.of(),
                inputs, "sent");
        inputs.put("miles", 60.0);

        assertThat(entry.inputs()).containsEntry("miles", 6.0);
        assertThatThrownBy(() -> log.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("A copy does not see later entries of the original")
    void copyIsIndependent() {
        AuditLog log = new AuditLog();
        log.append(Tick.of(0, DayPart.MORNING), AuditSubsystem.SUPPLY, "army:1", List.of(), Map.of(), "ate");
        AuditLog copy = log.copy();

        log.append(Tick.of(0, DayPart.MIDDAY), AuditSubsystem.SUPPLY, "army:1", List.of(), Map.of(), "ate");

        assertThat(copy.size()).isEqualTo(1);
        assertThat(log.size()).isEqualTo(2);
    }
}
