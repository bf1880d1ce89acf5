package com.acme.pgprecheck.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PrecheckSession")
class PrecheckSessionTest {

    private final PrecheckSession session = new PrecheckSession(13, 16, false,
            List.of(new DatabaseRef("appdb")), List.of("bad;name"), Instant.EPOCH);

    @Test
    @DisplayName("rule ids are listed once, in insertion order")
    void deduplicatedIds() {
        session.addErrors("A-6", 1);
        session.addErrors("A-1", 2);
        session.addErrors("A-6", 3);

        assertThat(session.errorCount()).isEqualTo(6);
        assertThat(session.failedRuleIds()).containsExactly("A-6", "A-1");
    }

    @Test
    @DisplayName("zero counts do not list the rule")
    void zeroCountsIgnored() {
        session.addWarnings("A-9", 0);
        session.addProbeErrors("A-1", 0);

        assertThat(session.warnedRuleIds()).isEmpty();
        assertThat(session.unverifiedRuleIds()).isEmpty();
    }

    @Test
    @DisplayName("a sealed session rejects every mutation")
    void sealed() {
        session.seal(Instant.EPOCH.plusSeconds(5));

        assertThat(session.isSealed()).isTrue();
        assertThat(session.finishedAt()).isEqualTo(Instant.EPOCH.plusSeconds(5));
        assertThatThrownBy(() -> session.addErrors("A-1", 1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.appendOutcome(RuleOutcome.skipped("E-9", "x"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.seal(Instant.now())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("database set and rejected names are fixed at construction")
    void immutableDatabases() {
        assertThat(session.databases()).containsExactly(new DatabaseRef("appdb"));
        assertThat(session.rejectedDatabaseNames()).containsExactly("bad;name");
        assertThatThrownBy(() -> session.databases().add(new DatabaseRef("other")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
