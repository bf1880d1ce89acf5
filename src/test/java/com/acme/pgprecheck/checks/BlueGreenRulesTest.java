package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.model.Enums.Severity;
import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ScopeUnit;
import com.acme.pgprecheck.probe.FakeProbeClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BlueGreenRules")
class BlueGreenRulesTest {

    private static Rule rule(String id) {
        return RuleCatalog.defaultCatalog().find(id).orElseThrow();
    }

    private static FakeProbeClient capacity(String slots, String walSenders, String logicalWorkers, String workerProcesses) {
        return new FakeProbeClient()
                .setting("max_replication_slots", slots)
                .setting("max_wal_senders", walSenders)
                .setting("max_logical_replication_workers", logicalWorkers)
                .setting("max_worker_processes", workerProcesses);
    }

    @Nested
    @DisplayName("BG-1 replication capacity")
    class ReplicationCapacity {

        @Test
        @DisplayName("three databases need four slots; two slots is an error")
        void tooFewSlots() throws Exception {
            Rule bg1 = rule("BG-1");

            List<Finding> findings = bg1.probe().evaluate(capacity("2", "10", "10", "20"), bg1, ScopeUnit.cluster(3));

            assertThat(findings).extracting(Finding::summary)
                    .containsExactly("max_replication_slots (2) < required (4)");
            assertThat(findings).allSatisfy(f -> assertThat(f.severity()).isEqualTo(Severity.ERROR));
        }

        @Test
        @DisplayName("every shortfall is reported separately")
        void allShortfalls() throws Exception {
            Rule bg1 = rule("BG-1");

            List<Finding> findings = bg1.probe().evaluate(capacity("2", "1", "2", "2"), bg1, ScopeUnit.cluster(3));

            assertThat(findings).hasSize(4);
        }

        @Test
        @DisplayName("worker processes equal to logical workers is not enough")
        void workerProcessesMustExceed() throws Exception {
            Rule bg1 = rule("BG-1");

            List<Finding> findings = bg1.probe().evaluate(capacity("4", "4", "4", "4"), bg1, ScopeUnit.cluster(3));

            assertThat(findings).extracting(Finding::summary)
                    .containsExactly("max_worker_processes (4) <= max_logical_replication_workers (4)");
        }

        @Test
        @DisplayName("exact minimums pass")
        void exactMinimums() throws Exception {
            Rule bg1 = rule("BG-1");

            assertThat(bg1.probe().evaluate(capacity("4", "4", "4", "5"), bg1, ScopeUnit.cluster(3))).isEmpty();
        }

        @Test
        @DisplayName("a non-numeric setting cannot be verified")
        void unparseableSetting() {
            Rule bg1 = rule("BG-1");

            assertThatThrownBy(() -> bg1.probe().evaluate(capacity("lots", "4", "4", "5"), bg1, ScopeUnit.cluster(3)))
                    .isInstanceOf(ProbeException.class)
                    .hasMessageContaining("max_replication_slots");
        }

        @Test
        @DisplayName("a missing setting cannot be verified")
        void missingSetting() {
            Rule bg1 = rule("BG-1");

            assertThatThrownBy(() -> bg1.probe().evaluate(new FakeProbeClient(), bg1, ScopeUnit.cluster(3)))
                    .isInstanceOf(ProbeException.class);
        }
    }

    @Test
    @DisplayName("BG-3 tables without a primary key are warnings")
    void tablesWithoutPrimaryKey() throws Exception {
        Rule bg3 = rule("BG-3");
        FakeProbeClient client = new FakeProbeClient().rows("tables_without_primary_key", "appdb", null,
                Map.of("schema", "public", "table_name", "events", "replica_identity", "DEFAULT"));

        assertThat(bg3.probe().evaluate(client, bg3, ScopeUnit.database(new com.acme.pgprecheck.model.DatabaseRef("appdb"), 1)))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.severity()).isEqualTo(Severity.WARNING);
                    assertThat(f.detailRows()).singleElement().satisfies(row -> assertThat(row).containsEntry("replica_identity", "DEFAULT"));
                });
    }

    @Test
    @DisplayName("BG-6 looks for the capture trigger by name")
    void dtsTrigger() throws Exception {
        Rule bg6 = rule("BG-6");
        FakeProbeClient client = new FakeProbeClient().rows("named_event_trigger", FakeProbeClient.ANY_DB,
                "dts_capture_catalog_start", Map.of("evtname", "dts_capture_catalog_start"));

        assertThat(bg6.probe().evaluate(client, bg6, ScopeUnit.database(new com.acme.pgprecheck.model.DatabaseRef("db1"), 1)))
                .singleElement()
                .extracting(Finding::summary)
                .isEqualTo("DTS trigger 'dts_capture_catalog_start' found");
    }

    @Test
    @DisplayName("subscription evidence never includes the connection string")
    void subscriptionsOmitConninfo() {
        assertThat(CatalogQueries.SUBSCRIPTIONS.sql()).doesNotContain("subconninfo");
    }
}
