package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.DatabaseRef;
import com.acme.pgprecheck.model.Enums.Section;
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

@DisplayName("Probes")
class ProbesTest {

    private static final DatabaseRef APP = new DatabaseRef("appdb");

    private static Rule rule(String id) {
        return RuleCatalog.defaultCatalog().find(id).orElseThrow();
    }

    @Nested
    @DisplayName("rowsPresent")
    class RowsPresent {

        @Test
        @DisplayName("no rows means no finding")
        void emptyIsClean() throws Exception {
            Rule a1 = rule("A-1");

            assertThat(a1.probe().evaluate(new FakeProbeClient(), a1, ScopeUnit.cluster(1))).isEmpty();
        }

        @Test
        @DisplayName("two prepared transactions give one error carrying both rows")
        void rowsBecomeOneFinding() throws Exception {
            Rule a1 = rule("A-1");
            FakeProbeClient client = new FakeProbeClient().rows("prepared_transactions", null, null,
                    Map.of("gid", "tx1", "owner", "app"),
                    Map.of("gid", "tx2", "owner", "app"));

            List<Finding> findings = a1.probe().evaluate(client, a1, ScopeUnit.cluster(1));

            assertThat(findings).hasSize(1);
            Finding f = findings.get(0);
            assertThat(f.ruleId()).isEqualTo("A-1");
            assertThat(f.severity()).isEqualTo(Severity.ERROR);
            assertThat(f.databaseName()).isNull();
            assertThat(f.summary()).startsWith("2 uncommitted prepared transaction(s)");
            assertThat(f.detailRows()).hasSize(2);
        }

        @Test
        @DisplayName("the fixed extension name is bound as the query parameter")
        void fixedParameterIsBound() throws Exception {
            Rule a8 = rule("A-8");
            FakeProbeClient client = new FakeProbeClient().rows("installed_extension", "appdb", "pg_repack",
                    Map.of("extname", "pg_repack", "extversion", "1.4.7"));

            List<Finding> findings = a8.probe().evaluate(client, a8, ScopeUnit.database(APP, 1));

            assertThat(findings).singleElement().satisfies(f -> {
                assertThat(f.databaseName()).isEqualTo("appdb");
                assertThat(f.summary()).contains("pg_repack 1.4.7");
            });
            assertThat(client.calls()).containsExactly("installed_extension@appdb/pg_repack");
        }

        @Test
        @DisplayName("per-target units bind their target and name it in the summary")
        void targetIsBound() throws Exception {
            Rule a9 = rule("A-9");
            FakeProbeClient client = new FakeProbeClient().rows("outdated_extension", "appdb", "postgis",
                    Map.of("name", "postgis", "installed_version", "3.1.4", "default_version", "3.4.0"));

            List<Finding> findings = a9.probe().evaluate(client, a9, ScopeUnit.target(APP, "postgis", 1));

            assertThat(findings).singleElement().satisfies(f -> {
                assertThat(f.severity()).isEqualTo(Severity.WARNING);
                assertThat(f.target()).isEqualTo("postgis");
                assertThat(f.summary()).isEqualTo("postgis installed: 3.1.4, available: 3.4.0");
            });
        }
    }

    @Nested
    @DisplayName("scalar")
    class Scalar {

        @Test
        @DisplayName("template count of 2 is clean")
        void templateCountTwo() throws Exception {
            Rule a3 = rule("A-3");
            FakeProbeClient client = new FakeProbeClient().scalar("template_database_count", null, "2");

            assertThat(a3.probe().evaluate(client, a3, ScopeUnit.cluster(1))).isEmpty();
        }

        @Test
        @DisplayName("template count of 1 is an error")
        void templateCountOne() throws Exception {
            Rule a3 = rule("A-3");
            FakeProbeClient client = new FakeProbeClient().scalar("template_database_count", null, "1");

            assertThat(a3.probe().evaluate(client, a3, ScopeUnit.cluster(1)))
                    .singleElement()
                    .extracting(Finding::summary)
                    .asString()
                    .contains("found 1 of 2");
        }

        @Test
        @DisplayName("a missing row reads as zero")
        void missingRowIsZero() throws Exception {
            Rule a3 = rule("A-3");

            assertThat(a3.probe().evaluate(new FakeProbeClient(), a3, ScopeUnit.cluster(1))).hasSize(1);
        }
    }

    @Nested
    @DisplayName("settingEquals")
    class SettingEquals {

        @Test
        @DisplayName("exactly 'on' passes")
        void on() throws Exception {
            Rule bg5 = rule("BG-5");
            FakeProbeClient client = new FakeProbeClient().setting("rds.logical_replication", "on");

            assertThat(bg5.probe().evaluate(client, bg5, ScopeUnit.cluster(1))).isEmpty();
        }

        @Test
        @DisplayName("'off' fails and reports the current value")
        void off() throws Exception {
            Rule bg5 = rule("BG-5");
            FakeProbeClient client = new FakeProbeClient().setting("rds.logical_replication", "off");

            assertThat(bg5.probe().evaluate(client, bg5, ScopeUnit.cluster(1)))
                    .singleElement()
                    .extracting(Finding::summary)
                    .isEqualTo("rds.logical_replication is NOT enabled (current: off)");
        }

        @Test
        @DisplayName("an unknown setting fails as 'unknown'")
        void unknown() throws Exception {
            Rule bg5 = rule("BG-5");

            assertThat(bg5.probe().evaluate(new FakeProbeClient(), bg5, ScopeUnit.cluster(1)))
                    .singleElement()
                    .extracting(Finding::summary)
                    .asString()
                    .contains("current: unknown");
        }
    }

    @Test
    @DisplayName("custom summarizers see the unit")
    void summarizerSeesUnit() throws Exception {
        Rule r = Rule.builder("X-1", "custom")
                .section(Section.ENGINE_INTERNAL)
                .probe(Probes.rowsPresent(CatalogQueries.TABLES_WITH_OIDS, (unit, rows) -> unit.label() + ":" + rows.size()))
                .build();
        FakeProbeClient client = new FakeProbeClient().rows("tables_with_oids", "appdb", null, Map.of("relname", "t"));

        assertThat(r.probe().evaluate(client, r, ScopeUnit.database(APP, 1)))
                .singleElement()
                .extracting(Finding::summary)
                .isEqualTo("appdb:1");
    }
}
