package com.acme.pgprecheck.report;

import com.acme.pgprecheck.PrecheckContext;
import com.acme.pgprecheck.checks.ResultAggregator;
import com.acme.pgprecheck.checks.RuleCatalog;
import com.acme.pgprecheck.model.*;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonReportWriter")
class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("default file name is timestamped without separators")
    void defaultFileName() {
        assertThat(JsonReportWriter.defaultFileName(Instant.parse("2026-03-01T10:15:00.123Z")))
                .isEqualTo("pg_upgrade_precheck_20260301T101500123Z.json");
    }

    @Test
    @DisplayName("writes summary, sections and inputs without a password")
    void writesDocument() throws Exception {
        DatabaseRef app = new DatabaseRef("appdb");
        PrecheckSession s = new PrecheckSession(13, 16, true, List.of(app), List.of(), Instant.parse("2026-03-01T10:15:00Z"));
        ResultAggregator.accumulate(s, RuleOutcome.executed("BG-5",
                List.of(Finding.err("BG-5", ScopeUnit.cluster(1), "rds.logical_replication is NOT enabled (current: off)")),
                List.of()));
        s.seal(Instant.parse("2026-03-01T10:15:05Z"));
        PrecheckReport report = new ReportRenderer(RuleCatalog.defaultCatalog()).render(s);

        Path file = JsonReportWriter.write(new PrecheckContext("db.example.com", 5432, "postgres", 16), report, tempDir);

        assertThat(file.getFileName().toString()).startsWith("pg_upgrade_precheck_");
        JsonNode root = JsonReportWriter.MAPPER.readTree(Files.readString(file));
        assertThat(root.path("timestamp_utc").asText()).isEqualTo("2026-03-01T10:15:05Z");
        assertThat(root.path("inputs").path("host").asText()).isEqualTo("db.example.com");
        assertThat(root.path("inputs").has("password")).isFalse();
        assertThat(root.path("summary").path("errorCount").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("failedRuleIds").get(0).asText()).isEqualTo("BG-5");
        assertThat(root.path("sections").size()).isEqualTo(3);
        assertThat(root.path("sections").get(2).path("section").asText()).isEqualTo("BLUE_GREEN");
    }
}
