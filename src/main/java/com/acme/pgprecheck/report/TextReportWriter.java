package com.acme.pgprecheck.report;

import com.acme.pgprecheck.PrecheckContext;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.Enums.Severity;
import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ProbeError;
import com.acme.pgprecheck.report.PrecheckReport.RuleResult;
import com.acme.pgprecheck.report.PrecheckReport.SectionReport;
import com.acme.pgprecheck.report.PrecheckReport.Summary;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/** Console rendering of a report, one block per section and a closing summary. */
public final class TextReportWriter {

    static final String RULE = "============================================";
    static final int MAX_EVIDENCE_ROWS = 20;
    static final String UNVERIFIED_VERDICT =
            "⚠️ Precheck could not verify every check; review the checks above before upgrading.";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream out;
    private final ZoneId zone;

    public TextReportWriter(PrintStream out) {
        this(out, ZoneId.systemDefault());
    }

    public TextReportWriter(PrintStream out, ZoneId zone) {
        this.out = out;
        this.zone = zone;
    }

    public void writeHeader(PrecheckContext ctx, int sourceVersion) {
        out.println(RULE);
        out.println("Aurora/RDS PostgreSQL Upgrade Precheck");
        out.println(RULE);
        out.println("Host: " + ctx.host);
        out.println("Port: " + ctx.port);
        out.println("User: " + ctx.user);
        out.println("Source Version: " + sourceVersion + " (detected)");
        out.println("Target Version: " + ctx.targetVersion);
        out.println(RULE);
    }

    public void writeVersionCheckPassed(int sourceVersion, int targetVersion) {
        out.println("✓ Version check passed: " + sourceVersion + " -> " + targetVersion);
    }

    public void writeStart() {
        out.println();
        out.println(RULE);
        out.println("Starting Precheck...");
        out.println(RULE);
    }

    public void write(PrecheckReport report) {
        Summary summary = report.summary();
        for (SectionReport section : report.sections()) {
            out.println();
            out.println(RULE);
            out.println(section.title());
            out.println(RULE);
            if (section.section() == Section.BLUE_GREEN && !summary.blueGreenRequested()) {
                out.println("  Skipped (Blue/Green checks not requested)");
                continue;
            }
            for (RuleResult rule : section.rules()) writeRule(rule);
        }
        writeSummary(report);
    }

    private void writeRule(RuleResult rule) {
        out.println();
        out.println("=== " + rule.label() + " ===");
        switch (rule.status()) {
            case SKIPPED:
                out.println("  Skipped (" + rule.skipReason() + ")");
                return;
            case OK:
                out.println("✓ OK");
                return;
            default:
                break;
        }
        for (Finding f : rule.findings()) {
            out.println((f.severity() == Severity.ERROR ? "❌ ERROR" : "⚠️ WARN") + where(f.databaseName()) + ": " + f.summary());
            writeRows(f.detailRows());
        }
        if (rule.remediation() != null && !rule.remediation().isBlank()) {
            out.println("   " + rule.remediation());
        }
        for (ProbeError e : rule.probeErrors()) {
            out.println("  ⚠️ Could not verify" + where(e.databaseName()) + ": " + e.message());
        }
    }

    private void writeRows(List<Map<String, Object>> rows) {
        if (rows == null) return;
        int shown = Math.min(rows.size(), MAX_EVIDENCE_ROWS);
        for (int i = 0; i < shown; i++) {
            StringJoiner line = new StringJoiner(" | ", "     ", "");
            for (Map.Entry<String, Object> e : rows.get(i).entrySet()) line.add(e.getKey() + "=" + e.getValue());
            out.println(line);
        }
        if (rows.size() > shown) out.println("     ... " + (rows.size() - shown) + " more row(s)");
    }

    private void writeSummary(PrecheckReport report) {
        Summary s = report.summary();
        out.println();
        out.println(RULE);
        out.println("Precheck Summary");
        out.println(RULE);
        out.println("Source Version: " + s.sourceVersion());
        out.println("Target Version: " + s.targetVersion());
        out.println("Blue/Green Check: " + (s.blueGreenRequested() ? "yes" : "no"));
        out.println("Database Count: " + s.databaseCount());
        out.println("Start Time: " + format(s.startedAt()));
        out.println("End Time: " + format(s.finishedAt()));
        out.println(RULE);

        if (!s.rejectedDatabaseNames().isEmpty()) {
            out.println("Note: skipped invalid database name(s): " + String.join(", ", s.rejectedDatabaseNames()));
            out.println();
        }
        if (s.errorCount() > 0) {
            out.println("❌ Precheck identified " + s.errorCount() + " error(s) in " + s.failedRuleIds().size()
                    + " check(s) that need to be addressed before upgrading.");
            out.println("   Please review the error details in each check above.");
            out.println();
            out.println("Failed Checks:");
            for (String label : labels(report, s.failedRuleIds())) out.println("  - " + label);
            out.println();
        }
        if (s.warningCount() > 0) {
            out.println("⚠️ Precheck identified " + s.warningCount() + " warning(s) in " + s.warnedRuleIds().size()
                    + " check(s) that should be reviewed before upgrading.");
            out.println("   Please review the warning details in each check above.");
            out.println();
            out.println("Warning Checks:");
            for (String label : labels(report, s.warnedRuleIds())) out.println("  - " + label);
            out.println();
        }
        if (!s.unverifiedRuleIds().isEmpty()) {
            out.println("⚠️ Could not verify " + s.unverifiedRuleIds().size() + " check(s) ("
                    + s.probeErrorCount() + " probe error(s)); these were not counted as passed:");
            for (String label : labels(report, s.unverifiedRuleIds())) out.println("  - " + label);
            out.println();
        }
        if (s.passed()) {
            out.println("✓ Precheck passed. Upgrade can proceed.");
        } else if (s.errorCount() == 0 && s.warningCount() == 0) {
            out.println(UNVERIFIED_VERDICT);
        }
        out.println(RULE);
    }

    private static List<String> labels(PrecheckReport report, List<String> ids) {
        List<String> out = new ArrayList<>();
        for (String id : ids) out.add(label(report, id));
        return out;
    }

    private static String label(PrecheckReport report, String id) {
        for (SectionReport section : report.sections()) {
            for (RuleResult r : section.rules()) {
                if (r.id().equals(id)) return r.label();
            }
        }
        return id;
    }

    private String format(Instant instant) {
        return instant == null ? "-" : TIMESTAMP.format(instant.atZone(zone));
    }

    private static String where(String databaseName) {
        return databaseName == null ? "" : " [" + databaseName + "]";
    }
}
