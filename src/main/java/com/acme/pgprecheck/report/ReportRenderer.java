package com.acme.pgprecheck.report;

import com.acme.pgprecheck.checks.Rule;
import com.acme.pgprecheck.checks.RuleCatalog;
import com.acme.pgprecheck.model.Enums.RuleStatus;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.PrecheckSession;
import com.acme.pgprecheck.model.RuleOutcome;
import com.acme.pgprecheck.report.PrecheckReport.RuleResult;
import com.acme.pgprecheck.report.PrecheckReport.SectionReport;
import com.acme.pgprecheck.report.PrecheckReport.Summary;

import java.util.*;

/** Builds the immutable report view of a sealed session, grouped by catalog section. */
public final class ReportRenderer {

    static final String NOT_EVALUATED = "not evaluated in this session";

    private final RuleCatalog catalog;

    public ReportRenderer(RuleCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public PrecheckReport render(PrecheckSession session) {
        if (!session.isSealed()) {
            throw new IllegalStateException("Cannot render a session that has not been sealed");
        }

        Map<String, RuleOutcome> byId = new HashMap<>();
        for (RuleOutcome o : session.outcomes()) byId.put(o.ruleId(), o);

        List<SectionReport> sections = new ArrayList<>();
        for (Section section : Section.values()) {
            List<RuleResult> results = new ArrayList<>();
            for (Rule rule : catalog.bySection(section)) {
                results.add(result(rule, byId.get(rule.id())));
            }
            sections.add(new SectionReport(section, section.title(), results));
        }

        Summary summary = new Summary(
                session.sourceVersion(),
                session.targetVersion(),
                session.blueGreenRequested(),
                session.databases().size(),
                session.rejectedDatabaseNames(),
                session.startedAt(),
                session.finishedAt(),
                session.errorCount(),
                session.warningCount(),
                session.failedRuleIds(),
                session.warnedRuleIds(),
                session.unverifiedRuleIds(),
                session.probeErrorCount());
        return new PrecheckReport(sections, summary);
    }

    /** Process exit code: the error count, clamped to what a shell can see. */
    public static int exitStatus(PrecheckSession session) {
        return Math.max(0, Math.min(255, session.errorCount()));
    }

    private static RuleResult result(Rule rule, RuleOutcome outcome) {
        if (outcome == null) {
            return new RuleResult(rule.id(), rule.title(), RuleStatus.SKIPPED, NOT_EVALUATED, null, List.of(), List.of());
        }
        RuleStatus status = outcome.status();
        String remediation = status == RuleStatus.FAILED || status == RuleStatus.WARNED ? rule.remediation() : null;
        return new RuleResult(rule.id(), rule.title(), status, outcome.skipReason(), remediation,
                outcome.findings(), outcome.probeErrors());
    }
}
