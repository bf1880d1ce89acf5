package com.acme.pgprecheck.report;

import com.acme.pgprecheck.model.Enums.RuleStatus;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ProbeError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

public record PrecheckReport(List<SectionReport> sections, Summary summary) {

    public PrecheckReport {
        sections = List.copyOf(sections);
    }

    public record SectionReport(Section section, String title, List<RuleResult> rules) {
        public SectionReport {
            rules = List.copyOf(rules);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RuleResult(String id,
                             String title,
                             RuleStatus status,
                             String skipReason,
                             String remediation,
                             List<Finding> findings,
                             List<ProbeError> probeErrors) {

        /** "A-1. check_for_prepared_transactions" */
        public String label() { return id + ". " + title; }
    }

    public record Summary(int sourceVersion,
                          int targetVersion,
                          boolean blueGreenRequested,
                          int databaseCount,
                          List<String> rejectedDatabaseNames,
                          Instant startedAt,
                          Instant finishedAt,
                          int errorCount,
                          int warningCount,
                          List<String> failedRuleIds,
                          List<String> warnedRuleIds,
                          List<String> unverifiedRuleIds,
                          int probeErrorCount) {

        /** No errors, no warnings and every applicable check verified. */
        public boolean passed() { return errorCount == 0 && warningCount == 0 && unverifiedRuleIds.isEmpty(); }
    }
}
