package com.acme.pgprecheck.model;

import com.acme.pgprecheck.model.Enums.RuleStatus;
import com.acme.pgprecheck.model.Enums.Severity;

import java.util.List;

public record RuleOutcome(String ruleId,
                          boolean applicable,
                          String skipReason,
                          List<Finding> findings,
                          List<ProbeError> probeErrors) {

    public RuleOutcome {
        findings = findings == null ? List.of() : List.copyOf(findings);
        probeErrors = probeErrors == null ? List.of() : List.copyOf(probeErrors);
    }

    public static RuleOutcome skipped(String ruleId, String reason) {
        return new RuleOutcome(ruleId, false, reason, List.of(), List.of());
    }

    public static RuleOutcome executed(String ruleId, List<Finding> findings, List<ProbeError> probeErrors) {
        return new RuleOutcome(ruleId, true, null, findings, probeErrors);
    }

    public int errorCount() { return count(Severity.ERROR); }

    public int warningCount() { return count(Severity.WARNING); }

    public RuleStatus status() {
        if (!applicable) return RuleStatus.SKIPPED;
        if (errorCount() > 0) return RuleStatus.FAILED;
        if (warningCount() > 0) return RuleStatus.WARNED;
        if (!probeErrors.isEmpty()) return RuleStatus.UNVERIFIED;
        return RuleStatus.OK;
    }

    private int count(Severity severity) {
        int n = 0;
        for (Finding f : findings) if (f.severity() == severity) n++;
        return n;
    }
}
