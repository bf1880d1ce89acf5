package com.acme.pgprecheck.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate root of one precheck run.
 *
 * <p>The database set and the run parameters are fixed at construction. Outcomes and
 * counters grow monotonically through the mutators below, which are meant to be driven by
 * a single aggregator; every mutator fails once {@link #seal(Instant)} has been called.
 */
public final class PrecheckSession {

    private final int sourceVersion;
    private final int targetVersion;
    private final boolean blueGreenRequested;
    private final List<DatabaseRef> databases;
    private final List<String> rejectedDatabaseNames;
    private final Instant startedAt;

    private final List<RuleOutcome> outcomes = new ArrayList<>();
    private final Set<String> failedRuleIds = new LinkedHashSet<>();
    private final Set<String> warnedRuleIds = new LinkedHashSet<>();
    private final Set<String> unverifiedRuleIds = new LinkedHashSet<>();
    private int errorCount;
    private int warningCount;
    private int probeErrorCount;
    private Instant finishedAt;

    public PrecheckSession(int sourceVersion, int targetVersion, boolean blueGreenRequested,
                           List<DatabaseRef> databases, List<String> rejectedDatabaseNames, Instant startedAt) {
        this.sourceVersion = sourceVersion;
        this.targetVersion = targetVersion;
        this.blueGreenRequested = blueGreenRequested;
        this.databases = List.copyOf(databases);
        this.rejectedDatabaseNames = rejectedDatabaseNames == null ? List.of() : List.copyOf(rejectedDatabaseNames);
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public int sourceVersion() { return sourceVersion; }
    public int targetVersion() { return targetVersion; }
    public boolean blueGreenRequested() { return blueGreenRequested; }
    public List<DatabaseRef> databases() { return databases; }
    public List<String> rejectedDatabaseNames() { return rejectedDatabaseNames; }
    public Instant startedAt() { return startedAt; }

    public synchronized Instant finishedAt() { return finishedAt; }
    public synchronized boolean isSealed() { return finishedAt != null; }
    public synchronized List<RuleOutcome> outcomes() { return List.copyOf(outcomes); }
    public synchronized int errorCount() { return errorCount; }
    public synchronized int warningCount() { return warningCount; }
    public synchronized int probeErrorCount() { return probeErrorCount; }
    public synchronized List<String> failedRuleIds() { return List.copyOf(failedRuleIds); }
    public synchronized List<String> warnedRuleIds() { return List.copyOf(warnedRuleIds); }
    public synchronized List<String> unverifiedRuleIds() { return List.copyOf(unverifiedRuleIds); }

    public synchronized void appendOutcome(RuleOutcome outcome) {
        ensureOpen();
        outcomes.add(Objects.requireNonNull(outcome, "outcome"));
    }

    public synchronized void addErrors(String ruleId, int count) {
        ensureOpen();
        if (count <= 0) return;
        errorCount += count;
        failedRuleIds.add(ruleId);
    }

    public synchronized void addWarnings(String ruleId, int count) {
        ensureOpen();
        if (count <= 0) return;
        warningCount += count;
        warnedRuleIds.add(ruleId);
    }

    public synchronized void addProbeErrors(String ruleId, int count) {
        ensureOpen();
        if (count <= 0) return;
        probeErrorCount += count;
        unverifiedRuleIds.add(ruleId);
    }

    public synchronized void seal(Instant finishedAt) {
        ensureOpen();
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
    }

    private void ensureOpen() {
        if (finishedAt != null) throw new IllegalStateException("Precheck session is sealed");
    }
}
