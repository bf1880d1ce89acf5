/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: PostgreSQL Upgrade Precheck Tool
 */

package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.model.DatabaseRef;
import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ProbeError;
import com.acme.pgprecheck.model.RuleOutcome;
import com.acme.pgprecheck.model.ScopeUnit;
import com.acme.pgprecheck.probe.ProbeClient;
import com.acme.pgprecheck.util.TimeoutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a rule out over its scope units and runs one probe call per unit on a fixed worker
 * pool. A failing unit becomes a {@link ProbeError} on the outcome and never affects its
 * siblings.
 */
public final class RuleExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuleExecutor.class);

    private final ProbeClient client;
    private final Duration probeTimeout;
    private final ExecutorService pool;

    public RuleExecutor(ProbeClient client, int workers, Duration probeTimeout) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        this.client = Objects.requireNonNull(client, "client");
        this.probeTimeout = probeTimeout;
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "precheck-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Runs the rule and waits for every unit. */
    public RuleOutcome execute(Rule rule, List<DatabaseRef> databases) {
        return submit(rule, databases).await();
    }

    /** Queues every scope unit of the rule and returns immediately. */
    public PendingOutcome submit(Rule rule, List<DatabaseRef> databases) {
        List<ScopeUnit> units = scopeUnits(rule, databases);
        List<Future<UnitResult>> futures = new ArrayList<>(units.size());
        for (ScopeUnit unit : units) {
            futures.add(pool.submit(() -> probe(rule, unit)));
        }
        return new PendingOutcome(rule.id(), units, futures, null);
    }

    /** Cluster rules get one unit; per-database rules one per database; per-target rules database-major, target-minor. */
    static List<ScopeUnit> scopeUnits(Rule rule, List<DatabaseRef> databases) {
        int n = databases.size();
        List<ScopeUnit> units = new ArrayList<>();
        switch (rule.scope()) {
            case CLUSTER:
                units.add(ScopeUnit.cluster(n));
                break;
            case PER_DATABASE:
                for (DatabaseRef db : databases) units.add(ScopeUnit.database(db, n));
                break;
            case PER_DATABASE_PER_TARGET:
                for (DatabaseRef db : databases) {
                    for (String target : rule.targets()) units.add(ScopeUnit.target(db, target, n));
                }
                break;
            default:
                throw new IllegalStateException("Unhandled scope " + rule.scope());
        }
        return units;
    }

    private UnitResult probe(Rule rule, ScopeUnit unit) {
        String operation = rule.id() + "@" + unit.label();
        try {
            List<Finding> findings = TimeoutExecutor.executeWithTimeout(operation, probeTimeout,
                    () -> rule.probe().evaluate(client, rule, unit));
            return new UnitResult(findings == null ? List.of() : findings, null);
        } catch (ProbeException e) {
            log.warn("Could not verify {} on {}: {}", rule.id(), unit.label(), e.getMessage());
            return new UnitResult(List.of(), ProbeError.of(rule.id(), unit, e.getMessage()));
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private record UnitResult(List<Finding> findings, ProbeError error) {}

    /** Outcome of a submitted rule, resolved in unit order. */
    public static final class PendingOutcome {
        private final String ruleId;
        private final List<ScopeUnit> units;
        private final List<Future<UnitResult>> futures;
        private final RuleOutcome resolved;

        private PendingOutcome(String ruleId, List<ScopeUnit> units, List<Future<UnitResult>> futures, RuleOutcome resolved) {
            this.ruleId = ruleId;
            this.units = units;
            this.futures = futures;
            this.resolved = resolved;
        }

        /** Wraps an outcome that needs no probing, such as a skipped rule. */
        public static PendingOutcome completed(RuleOutcome outcome) {
            return new PendingOutcome(outcome.ruleId(), List.of(), List.of(), outcome);
        }

        public String ruleId() { return ruleId; }

        public RuleOutcome await() {
            if (resolved != null) return resolved;

            List<Finding> findings = new ArrayList<>();
            List<ProbeError> errors = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                ScopeUnit unit = units.get(i);
                try {
                    UnitResult r = futures.get(i).get();
                    findings.addAll(r.findings());
                    if (r.error() != null) errors.add(r.error());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    errors.add(ProbeError.of(ruleId, unit, "Interrupted while waiting for probe"));
                } catch (ExecutionException | CancellationException e) {
                    Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                    log.warn("Probe task for {} on {} failed", ruleId, unit.label(), cause);
                    errors.add(ProbeError.of(ruleId, unit, "Probe task failed: " + cause));
                }
            }
            return RuleOutcome.executed(ruleId, findings, errors);
        }
    }
}
