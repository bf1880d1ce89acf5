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

import com.acme.pgprecheck.config.PrecheckConfig;
import com.acme.pgprecheck.exceptions.ConnectivityException;
import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.model.Applicability;
import com.acme.pgprecheck.model.PrecheckSession;
import com.acme.pgprecheck.model.RuleOutcome;
import com.acme.pgprecheck.probe.ProbeClient;
import com.acme.pgprecheck.util.TimeoutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives one precheck run: enumerates databases, submits every applicable rule to the
 * worker pool, then folds the outcomes into a session in catalog order and seals it.
 */
public final class PrecheckRunner {

    private static final Logger log = LoggerFactory.getLogger(PrecheckRunner.class);

    private final ProbeClient client;
    private final RuleCatalog catalog;
    private final PrecheckConfig config;
    private final Clock clock;

    public PrecheckRunner(ProbeClient client, RuleCatalog catalog, PrecheckConfig config) {
        this(client, catalog, config, Clock.systemUTC());
    }

    public PrecheckRunner(ProbeClient client, RuleCatalog catalog, PrecheckConfig config, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Major version of the connected server, from {@code server_version_num}. */
    public int detectSourceVersion() throws ConnectivityException {
        String raw;
        try {
            raw = TimeoutExecutor.executeWithTimeout("server_version_num", config.probeTimeout(),
                    () -> client.showSetting("server_version_num"));
        } catch (ProbeException e) {
            throw new ConnectivityException("Unable to connect to database. Please verify credentials and connectivity. ("
                    + e.getMessage() + ")", e);
        }
        try {
            return majorVersion(raw);
        } catch (IllegalArgumentException e) {
            throw new ConnectivityException("Unable to detect source version: " + e.getMessage(), e);
        }
    }

    /** 130011 -> 13, 90624 -> 9. */
    static int majorVersion(String serverVersionNum) {
        if (serverVersionNum == null || serverVersionNum.isBlank()) {
            throw new IllegalArgumentException("server_version_num is empty");
        }
        int num;
        try {
            num = Integer.parseInt(serverVersionNum.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("server_version_num is not numeric: " + serverVersionNum, e);
        }
        if (num < 10000) throw new IllegalArgumentException("server_version_num out of range: " + serverVersionNum);
        return num / 10000;
    }

    public PrecheckSession run(int sourceVersion, int targetVersion, boolean blueGreenRequested) throws ConnectivityException {
        Instant startedAt = clock.instant();
        List<String> raw;
        try {
            raw = TimeoutExecutor.executeWithTimeout("list_databases", config.probeTimeout(), client::listDatabases);
        } catch (ProbeException e) {
            throw new ConnectivityException("Unable to enumerate databases: " + e.getMessage(), e);
        }
        DatabaseEnumerator.Enumeration enumeration = DatabaseEnumerator.enumerate(raw);

        PrecheckSession session = new PrecheckSession(sourceVersion, targetVersion, blueGreenRequested,
                enumeration.databases(), enumeration.rejectedNames(), startedAt);
        log.info("Running {} rules against {} database(s), {} -> {}, blue/green={}",
                catalog.size(), enumeration.databases().size(), sourceVersion, targetVersion, blueGreenRequested);

        try (RuleExecutor executor = new RuleExecutor(client, config.workers(), config.probeTimeout())) {
            List<RuleExecutor.PendingOutcome> pending = new ArrayList<>(catalog.size());
            for (Rule rule : catalog.rules()) {
                Applicability a = VersionGate.evaluate(rule, sourceVersion, targetVersion, blueGreenRequested);
                if (a.applicable()) {
                    pending.add(executor.submit(rule, session.databases()));
                } else {
                    log.debug("Skipping {}: {}", rule.id(), a.reason());
                    pending.add(RuleExecutor.PendingOutcome.completed(RuleOutcome.skipped(rule.id(), a.reason())));
                }
            }
            for (RuleExecutor.PendingOutcome p : pending) {
                ResultAggregator.accumulate(session, p.await());
            }
        }

        session.seal(clock.instant());
        log.info("Precheck finished: {} error(s), {} warning(s), {} probe error(s)",
                session.errorCount(), session.warningCount(), session.probeErrorCount());
        return session;
    }
}
