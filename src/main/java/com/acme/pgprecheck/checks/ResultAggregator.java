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

import com.acme.pgprecheck.model.PrecheckSession;
import com.acme.pgprecheck.model.RuleOutcome;

/** Folds rule outcomes into the session. The only writer of session counters. */
public final class ResultAggregator {
    private ResultAggregator() {}

    public static void accumulate(PrecheckSession session, RuleOutcome outcome) {
        synchronized (session) {
            session.appendOutcome(outcome);
            if (!outcome.applicable()) return;
            session.addErrors(outcome.ruleId(), outcome.errorCount());
            session.addWarnings(outcome.ruleId(), outcome.warningCount());
            session.addProbeErrors(outcome.ruleId(), outcome.probeErrors().size());
        }
    }
}
