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
import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ScopeUnit;
import com.acme.pgprecheck.probe.ProbeClient;

import java.util.List;

/**
 * Probes one scope unit for a rule. An empty list means the unit is clean; a thrown
 * {@link ProbeException} means it could not be verified.
 */
@FunctionalInterface
public interface RuleProbe {
    List<Finding> evaluate(ProbeClient client, Rule rule, ScopeUnit unit) throws ProbeException;
}
