package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.Applicability;
import com.acme.pgprecheck.model.Enums.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Decides whether a rule runs for an upgrade path. Total and side-effect free apart from logging. */
public final class VersionGate {

    private static final Logger log = LoggerFactory.getLogger(VersionGate.class);

    static final String BLUE_GREEN_NOT_REQUESTED = "Blue/Green checks not requested";

    private VersionGate() {}

    public static Applicability evaluate(Rule rule, int sourceVersion, int targetVersion, boolean blueGreenRequested) {
        if (rule.section() == Section.BLUE_GREEN && !blueGreenRequested) {
            return Applicability.skip(BLUE_GREEN_NOT_REQUESTED);
        }
        try {
            if (rule.applicability().allows(sourceVersion, targetVersion, blueGreenRequested)) {
                return Applicability.yes();
            }
            return Applicability.skip("requires " + rule.applicability().requirement());
        } catch (RuntimeException e) {
            log.warn("Applicability check for {} failed, skipping rule", rule.id(), e);
            return Applicability.skip("applicability could not be evaluated: " + e.getMessage());
        }
    }
}
