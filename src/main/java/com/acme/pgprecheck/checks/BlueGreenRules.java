package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.model.Enums.Scope;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.Enums.Severity;
import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ScopeUnit;
import com.acme.pgprecheck.probe.ProbeClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Section 3: blue/green deployment readiness. These rules only run when the operator asked
 * for blue/green checks; the gate skips the whole section otherwise.
 */
public final class BlueGreenRules {
    private BlueGreenRules() {}

    public static List<Rule> rules() {
        return List.of(
                Rule.builder("BG-1", "Check logical replication parameters")
                        .section(Section.BLUE_GREEN)
                        .probe(BlueGreenRules::replicationCapacity)
                        .remediation("Raise the parameters in the DB cluster parameter group and reboot.")
                        .build(),

                Rule.builder("BG-2", "Check for logical replication subscriptions")
                        .section(Section.BLUE_GREEN)
                        .scope(Scope.PER_DATABASE)
                        .probe(Probes.rowsPresent(CatalogQueries.SUBSCRIPTIONS,
                                (unit, rows) -> rows.size() + " subscription(s) exist and must be dropped before Blue/Green upgrade"))
                        .remediation("Please drop the subscriptions using: DROP SUBSCRIPTION ...;")
                        .build(),

                Rule.builder("BG-3", "Check tables without Primary Key")
                        .section(Section.BLUE_GREEN)
                        .scope(Scope.PER_DATABASE)
                        .severity(Severity.WARNING)
                        .probe(Probes.rowsPresent(CatalogQueries.TABLES_WITHOUT_PRIMARY_KEY,
                                (unit, rows) -> rows.size() + " table(s) without Primary Key"))
                        .remediation("Tables without a primary key need REPLICA IDENTITY FULL for logical replication.")
                        .build(),

                Rule.builder("BG-4", "Check DDL event triggers")
                        .section(Section.BLUE_GREEN)
                        .scope(Scope.PER_DATABASE)
                        .severity(Severity.WARNING)
                        .probe(Probes.rowsPresent(CatalogQueries.DDL_EVENT_TRIGGERS,
                                (unit, rows) -> rows.size() + " DDL event trigger(s) found, may interfere with Blue/Green deployment"))
                        .remediation("DDL triggers may fire during CREATE SUBSCRIPTION on the green instance. "
                                + "Consider disabling the DDL triggers.")
                        .build(),

                Rule.builder("BG-5", "Check rds.logical_replication parameter")
                        .section(Section.BLUE_GREEN)
                        .probe(Probes.settingEquals("rds.logical_replication", "on",
                                current -> "rds.logical_replication is NOT enabled (current: " + current + ")"))
                        .remediation("Set rds.logical_replication=1 in the DB cluster parameter group and reboot.")
                        .build(),

                Rule.builder("BG-6", "Check for DTS trigger")
                        .section(Section.BLUE_GREEN)
                        .scope(Scope.PER_DATABASE)
                        .probe(Probes.rowsPresent(CatalogQueries.NAMED_EVENT_TRIGGER, CatalogQueries.DTS_CAPTURE_TRIGGER,
                                (unit, rows) -> "DTS trigger '" + CatalogQueries.DTS_CAPTURE_TRIGGER + "' found"))
                        .remediation("This trigger will cause Blue/Green deployment to fail. Drop it before upgrade: "
                                + CatalogQueries.DTS_CAPTURE_TRIGGER + "()")
                        .build()
        );
    }

    /**
     * One slot and one apply worker per database plus one spare. All four comparisons run,
     * each shortfall is its own finding.
     */
    static List<Finding> replicationCapacity(ProbeClient client, Rule rule, ScopeUnit unit) throws ProbeException {
        int slots = intSetting(client, rule, "max_replication_slots");
        int walSenders = intSetting(client, rule, "max_wal_senders");
        int logicalWorkers = intSetting(client, rule, "max_logical_replication_workers");
        int workerProcesses = intSetting(client, rule, "max_worker_processes");

        int requiredSlots = unit.sessionDatabaseCount() + 1;
        int requiredWorkers = unit.sessionDatabaseCount() + 1;

        List<Finding> out = new ArrayList<>();
        if (slots < requiredSlots) {
            out.add(Finding.err(rule.id(), unit,
                    "max_replication_slots (" + slots + ") < required (" + requiredSlots + ")"));
        }
        if (walSenders < slots) {
            out.add(Finding.err(rule.id(), unit,
                    "max_wal_senders (" + walSenders + ") < max_replication_slots (" + slots + ")"));
        }
        if (logicalWorkers < requiredWorkers) {
            out.add(Finding.err(rule.id(), unit,
                    "max_logical_replication_workers (" + logicalWorkers + ") < required (" + requiredWorkers + ")"));
        }
        if (workerProcesses <= logicalWorkers) {
            out.add(Finding.err(rule.id(), unit,
                    "max_worker_processes (" + workerProcesses + ") <= max_logical_replication_workers (" + logicalWorkers + ")"));
        }
        return out;
    }

    private static int intSetting(ProbeClient client, Rule rule, String name) throws ProbeException {
        String raw = client.showSetting(name);
        if (raw == null || raw.isBlank()) {
            throw new ProbeException(rule.id(), "Setting '" + name + "' could not be read");
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ProbeException(rule.id(), "Setting '" + name + "' is not numeric: " + raw, e);
        }
    }
}
