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

import com.acme.pgprecheck.model.Enums.Scope;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.Enums.Severity;
import com.acme.pgprecheck.model.VersionConstraint;

import java.util.List;

/** Section 1: the checks Aurora/RDS runs before handing over to pg_upgrade. */
public final class AuroraRdsRules {
    private AuroraRdsRules() {}

    static final List<String> MULTI_VERSION_EXTENSIONS = List.of(
            "postgis", "pgrouting", "postgis_raster", "postgis_tiger_geocoder",
            "postgis_topology", "address_standardizer", "address_standardizer_data_us", "rdkit");

    public static List<Rule> rules() {
        return List.of(
                Rule.builder("A-1", "check_for_prepared_transactions")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .probe(Probes.rowsPresent(CatalogQueries.PREPARED_TRANSACTIONS,
                                (unit, rows) -> rows.size() + " uncommitted prepared transaction(s) exist"))
                        .remediation("Please commit or rollback all prepared transactions and try again.")
                        .build(),

                Rule.builder("A-2", "check_database_not_allow_connect")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .probe(Probes.rowsPresent(CatalogQueries.DATABASES_NOT_ALLOWING_CONNECTIONS,
                                (unit, rows) -> "Database connection settings error: " + rows.size()
                                        + " database(s) do not allow connections"))
                        .remediation("Please ensure all non-template0 databases allow connections and try again.")
                        .build(),

                Rule.builder("A-3", "check_template_0_and_template1")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .probe(Probes.scalar(CatalogQueries.TEMPLATE_DATABASE_COUNT,
                                v -> !"2".equals(v),
                                v -> "template1 and template0 are invalid (found " + v + " of 2 with datistemplate = true)"))
                        .remediation("Make sure that template1 and template0 exist and have datistemplate set to 't'.")
                        .build(),

                Rule.builder("A-4", "check_for_invalid_database")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .probe(Probes.rowsPresent(CatalogQueries.INVALID_DATABASES,
                                (unit, rows) -> rows.size() + " invalid database(s) found (datconnlimit = -2)"))
                        .remediation("Remove the invalid databases with 'DROP DATABASE' and try again.")
                        .build(),

                Rule.builder("A-5", "check_for_replication_slots")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .appliesWhen(VersionConstraint.sourceBelow(17))
                        .probe(Probes.rowsPresent(CatalogQueries.REPLICATION_SLOTS,
                                (unit, rows) -> rows.size() + " replication slot(s) exist and must be dropped before upgrade"))
                        .remediation("Please drop all replication slots and try again.")
                        .build(),

                Rule.builder("A-6", "check_chkpass_extension")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.targetAtLeast(11))
                        .probe(Probes.rowsPresent(CatalogQueries.INSTALLED_EXTENSION, "chkpass",
                                (unit, rows) -> "chkpass extension installed, not supported in PG >= 11"))
                        .remediation("This extension is not supported in the target version. Please drop the extension and try again.")
                        .build(),

                Rule.builder("A-7", "check_tsearch2_extension")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.targetAtLeast(11))
                        .probe(Probes.rowsPresent(CatalogQueries.INSTALLED_EXTENSION, "tsearch2",
                                (unit, rows) -> "tsearch2 extension installed, not supported in PG >= 11"))
                        .remediation("This extension is not supported in the target version. Please drop the extension and try again.")
                        .build(),

                Rule.builder("A-8", "check_pg_repack_extension")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.targetAtLeast(14))
                        .probe(Probes.rowsPresent(CatalogQueries.INSTALLED_EXTENSION, "pg_repack",
                                (unit, rows) -> "pg_repack " + Probes.column(rows, "extversion")
                                        + " installed, must be dropped before upgrade to PG >= 14"))
                        .remediation("Drop the extension and try again.")
                        .build(),

                Rule.builder("A-9", "check_for_multi_extensions_version")
                        .section(Section.AURORA_RDS_PRECHECK)
                        .perTarget(MULTI_VERSION_EXTENSIONS)
                        .severity(Severity.WARNING)
                        .probe(Probes.rowsPresent(CatalogQueries.OUTDATED_EXTENSION,
                                (unit, rows) -> unit.target() + " installed: " + Probes.column(rows, "installed_version")
                                        + ", available: " + Probes.column(rows, "default_version")))
                        .remediation("You can either drop the extension or upgrade the extension and try the upgrade again.")
                        .build()
        );
    }
}
