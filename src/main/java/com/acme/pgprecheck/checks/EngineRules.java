package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.Enums.Scope;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.VersionConstraint;

import java.util.List;

/** Section 2: the data type and catalog checks pg_upgrade itself performs. */
public final class EngineRules {
    private EngineRules() {}

    static final List<String> REMOVED_TYPES = List.of("abstime", "reltime", "tinterval");

    private static final String DROP_COLUMNS = "Please drop the problem columns and try again.";

    public static List<Rule> rules() {
        return List.of(
                Rule.builder("E-1", "Checking for system-defined composite types in user tables")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .probe(Probes.rowsPresent(CatalogQueries.SYSTEM_COMPOSITE_TYPE_COLUMNS,
                                (unit, rows) -> "System-defined composite types in user tables (" + rows.size() + " column(s))"))
                        .remediation("These type OIDs are not stable across PostgreSQL versions. " + DROP_COLUMNS)
                        .build(),

                Rule.builder("E-2", "Checking for reg* data types in user tables")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .probe(Probes.rowsPresent(CatalogQueries.REG_TYPE_COLUMNS,
                                (unit, rows) -> "reg* data types in user tables (" + rows.size() + " column(s))"))
                        .remediation("These data types reference system OIDs that are not preserved by pg_upgrade. " + DROP_COLUMNS)
                        .build(),

                Rule.builder("E-3", "Checking for incompatible aclitem data type in user tables")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.sourceAtMost(15).and(VersionConstraint.targetAtLeast(16)))
                        .probe(Probes.rowsPresent(CatalogQueries.ACLITEM_COLUMNS,
                                (unit, rows) -> "'aclitem' data type found, format changed in PG 16"))
                        .remediation("The internal format of \"aclitem\" changed in PostgreSQL version 16. " + DROP_COLUMNS)
                        .build(),

                Rule.builder("E-4", "Checking for invalid sql_identifier user columns")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.sourceAtMost(11))
                        .probe(Probes.rowsPresent(CatalogQueries.SQL_IDENTIFIER_COLUMNS,
                                (unit, rows) -> "'sql_identifier' data type found, format changed in PG 12"))
                        .remediation("The on-disk format for this data type has changed. " + DROP_COLUMNS)
                        .build(),

                Rule.builder("E-5", "Checking for removed abstime & reltime & tinterval data type in user tables")
                        .section(Section.ENGINE_INTERNAL)
                        .perTarget(REMOVED_TYPES)
                        .appliesWhen(VersionConstraint.sourceAtMost(11))
                        .probe(Probes.rowsPresent(CatalogQueries.REMOVED_TYPE_COLUMNS,
                                (unit, rows) -> "Removed data type '" + unit.target() + "' found in user tables"))
                        .remediation("These types were removed in PostgreSQL version 12. "
                                + "Please drop the problem columns, or change them to another data type, and try again.")
                        .build(),

                Rule.builder("E-6", "Checking for user-defined encoding conversions")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.sourceAtMost(13))
                        .probe(Probes.rowsPresent(CatalogQueries.USER_ENCODING_CONVERSIONS,
                                (unit, rows) -> rows.size() + " user-defined encoding conversion(s) found"))
                        .remediation("The conversion function parameters changed in PostgreSQL version 14. "
                                + "Please remove the encoding conversions and try again.")
                        .build(),

                Rule.builder("E-7", "Checking for user-defined postfix operators")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.sourceAtMost(13))
                        .probe(Probes.rowsPresent(CatalogQueries.USER_POSTFIX_OPERATORS,
                                (unit, rows) -> rows.size() + " user-defined postfix operator(s) found"))
                        .remediation("Postfix operators are not supported anymore. Consider dropping them and "
                                + "replacing them with prefix operators or function calls.")
                        .build(),

                Rule.builder("E-8", "check_for_incompatible_polymorphics")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.sourceAtMost(13))
                        .probe(Probes.rowsPresent(CatalogQueries.INCOMPATIBLE_POLYMORPHICS,
                                (unit, rows) -> rows.size() + " user-defined object(s) refer to incompatible polymorphic functions"))
                        .remediation("Drop these objects before upgrading and restore them afterwards, changing them to refer "
                                + "to the new functions taking \"anycompatiblearray\" and \"anycompatible\".")
                        .build(),

                Rule.builder("E-9", "Checking for tables WITH OIDS")
                        .section(Section.ENGINE_INTERNAL)
                        .scope(Scope.PER_DATABASE)
                        .appliesWhen(VersionConstraint.sourceAtMost(11))
                        .probe(Probes.rowsPresent(CatalogQueries.TABLES_WITH_OIDS,
                                (unit, rows) -> rows.size() + " table(s) declared WITH OIDS found"))
                        .remediation("Remove the oid column using: ALTER TABLE ... SET WITHOUT OIDS;")
                        .build()
        );
    }
}
