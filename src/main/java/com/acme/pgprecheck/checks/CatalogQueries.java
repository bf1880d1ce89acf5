package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.probe.ProbeQuery;

/**
 * Read-only system catalog queries behind every rule.
 *
 * <p>The type-usage probes mirror pg_upgrade's own checks: a recursive walk from a set of
 * seed types through domains, arrays, composites and ranges, reporting every user column
 * that ends up depending on one of them.
 */
public final class CatalogQueries {
    private CatalogQueries() {}

    // ---------------- Aurora/RDS precheck ----------------

    public static final ProbeQuery PREPARED_TRANSACTIONS = new ProbeQuery("prepared_transactions", """
            SELECT gid, prepared::text AS prepared, owner, database
            FROM pg_catalog.pg_prepared_xacts
            ORDER BY gid
            """);

    public static final ProbeQuery DATABASES_NOT_ALLOWING_CONNECTIONS = new ProbeQuery("databases_not_allowing_connections", """
            SELECT datname
            FROM pg_catalog.pg_database
            WHERE datname <> 'template0'
              AND NOT datallowconn
            ORDER BY datname
            """);

    public static final ProbeQuery TEMPLATE_DATABASE_COUNT = new ProbeQuery("template_database_count", """
            SELECT count(*)
            FROM pg_catalog.pg_database
            WHERE datistemplate
              AND datname IN ('template0', 'template1')
            """);

    public static final ProbeQuery INVALID_DATABASES = new ProbeQuery("invalid_databases", """
            SELECT datname
            FROM pg_catalog.pg_database
            WHERE datconnlimit = -2
            ORDER BY datname
            """);

    public static final ProbeQuery REPLICATION_SLOTS = new ProbeQuery("replication_slots", """
            SELECT slot_name, plugin, slot_type, database, active
            FROM pg_catalog.pg_replication_slots
            ORDER BY slot_name
            """);

    public static final ProbeQuery INSTALLED_EXTENSION = new ProbeQuery("installed_extension", """
            SELECT extname, extversion
            FROM pg_catalog.pg_extension
            WHERE extname = ?
            """);

    public static final ProbeQuery OUTDATED_EXTENSION = new ProbeQuery("outdated_extension", """
            SELECT name, installed_version, default_version
            FROM pg_catalog.pg_available_extensions
            WHERE name = ?
              AND installed_version IS NOT NULL
              AND default_version <> installed_version
            """);

    // ---------------- engine (pg_upgrade) checks ----------------

    public static final ProbeQuery SYSTEM_COMPOSITE_TYPE_COLUMNS = typeUsage("system_composite_type_columns", """
            SELECT t.oid
            FROM pg_catalog.pg_type t
            LEFT JOIN pg_catalog.pg_namespace n ON t.typnamespace = n.oid
            WHERE typtype = 'c'
              AND (t.oid < 16384 OR nspname = 'information_schema')""");

    public static final ProbeQuery REG_TYPE_COLUMNS = typeUsage("reg_type_columns", """
            SELECT oid
            FROM pg_catalog.pg_type t
            WHERE t.typnamespace = (SELECT oid FROM pg_catalog.pg_namespace WHERE nspname = 'pg_catalog')
              AND t.typname IN ('regcollation', 'regconfig', 'regdictionary', 'regnamespace',
                                'regoper', 'regoperator', 'regproc', 'regprocedure')""");

    public static final ProbeQuery ACLITEM_COLUMNS = typeUsage("aclitem_columns",
            "SELECT 'pg_catalog.aclitem'::pg_catalog.regtype AS oid");

    public static final ProbeQuery SQL_IDENTIFIER_COLUMNS = typeUsage("sql_identifier_columns",
            "SELECT 'information_schema.sql_identifier'::pg_catalog.regtype AS oid");

    /** Parameter 1: the pg_catalog type name. */
    public static final ProbeQuery REMOVED_TYPE_COLUMNS = typeUsage("removed_type_columns",
            "SELECT ('pg_catalog.' || ?::text)::pg_catalog.regtype AS oid");

    public static final ProbeQuery USER_ENCODING_CONVERSIONS = new ProbeQuery("user_encoding_conversions", """
            SELECT c.oid::text AS conoid, c.conname, n.nspname
            FROM pg_catalog.pg_conversion c, pg_catalog.pg_namespace n
            WHERE c.connamespace = n.oid
              AND c.oid >= 16384
            ORDER BY n.nspname, c.conname
            """);

    public static final ProbeQuery USER_POSTFIX_OPERATORS = new ProbeQuery("user_postfix_operators", """
            SELECT o.oid::text AS oproid, n.nspname AS oprnsp, o.oprname, tn.nspname AS typnsp, t.typname
            FROM pg_catalog.pg_operator o,
                 pg_catalog.pg_namespace n,
                 pg_catalog.pg_type t,
                 pg_catalog.pg_namespace tn
            WHERE o.oprnamespace = n.oid
              AND o.oprleft = t.oid
              AND t.typnamespace = tn.oid
              AND o.oprright = 0
              AND o.oid >= 16384
            ORDER BY n.nspname, o.oprname
            """);

    private static final String OLD_POLYMORPHICS = "ARRAY['array_append(anyarray,anyelement)', "
            + "'array_cat(anyarray,anyarray)', 'array_prepend(anyelement,anyarray)', "
            + "'array_remove(anyarray,anyelement)', 'array_replace(anyarray,anyelement,anyelement)', "
            + "'array_position(anyarray,anyelement)', 'array_position(anyarray,anyelement,integer)', "
            + "'array_positions(anyarray,anyelement)', 'width_bucket(anyelement,anyarray)']::pg_catalog.regprocedure[]";

    public static final ProbeQuery INCOMPATIBLE_POLYMORPHICS = new ProbeQuery("incompatible_polymorphics",
            "SELECT 'aggregate' AS objkind, p.oid::pg_catalog.regprocedure::text AS objname "
            + "FROM pg_catalog.pg_proc AS p "
            + "JOIN pg_catalog.pg_aggregate AS a ON a.aggfnoid = p.oid "
            + "JOIN pg_catalog.pg_proc AS transfn ON transfn.oid = a.aggtransfn "
            + "WHERE p.oid >= 16384 AND a.aggtransfn = ANY(" + OLD_POLYMORPHICS + ") "
            + "AND a.aggtranstype = ANY(ARRAY['anyarray', 'anyelement']::pg_catalog.regtype[]) "
            + "UNION ALL "
            + "SELECT 'aggregate' AS objkind, p.oid::pg_catalog.regprocedure::text AS objname "
            + "FROM pg_catalog.pg_proc AS p "
            + "JOIN pg_catalog.pg_aggregate AS a ON a.aggfnoid = p.oid "
            + "JOIN pg_catalog.pg_proc AS finalfn ON finalfn.oid = a.aggfinalfn "
            + "WHERE p.oid >= 16384 AND a.aggfinalfn = ANY(" + OLD_POLYMORPHICS + ") "
            + "AND a.aggtranstype = ANY(ARRAY['anyarray', 'anyelement']::pg_catalog.regtype[]) "
            + "UNION ALL "
            + "SELECT 'operator' AS objkind, op.oid::pg_catalog.regoperator::text AS objname "
            + "FROM pg_catalog.pg_operator AS op "
            + "WHERE op.oid >= 16384 AND oprcode = ANY(" + OLD_POLYMORPHICS + ") "
            + "AND oprleft = ANY(ARRAY['anyarray', 'anyelement']::pg_catalog.regtype[])");

    // relhasoids only exists up to PostgreSQL 11; the rule is gated accordingly
    public static final ProbeQuery TABLES_WITH_OIDS = new ProbeQuery("tables_with_oids", """
            SELECT n.nspname, c.relname
            FROM pg_catalog.pg_class c, pg_catalog.pg_namespace n
            WHERE c.relnamespace = n.oid
              AND c.relhasoids
              AND n.nspname NOT IN ('pg_catalog')
            ORDER BY n.nspname, c.relname
            """);

    // ---------------- blue/green deployment ----------------

    // subconninfo is left out on purpose: it may carry a password
    public static final ProbeQuery SUBSCRIPTIONS = new ProbeQuery("subscriptions", """
            SELECT subname, subslotname, subenabled
            FROM pg_catalog.pg_subscription
            ORDER BY subname
            """);

    public static final ProbeQuery TABLES_WITHOUT_PRIMARY_KEY = new ProbeQuery("tables_without_primary_key", """
            SELECT n.nspname AS schema, c.relname AS table_name,
                   CASE c.relreplident
                        WHEN 'd' THEN 'DEFAULT'
                        WHEN 'n' THEN 'NOTHING'
                        WHEN 'f' THEN 'FULL'
                        WHEN 'i' THEN 'INDEX'
                   END AS replica_identity
            FROM pg_catalog.pg_class c
            JOIN pg_catalog.pg_namespace n ON c.relnamespace = n.oid
            WHERE c.relkind = 'r'
              AND n.nspname NOT IN ('pg_catalog', 'information_schema', 'pg_toast', 'rdsadmin')
              AND NOT EXISTS (
                  SELECT 1 FROM pg_catalog.pg_constraint con
                  WHERE con.conrelid = c.oid AND con.contype = 'p'
              )
            ORDER BY n.nspname, c.relname
            """);

    public static final String DTS_CAPTURE_TRIGGER = "dts_capture_catalog_start";

    public static final ProbeQuery DDL_EVENT_TRIGGERS = new ProbeQuery("ddl_event_triggers", """
            SELECT evtname AS trigger_name,
                   evtevent AS event,
                   evtfoid::pg_catalog.regproc::text AS function_name,
                   evtenabled::text AS enabled
            FROM pg_catalog.pg_event_trigger
            WHERE evtevent IN ('ddl_command_start', 'ddl_command_end', 'sql_drop')
              AND evtname <> 'dts_capture_catalog_start'
            ORDER BY evtname
            """);

    public static final ProbeQuery NAMED_EVENT_TRIGGER = new ProbeQuery("named_event_trigger", """
            SELECT evtname
            FROM pg_catalog.pg_event_trigger
            WHERE evtname = ?
            """);

    static ProbeQuery typeUsage(String id, String seedTypes) {
        return new ProbeQuery(id, "WITH RECURSIVE oids AS (\n"
                + seedTypes + "\n"
                + "UNION ALL\n"
                + "SELECT * FROM (\n"
                + "    WITH x AS (SELECT oid FROM oids)\n"
                + "    SELECT t.oid FROM pg_catalog.pg_type t, x WHERE typbasetype = x.oid AND typtype = 'd'\n"
                + "    UNION ALL\n"
                + "    SELECT t.oid FROM pg_catalog.pg_type t, x WHERE typelem = x.oid AND typtype = 'b'\n"
                + "    UNION ALL\n"
                + "    SELECT t.oid FROM pg_catalog.pg_type t, pg_catalog.pg_class c, pg_catalog.pg_attribute a, x\n"
                + "    WHERE t.typtype = 'c' AND t.oid = c.reltype AND c.oid = a.attrelid\n"
                + "      AND NOT a.attisdropped AND a.atttypid = x.oid\n"
                + "    UNION ALL\n"
                + "    SELECT t.oid FROM pg_catalog.pg_type t, pg_catalog.pg_range r, x\n"
                + "    WHERE t.typtype = 'r' AND r.rngtypid = t.oid AND r.rngsubtype = x.oid\n"
                + ") foo\n"
                + ")\n"
                + "SELECT n.nspname, c.relname, a.attname\n"
                + "FROM pg_catalog.pg_class c, pg_catalog.pg_namespace n, pg_catalog.pg_attribute a\n"
                + "WHERE c.oid = a.attrelid\n"
                + "  AND NOT a.attisdropped\n"
                + "  AND a.atttypid IN (SELECT oid FROM oids)\n"
                + "  AND c.relkind IN ('r', 'm', 'i')\n"
                + "  AND c.relnamespace = n.oid\n"
                + "  AND n.nspname !~ '^pg_temp_'\n"
                + "  AND n.nspname !~ '^pg_toast_temp_'\n"
                + "  AND n.nspname NOT IN ('pg_catalog', 'information_schema')\n"
                + "ORDER BY n.nspname, c.relname, a.attname");
    }
}
