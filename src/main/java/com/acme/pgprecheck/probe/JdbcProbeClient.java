package com.acme.pgprecheck.probe;

import com.acme.pgprecheck.PrecheckContext;
import com.acme.pgprecheck.config.PrecheckConfig;
import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.model.DatabaseRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * {@link ProbeClient} over the PostgreSQL JDBC driver. Every call opens its own read-only
 * connection and closes it when done, so concurrent probes never share a session.
 */
public final class JdbcProbeClient implements ProbeClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcProbeClient.class);

    static final ProbeQuery LIST_DATABASES = new ProbeQuery("list_databases",
            "SELECT datname FROM pg_catalog.pg_database WHERE NOT datistemplate ORDER BY datname");

    // missing_ok = true: unknown custom settings (rds.*) read as NULL instead of failing
    static final ProbeQuery SHOW_SETTING = new ProbeQuery("show_setting",
            "SELECT pg_catalog.current_setting(?, true)");

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final PrecheckConfig config;

    public JdbcProbeClient(PrecheckContext ctx, String password, PrecheckConfig config) {
        this.host = ctx.host;
        this.port = ctx.port;
        this.user = ctx.user;
        this.password = password;
        this.config = config;
    }

    @Override
    public String scalarQuery(String database, ProbeQuery probe, Object... params) throws ProbeException {
        try (Connection conn = connect(database);
             PreparedStatement st = prepare(conn, probe, params);
             ResultSet rs = st.executeQuery()) {
            if (rs.next()) {
                Object v = rs.getObject(1);
                return v == null ? null : v.toString();
            }
            return null;
        } catch (SQLException e) {
            throw failure(database, probe, e);
        }
    }

    @Override
    public List<Map<String, Object>> rowsQuery(String database, ProbeQuery probe, Object... params) throws ProbeException {
        try (Connection conn = connect(database);
             PreparedStatement st = prepare(conn, probe, params);
             ResultSet rs = st.executeQuery()) {
            ResultSetMetaData md = rs.getMetaData();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= md.getColumnCount(); i++) {
                    row.put(md.getColumnLabel(i), plain(rs.getObject(i)));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException e) {
            throw failure(database, probe, e);
        }
    }

    @Override
    public List<String> listDatabases() throws ProbeException {
        List<String> names = new ArrayList<>();
        for (Map<String, Object> row : rowsQuery(null, LIST_DATABASES)) {
            Object v = row.get("datname");
            if (v != null) names.add(v.toString());
        }
        return names;
    }

    @Override
    public String showSetting(String name) throws ProbeException {
        return scalarQuery(null, SHOW_SETTING, name);
    }

    private Connection connect(String database) throws SQLException {
        String db = database == null ? config.adminDatabase() : database;
        if (database != null && !DatabaseRef.isValidName(database)) {
            throw new IllegalArgumentException("Refusing to connect to non-allowlisted database name: " + database);
        }

        Properties props = new Properties();
        props.setProperty("user", user);
        props.setProperty("password", password);
        props.setProperty("sslmode", config.sslMode());
        props.setProperty("connectTimeout", String.valueOf(config.connectTimeout().toSeconds()));
        props.setProperty("socketTimeout", String.valueOf(config.probeTimeout().toSeconds() + 5));
        props.setProperty("readOnly", "true");
        props.setProperty("ApplicationName", "pg-upgrade-precheck");

        log.debug("Connecting to {}:{}/{}", host, port, db);
        return DriverManager.getConnection("jdbc:postgresql://" + host + ":" + port + "/" + db, props);
    }

    private PreparedStatement prepare(Connection conn, ProbeQuery probe, Object... params) throws SQLException {
        PreparedStatement st = conn.prepareStatement(probe.sql());
        try {
            st.setQueryTimeout((int) Math.max(1, config.probeTimeout().toSeconds()));
            for (int i = 0; i < params.length; i++) st.setObject(i + 1, params[i]);
            return st;
        } catch (SQLException e) {
            st.close();
            throw e;
        }
    }

    private static ProbeException failure(String database, ProbeQuery probe, SQLException e) {
        String where = database == null ? "cluster" : "database '" + database + "'";
        return new ProbeException(probe.id(), "Query failed on " + where + ": " + e.getMessage(), e);
    }

    static Object plain(Object v) {
        if (v == null || v instanceof String || v instanceof Number || v instanceof Boolean) return v;
        return v.toString();
    }
}
