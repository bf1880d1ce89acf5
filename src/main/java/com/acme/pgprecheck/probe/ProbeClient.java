package com.acme.pgprecheck.probe;

import com.acme.pgprecheck.exceptions.ProbeException;

import java.util.List;
import java.util.Map;

/** Read-only access to the instance. A null database means the administrative database. */
public interface ProbeClient {

    String scalarQuery(String database, ProbeQuery probe, Object... params) throws ProbeException;

    List<Map<String, Object>> rowsQuery(String database, ProbeQuery probe, Object... params) throws ProbeException;

    /** Names of all non-template databases, before allowlist filtering. */
    List<String> listDatabases() throws ProbeException;

    // null when the server does not know the setting
    String showSetting(String name) throws ProbeException;
}
