package com.acme.pgprecheck.probe;

import java.util.Objects;

/**
 * Fixed, read-only catalog query identified by a stable id. Variable parts (extension or
 * type names) are bound as JDBC parameters ({@code ?}), never spliced into {@code sql}.
 */
public record ProbeQuery(String id, String sql) {

    public ProbeQuery {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sql, "sql");
    }

    @Override
    public String toString() { return id; }
}
