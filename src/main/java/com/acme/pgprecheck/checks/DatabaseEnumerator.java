package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.DatabaseRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns the raw database list of the instance into the probe set. System databases are
 * dropped silently; names outside the identifier allowlist are rejected and reported.
 */
public final class DatabaseEnumerator {

    private static final Logger log = LoggerFactory.getLogger(DatabaseEnumerator.class);

    static final Set<String> SYSTEM_DATABASES = Set.of("template0", "template1", "rdsadmin");

    private DatabaseEnumerator() {}

    public record Enumeration(List<DatabaseRef> databases, List<String> rejectedNames) {
        public Enumeration {
            databases = List.copyOf(databases);
            rejectedNames = List.copyOf(rejectedNames);
        }
    }

    public static Enumeration enumerate(Collection<String> rawNames) {
        SortedSet<DatabaseRef> accepted = new TreeSet<>();
        SortedSet<String> rejected = new TreeSet<>();
        if (rawNames != null) {
            for (String raw : rawNames) {
                if (raw == null || raw.isBlank()) continue;
                if (SYSTEM_DATABASES.contains(raw)) continue;
                if (DatabaseRef.isValidName(raw)) {
                    accepted.add(new DatabaseRef(raw));
                } else {
                    rejected.add(raw);
                }
            }
        }
        for (String name : rejected) log.warn("Skipping invalid database name: {}", name);
        return new Enumeration(new ArrayList<>(accepted), new ArrayList<>(rejected));
    }
}
