package com.acme.pgprecheck.model;

import java.util.regex.Pattern;

/**
 * A database name that passed the identifier allowlist. Only instances of this type are
 * ever used to open a per-database probe connection.
 */
public record DatabaseRef(String name) implements Comparable<DatabaseRef> {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z0-9_-]+$");

    public DatabaseRef {
        if (!isValidName(name)) throw new IllegalArgumentException("Invalid database name: " + name);
    }

    public static boolean isValidName(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    @Override
    public int compareTo(DatabaseRef o) { return name.compareTo(o.name); }

    @Override
    public String toString() { return name; }
}
