package com.acme.pgprecheck.model;

import java.util.Objects;

// requirement doubles as the skip reason
public record VersionConstraint(String requirement, Test test) {

    @FunctionalInterface
    public interface Test {
        boolean allows(int sourceVersion, int targetVersion, boolean blueGreenRequested);
    }

    public VersionConstraint {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(test, "test");
    }

    public static VersionConstraint always() {
        return new VersionConstraint("any upgrade path", (s, t, bg) -> true);
    }

    public static VersionConstraint sourceAtMost(int version) {
        return new VersionConstraint("source version <= " + version, (s, t, bg) -> s <= version);
    }

    public static VersionConstraint sourceBelow(int version) {
        return new VersionConstraint("source version < " + version, (s, t, bg) -> s < version);
    }

    public static VersionConstraint targetAtLeast(int version) {
        return new VersionConstraint("target version >= " + version, (s, t, bg) -> t >= version);
    }

    public VersionConstraint and(VersionConstraint other) {
        return new VersionConstraint(requirement + " and " + other.requirement,
                (s, t, bg) -> test.allows(s, t, bg) && other.test.allows(s, t, bg));
    }

    public boolean allows(int sourceVersion, int targetVersion, boolean blueGreenRequested) {
        return test.allows(sourceVersion, targetVersion, blueGreenRequested);
    }

    @Override
    public String toString() { return requirement; }
}
