package com.acme.pgprecheck.model;

/**
 * One indivisible probe target: the whole cluster ({@code database == null}), a single
 * database, or a (database, named object) pair. {@code sessionDatabaseCount} is the size of
 * the session's database set, which cluster rules such as replication capacity depend on.
 */
public record ScopeUnit(DatabaseRef database, String target, int sessionDatabaseCount) {

    public static ScopeUnit cluster(int sessionDatabaseCount) { return new ScopeUnit(null, null, sessionDatabaseCount); }

    public static ScopeUnit database(DatabaseRef db, int sessionDatabaseCount) { return new ScopeUnit(db, null, sessionDatabaseCount); }

    public static ScopeUnit target(DatabaseRef db, String target, int sessionDatabaseCount) { return new ScopeUnit(db, target, sessionDatabaseCount); }

    public String databaseName() { return database == null ? null : database.name(); }

    public boolean isCluster() { return database == null; }

    public String label() {
        if (database == null) return "cluster";
        return target == null ? database.name() : database.name() + "/" + target;
    }
}
