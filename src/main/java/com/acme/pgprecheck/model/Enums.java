package com.acme.pgprecheck.model;

public final class Enums {
    private Enums() {}

    public enum Severity { ERROR, WARNING }

    public enum Scope { CLUSTER, PER_DATABASE, PER_DATABASE_PER_TARGET }

    public enum RuleStatus { OK, SKIPPED, FAILED, WARNED, UNVERIFIED }

    public enum Section {
        AURORA_RDS_PRECHECK("SECTION 1: Aurora/RDS Precheck (pg_upgrade_precheck.log)"),
        ENGINE_INTERNAL("SECTION 2: Engine Checks (pg_upgrade_internal.log)"),
        BLUE_GREEN("SECTION 3: Blue/Green Deployment Checks");

        private final String title;

        Section(String title) { this.title = title; }

        public String title() { return title; }
    }
}
