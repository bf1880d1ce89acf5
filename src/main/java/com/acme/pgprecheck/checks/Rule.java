/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: PostgreSQL Upgrade Precheck Tool
 */

package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.Enums.Scope;
import com.acme.pgprecheck.model.Enums.Section;
import com.acme.pgprecheck.model.Enums.Severity;
import com.acme.pgprecheck.model.VersionConstraint;

import java.util.List;
import java.util.Objects;

/**
 * Immutable catalog entry. Instances are built once when the catalog class loads and are
 * shared by all probe workers without synchronization.
 */
public final class Rule {

    private final String id;
    private final String title;
    private final Section section;
    private final Scope scope;
    private final VersionConstraint applicability;
    private final Severity defaultSeverity;
    private final RuleProbe probe;
    private final List<String> targets;
    private final String remediation;

    private Rule(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.title = Objects.requireNonNull(b.title, "title");
        this.section = Objects.requireNonNull(b.section, "section");
        this.scope = Objects.requireNonNull(b.scope, "scope");
        this.applicability = Objects.requireNonNull(b.applicability, "applicability");
        this.defaultSeverity = Objects.requireNonNull(b.defaultSeverity, "defaultSeverity");
        this.probe = Objects.requireNonNull(b.probe, "probe");
        this.targets = List.copyOf(b.targets);
        this.remediation = b.remediation == null ? "" : b.remediation;

        if (scope == Scope.PER_DATABASE_PER_TARGET && targets.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " fans out per target but declares no targets");
        }
        if (scope != Scope.PER_DATABASE_PER_TARGET && !targets.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " declares targets but scope is " + scope);
        }
    }

    public static Builder builder(String id, String title) {
        return new Builder(id, title);
    }

    public String id() { return id; }
    public String title() { return title; }
    public Section section() { return section; }
    public Scope scope() { return scope; }
    public VersionConstraint applicability() { return applicability; }
    public Severity defaultSeverity() { return defaultSeverity; }
    public RuleProbe probe() { return probe; }
    /** Fixed inner fan-out list (extension or type names); empty unless scope is PER_DATABASE_PER_TARGET. */
    public List<String> targets() { return targets; }
    public String remediation() { return remediation; }

    /** "A-1. check_for_prepared_transactions" */
    public String label() { return id + ". " + title; }

    @Override
    public String toString() {
        return "Rule{" + id + ", " + section + ", " + scope + ", " + defaultSeverity + ", applies when " + applicability + '}';
    }

    public static final class Builder {
        private final String id;
        private final String title;
        private Section section;
        private Scope scope = Scope.CLUSTER;
        private VersionConstraint applicability = VersionConstraint.always();
        private Severity defaultSeverity = Severity.ERROR;
        private RuleProbe probe;
        private List<String> targets = List.of();
        private String remediation;

        private Builder(String id, String title) {
            this.id = id;
            this.title = title;
        }

        public Builder section(Section section) {
            this.section = section;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder perTarget(List<String> targets) {
            this.scope = Scope.PER_DATABASE_PER_TARGET;
            this.targets = targets;
            return this;
        }

        public Builder appliesWhen(VersionConstraint applicability) {
            this.applicability = applicability;
            return this;
        }

        public Builder severity(Severity severity) {
            this.defaultSeverity = severity;
            return this;
        }

        public Builder probe(RuleProbe probe) {
            this.probe = probe;
            return this;
        }

        public Builder remediation(String remediation) {
            this.remediation = remediation;
            return this;
        }

        public Rule build() {
            return new Rule(this);
        }
    }
}
