package com.acme.pgprecheck.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A scope unit whose probe failed, so the rule could not be verified there. Never counted as a finding. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeError(String ruleId, String databaseName, String target, String message) {

    public static ProbeError of(String ruleId, ScopeUnit unit, String message) {
        return new ProbeError(ruleId, unit.databaseName(), unit.target(), message);
    }
}
