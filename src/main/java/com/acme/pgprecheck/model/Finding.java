package com.acme.pgprecheck.model;

import com.acme.pgprecheck.model.Enums.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One concrete incompatibility signal produced by a rule's probe for a single scope unit.
 * {@code databaseName} is null for cluster-wide rules, {@code target} is null unless the
 * rule fans out over extension or type names.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(String ruleId,
                      String databaseName,
                      String target,
                      Severity severity,
                      String summary,
                      List<Map<String, Object>> detailRows) {

    public Finding {
        detailRows = (detailRows == null || detailRows.isEmpty()) ? null : List.copyOf(detailRows);
    }

    public static Finding err(String ruleId, ScopeUnit unit, String summary) { return of(ruleId, unit, Severity.ERROR, summary, null); }
    public static Finding err(String ruleId, ScopeUnit unit, String summary, List<Map<String, Object>> rows) { return of(ruleId, unit, Severity.ERROR, summary, rows); }
    public static Finding warn(String ruleId, ScopeUnit unit, String summary) { return of(ruleId, unit, Severity.WARNING, summary, null); }
    public static Finding warn(String ruleId, ScopeUnit unit, String summary, List<Map<String, Object>> rows) { return of(ruleId, unit, Severity.WARNING, summary, rows); }

    public static Finding of(String ruleId, ScopeUnit unit, Severity severity, String summary, List<Map<String, Object>> rows) {
        return new Finding(ruleId, unit.databaseName(), unit.target(), severity, summary, rows);
    }
}
