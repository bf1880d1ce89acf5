package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.Finding;
import com.acme.pgprecheck.model.ScopeUnit;
import com.acme.pgprecheck.probe.ProbeQuery;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/** Reusable {@link RuleProbe} shapes. Every probe emits at most one finding per scope unit. */
public final class Probes {
    private Probes() {}

    @FunctionalInterface
    public interface Summarizer {
        String summarize(ScopeUnit unit, List<Map<String, Object>> rows);
    }

    /**
     * Any returned row is a finding, with the rows attached as evidence. The unit's target
     * (extension or type name), when present, is bound as the only query parameter.
     */
    public static RuleProbe rowsPresent(ProbeQuery query, Summarizer summarizer) {
        return (client, rule, unit) -> {
            Object[] params = unit.target() == null ? new Object[0] : new Object[] {unit.target()};
            List<Map<String, Object>> rows = client.rowsQuery(unit.databaseName(), query, params);
            if (rows == null || rows.isEmpty()) return List.of();
            return List.of(Finding.of(rule.id(), unit, rule.defaultSeverity(), summarizer.summarize(unit, rows), rows));
        };
    }

    /** Same as {@link #rowsPresent(ProbeQuery, Summarizer)} with a fixed bound parameter. */
    public static RuleProbe rowsPresent(ProbeQuery query, String param, Summarizer summarizer) {
        Objects.requireNonNull(param, "param");
        return (client, rule, unit) -> {
            List<Map<String, Object>> rows = client.rowsQuery(unit.databaseName(), query, param);
            if (rows == null || rows.isEmpty()) return List.of();
            return List.of(Finding.of(rule.id(), unit, rule.defaultSeverity(), summarizer.summarize(unit, rows), rows));
        };
    }

    /** A scalar result matching {@code failing} is a finding. A missing row reads as "0". */
    public static RuleProbe scalar(ProbeQuery query, Predicate<String> failing, Function<String, String> summary) {
        return (client, rule, unit) -> {
            String value = client.scalarQuery(unit.databaseName(), query);
            String v = value == null ? "0" : value.trim();
            if (!failing.test(v)) return List.of();
            return List.of(Finding.of(rule.id(), unit, rule.defaultSeverity(), summary.apply(v), null));
        };
    }

    /** The server setting must equal {@code expected} exactly; an unknown setting counts as a mismatch. */
    public static RuleProbe settingEquals(String setting, String expected, Function<String, String> summary) {
        return (client, rule, unit) -> {
            String value = client.showSetting(setting);
            if (expected.equals(value == null ? null : value.trim())) return List.of();
            return List.of(Finding.of(rule.id(), unit, rule.defaultSeverity(),
                    summary.apply(value == null || value.isBlank() ? "unknown" : value.trim()), null));
        };
    }

    static String column(List<Map<String, Object>> rows, String column) {
        Object v = rows.get(0).get(column);
        return v == null ? "" : v.toString();
    }
}
