package com.acme.pgprecheck.checks;

import com.acme.pgprecheck.model.Enums.Section;

import java.util.*;

/**
 * Ordered, duplicate-free list of rules. Catalog order is report order.
 */
public final class RuleCatalog {

    private static final RuleCatalog DEFAULT = new RuleCatalog(defaultRules());

    private final List<Rule> rules;
    private final Map<String, Rule> byId;

    public RuleCatalog(List<Rule> rules) {
        Map<String, Rule> index = new LinkedHashMap<>();
        for (Rule r : rules) {
            if (index.putIfAbsent(r.id(), r) != null) {
                throw new IllegalArgumentException("Duplicate rule id in catalog: " + r.id());
            }
        }
        this.rules = List.copyOf(rules);
        this.byId = Collections.unmodifiableMap(index);
    }

    public static RuleCatalog defaultCatalog() { return DEFAULT; }

    public List<Rule> rules() { return rules; }

    public Optional<Rule> find(String id) { return Optional.ofNullable(byId.get(id)); }

    public List<Rule> bySection(Section section) {
        List<Rule> out = new ArrayList<>();
        for (Rule r : rules) if (r.section() == section) out.add(r);
        return out;
    }

    public int size() { return rules.size(); }

    private static List<Rule> defaultRules() {
        List<Rule> all = new ArrayList<>();
        all.addAll(AuroraRdsRules.rules());
        all.addAll(EngineRules.rules());
        all.addAll(BlueGreenRules.rules());
        return all;
    }
}
