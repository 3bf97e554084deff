package com.xammer.guardrail.service;

import com.xammer.guardrail.domain.Exposure;
import com.xammer.guardrail.domain.FindingType;
import com.xammer.guardrail.domain.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Closed mapping from (finding type, exposure) to severity. Built once, checked
 * for totality, never consulted through conditional branches.
 */
public final class SeverityDecisionTable {

    private final Map<FindingType, Map<Exposure, Severity>> rules;

    private SeverityDecisionTable(Map<FindingType, Map<Exposure, Severity>> rules) {
        this.rules = rules;
    }

    public static SeverityDecisionTable defaults() {
        return builder()
                .rule(FindingType.PUBLIC_RESOURCE_EXPOSURE, Exposure.PRODUCTION, Severity.HIGH)
                .rule(FindingType.PUBLIC_RESOURCE_EXPOSURE, Exposure.UNSPECIFIED, Severity.HIGH)
                .rule(FindingType.PUBLIC_RESOURCE_EXPOSURE, Exposure.INTERNAL, Severity.MEDIUM)
                .rule(FindingType.OVER_PERMISSIVE_POLICY, Exposure.PRODUCTION, Severity.HIGH)
                .rule(FindingType.OVER_PERMISSIVE_POLICY, Exposure.UNSPECIFIED, Severity.MEDIUM)
                .rule(FindingType.OVER_PERMISSIVE_POLICY, Exposure.INTERNAL, Severity.MEDIUM)
                .rule(FindingType.UNUSED_ACCESS, Exposure.PRODUCTION, Severity.HIGH)
                .rule(FindingType.UNUSED_ACCESS, Exposure.UNSPECIFIED, Severity.MEDIUM)
                .rule(FindingType.UNUSED_ACCESS, Exposure.INTERNAL, Severity.LOW)
                .rule(FindingType.KEY_MISUSE, Exposure.PRODUCTION, Severity.HIGH)
                .rule(FindingType.KEY_MISUSE, Exposure.UNSPECIFIED, Severity.HIGH)
                .rule(FindingType.KEY_MISUSE, Exposure.INTERNAL, Severity.MEDIUM)
                .ruleForAllExposures(FindingType.UNRECOGNIZED, Severity.LOW)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Severity severityFor(FindingType type, Exposure exposure) {
        Map<Exposure, Severity> byExposure = rules.get(type);
        Severity severity = byExposure == null ? null : byExposure.get(exposure);
        if (severity == null) {
            throw new IllegalStateException("No severity rule for " + type + "/" + exposure);
        }
        return severity;
    }

    /** Every (type, exposure) pair with no rule. Empty for a valid table. */
    public List<String> missingRules() {
        List<String> missing = new ArrayList<>();
        for (FindingType type : FindingType.values()) {
            for (Exposure exposure : Exposure.values()) {
                Map<Exposure, Severity> byExposure = rules.get(type);
                if (byExposure == null || !byExposure.containsKey(exposure)) {
                    missing.add(type + "/" + exposure);
                }
            }
        }
        return Collections.unmodifiableList(missing);
    }

    public static final class Builder {

        private final Map<FindingType, Map<Exposure, Severity>> rules = new EnumMap<>(FindingType.class);

        private Builder() {
        }

        /**
         * Adds a rule. Repeating an identical rule is harmless; assigning a
         * different severity to a pair that already has one is rejected.
         */
        public Builder rule(FindingType type, Exposure exposure, Severity severity) {
            Map<Exposure, Severity> byExposure = rules.computeIfAbsent(type, t -> new EnumMap<>(Exposure.class));
            Severity existing = byExposure.putIfAbsent(exposure, severity);
            if (existing != null && existing != severity) {
                throw new IllegalStateException("Conflicting severity rules for " + type + "/" + exposure
                        + ": " + existing + " vs " + severity);
            }
            return this;
        }

        public Builder ruleForAllExposures(FindingType type, Severity severity) {
            for (Exposure exposure : Exposure.values()) {
                rule(type, exposure, severity);
            }
            return this;
        }

        public SeverityDecisionTable build() {
            Map<FindingType, Map<Exposure, Severity>> copy = new EnumMap<>(FindingType.class);
            rules.forEach((type, byExposure) -> copy.put(type, Collections.unmodifiableMap(new EnumMap<>(byExposure))));
            SeverityDecisionTable table = new SeverityDecisionTable(Collections.unmodifiableMap(copy));
            List<String> missing = table.missingRules();
            if (!missing.isEmpty()) {
                throw new IllegalStateException("Severity decision table is not total, missing " + missing);
            }
            return table;
        }
    }
}
