package com.xammer.guardrail.domain;

import java.util.Locale;
import java.util.Optional;

public enum FindingType {
    PUBLIC_RESOURCE_EXPOSURE,
    UNUSED_ACCESS,
    OVER_PERMISSIVE_POLICY,
    KEY_MISUSE,
    UNRECOGNIZED;

    /**
     * Matches a detector literal ignoring case and separators, so
     * "public-resource-exposure", "PUBLIC_RESOURCE_EXPOSURE" and
     * "publicResourceExposure" all resolve to the same constant.
     */
    public static Optional<FindingType> fromLiteral(String literal) {
        if (literal == null || literal.isBlank()) {
            return Optional.empty();
        }
        String key = squash(literal);
        for (FindingType type : values()) {
            if (type != UNRECOGNIZED && squash(type.name()).equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String squash(String value) {
        return value.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
    }
}
