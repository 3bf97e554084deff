package com.xammer.guardrail.domain;

/**
 * Deployment context of the affected resource, derived from its tags.
 * UNSPECIFIED means no recognised marker was present.
 */
public enum Exposure {
    PRODUCTION,
    UNSPECIFIED,
    INTERNAL
}
