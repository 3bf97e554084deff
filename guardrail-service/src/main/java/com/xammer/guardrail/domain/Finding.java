package com.xammer.guardrail.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A detected identity/access issue. Read-only once normalized.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Finding {

    private final String id;
    private final FindingType type;
    /** Type literal exactly as the detector sent it. */
    private final String rawType;
    private final ResourceRef resourceRef;
    private final Instant detectedAt;
    private final Map<String, Object> rawAttributes;

    @Builder
    private Finding(String id, FindingType type, String rawType, ResourceRef resourceRef,
                    Instant detectedAt, Map<String, Object> rawAttributes) {
        this.id = id;
        this.type = type;
        this.rawType = rawType;
        this.resourceRef = resourceRef;
        this.detectedAt = detectedAt;
        this.rawAttributes = rawAttributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rawAttributes));
    }
}
