package com.xammer.guardrail.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only audit entry, one per finding or credential per invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RemediationOutcome {

    public static final String ALREADY_SATISFIED = "already-satisfied";
    public static final String MANUAL_REVIEW = "manual-review";
    public static final String WITHIN_THRESHOLD = "within-threshold";
    public static final String UNSUPPORTED_TARGET = "unsupported-target";

    private String findingId;
    private OutcomeSource source;
    private RemediationAction action;
    private String targetRef;
    private OutcomeResult result;
    private String reason;
    private int attempts;
    private Instant timestamp;
}
