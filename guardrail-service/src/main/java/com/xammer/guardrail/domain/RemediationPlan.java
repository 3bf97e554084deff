package com.xammer.guardrail.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * One plan per finding per pipeline pass. {@code action} is what the executor
 * will do; {@code recommendedAction} is what the policy table maps the finding
 * type to, which differs from {@code action} when the plan was downgraded to
 * manual review.
 */
@Getter
@Builder
@ToString
public class RemediationPlan {

    private final String findingId;
    private final RemediationAction action;
    private final RemediationAction recommendedAction;
    private final Severity severity;
    private final ResourceRef targetRef;
    private final List<String> guidance;
    private final Map<String, Object> attributes;

    public boolean isAutomatic() {
        return action != null && action.isMutating();
    }
}
